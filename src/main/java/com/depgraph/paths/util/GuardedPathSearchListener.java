package com.depgraph.paths.util;

import com.depgraph.paths.api.PathSearchListener;
import lombok.extern.log4j.Log4j2;

/**
 * Wraps a {@link PathSearchListener} so that nothing it throws can reach the
 * search that called it. Failures are logged through an
 * {@link ErrorRateLimiter} and otherwise ignored; only a
 * {@link VirtualMachineError} is rethrown.
 */
@Log4j2
public final class GuardedPathSearchListener implements PathSearchListener {
    private static final long LOG_INTERVAL_MILLIS = 5_000;

    private final PathSearchListener delegate;
    private final ErrorRateLimiter errors = new ErrorRateLimiter(log, LOG_INTERVAL_MILLIS);

    private GuardedPathSearchListener(PathSearchListener delegate) {
        this.delegate = delegate;
    }

    /** Returns {@code listener} guarded, without wrapping twice. */
    public static PathSearchListener guard(PathSearchListener listener) {
        if (listener == null)
            return PathSearchListener.NONE;
        if (listener == PathSearchListener.NONE || listener instanceof GuardedPathSearchListener)
            return listener;
        return new GuardedPathSearchListener(listener);
    }

    private static void rethrowFatal(Throwable t) {
        if (t instanceof VirtualMachineError vme)
            throw vme;
    }

    @Override
    public void onSelection(int rootCount, int destinationCount) {
        try {
            delegate.onSelection(rootCount, destinationCount);
        } catch (Throwable e) {
            rethrowFatal(e);
            errors.warn("Progress listener failed in onSelection", e);
        }
    }

    @Override
    public void onRootLoading(String root) {
        try {
            delegate.onRootLoading(root);
        } catch (Throwable e) {
            rethrowFatal(e);
            errors.warn("Progress listener failed in onRootLoading", e);
        }
    }

    @Override
    public void onClosureResolved(String root, int closureSize) {
        try {
            delegate.onClosureResolved(root, closureSize);
        } catch (Throwable e) {
            rethrowFatal(e);
            errors.warn("Progress listener failed in onClosureResolved", e);
        }
    }

    @Override
    public void onFanOut(String root, int destinationCount) {
        try {
            delegate.onFanOut(root, destinationCount);
        } catch (Throwable e) {
            rethrowFatal(e);
            errors.warn("Progress listener failed in onFanOut", e);
        }
    }

    @Override
    public void onSearchStart(String root, String destination) {
        try {
            delegate.onSearchStart(root, destination);
        } catch (Throwable e) {
            rethrowFatal(e);
            errors.warn("Progress listener failed in onSearchStart", e);
        }
    }

    @Override
    public void onEdgeProgress(String root, String destination, int pathsFound, long edgesVisited) {
        try {
            delegate.onEdgeProgress(root, destination, pathsFound, edgesVisited);
        } catch (Throwable e) {
            rethrowFatal(e);
            errors.warn("Progress listener failed in onEdgeProgress", e);
        }
    }

    @Override
    public void onPathMilestone(String root, String destination, int pathsFound) {
        try {
            delegate.onPathMilestone(root, destination, pathsFound);
        } catch (Throwable e) {
            rethrowFatal(e);
            errors.warn("Progress listener failed in onPathMilestone", e);
        }
    }
}
