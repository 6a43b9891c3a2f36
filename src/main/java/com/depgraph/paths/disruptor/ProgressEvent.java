package com.depgraph.paths.disruptor;

import com.depgraph.paths.api.PathSearchListener;

/**
 * A mutable progress notification, used within the LMAX Disruptor RingBuffer.
 *
 * <p>
 * <b>Flyweight Pattern:</b> Instances are pre-allocated during RingBuffer
 * construction and reused for every notification published through the
 * buffer.
 *
 * <p>
 * <b>Fields:</b>
 * <ul>
 * <li>{@code type}: Which {@link PathSearchListener} callback to replay.</li>
 * <li>{@code root}, {@code destination}: The pair concerned (either may be
 * null for callbacks that do not carry it).</li>
 * <li>{@code count}: Closure size, destination count, paths found or root
 * count, depending on {@code type}.</li>
 * <li>{@code secondaryCount}: Edges visited or destination count, depending
 * on {@code type}.</li>
 * </ul>
 */
public final class ProgressEvent {

    public enum Type {
        SELECTION,
        ROOT_LOADING,
        CLOSURE_RESOLVED,
        FAN_OUT,
        SEARCH_START,
        EDGE_PROGRESS,
        PATH_MILESTONE
    }

    private Type type;
    private String root;
    private String destination;
    private int count;
    private long secondaryCount;

    public void set(Type type, String root, String destination, int count, long secondaryCount) {
        this.type = type;
        this.root = root;
        this.destination = destination;
        this.count = count;
        this.secondaryCount = secondaryCount;
    }

    /** Replays this notification on {@code listener}. */
    public void dispatchTo(PathSearchListener listener) {
        switch (type) {
            case SELECTION -> listener.onSelection(count, (int) secondaryCount);
            case ROOT_LOADING -> listener.onRootLoading(root);
            case CLOSURE_RESOLVED -> listener.onClosureResolved(root, count);
            case FAN_OUT -> listener.onFanOut(root, count);
            case SEARCH_START -> listener.onSearchStart(root, destination);
            case EDGE_PROGRESS -> listener.onEdgeProgress(root, destination, count, secondaryCount);
            case PATH_MILESTONE -> listener.onPathMilestone(root, destination, count);
        }
    }

    public void clear() {
        type = null;
        root = null;
        destination = null;
        count = 0;
        secondaryCount = 0;
    }
}
