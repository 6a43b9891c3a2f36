package com.depgraph.paths.util;

import com.depgraph.paths.api.PathSearchListener;
import com.depgraph.paths.testutil.RecordingListener;
import org.apache.logging.log4j.LogManager;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class GuardedPathSearchListenerTest {

    private static final class ExplodingListener implements PathSearchListener {
        int calls;

        @Override
        public void onRootLoading(String root) {
            calls++;
            throw new IllegalStateException("boom");
        }

        @Override
        public void onEdgeProgress(String root, String destination, int pathsFound, long edgesVisited) {
            calls++;
            throw new UnsupportedOperationException("boom");
        }
    }

    @Test
    public void testGuardNullIsNone() {
        assertSame(PathSearchListener.NONE, GuardedPathSearchListener.guard(null));
        assertSame(PathSearchListener.NONE, GuardedPathSearchListener.guard(PathSearchListener.NONE));
    }

    @Test
    public void testGuardIsNotAppliedTwice() {
        PathSearchListener once = GuardedPathSearchListener.guard(new RecordingListener());
        assertSame(once, GuardedPathSearchListener.guard(once));
    }

    @Test
    public void testDelegatesCallbacks() {
        RecordingListener recording = new RecordingListener();
        PathSearchListener guarded = GuardedPathSearchListener.guard(recording);

        guarded.onSelection(2, 3);
        guarded.onFanOut("A", 3);
        guarded.onPathMilestone("A", "B", 100);

        assertEquals(3, recording.events().size());
        assertEquals("selection 2 3", recording.events().get(0));
        assertEquals("milestone A B 100", recording.events().get(2));
    }

    @Test
    public void testSwallowsListenerFailures() {
        ExplodingListener exploding = new ExplodingListener();
        PathSearchListener guarded = GuardedPathSearchListener.guard(exploding);

        for (int i = 0; i < 10; i++) {
            guarded.onRootLoading("A");
            guarded.onEdgeProgress("A", "B", 0, i);
        }
        assertEquals(20, exploding.calls);
    }

    @Test
    public void testSwallowsErrorsFromListener() {
        RecordingListener recording = new RecordingListener();
        PathSearchListener guarded = GuardedPathSearchListener.guard(new PathSearchListener() {
            @Override
            public void onPathMilestone(String root, String destination, int pathsFound) {
                throw new AssertionError("listener error");
            }

            @Override
            public void onSearchStart(String root, String destination) {
                recording.onSearchStart(root, destination);
            }
        });

        guarded.onPathMilestone("A", "B", 1);
        guarded.onSearchStart("A", "B");
        assertEquals(List.of("searchStart A B"), recording.events());
    }

    @Test(expected = OutOfMemoryError.class)
    public void testVirtualMachineErrorsPassThrough() {
        PathSearchListener guarded = GuardedPathSearchListener.guard(new PathSearchListener() {
            @Override
            public void onFanOut(String root, int destinationCount) {
                throw new OutOfMemoryError("simulated");
            }
        });
        guarded.onFanOut("A", 1);
    }

    @Test
    public void testErrorRateLimiterSuppressesWithinInterval() {
        ErrorRateLimiter limiter = new ErrorRateLimiter(LogManager.getLogger(getClass()), 60_000);
        RuntimeException failure = new RuntimeException("failure");

        assertTrue(limiter.warn("first", failure));
        assertFalse(limiter.warn("second", failure));
        assertFalse(limiter.warn("third", failure));
        assertEquals(2, limiter.suppressedCount());
    }

    @Test
    public void testErrorRateLimiterLogsAgainAfterInterval() throws InterruptedException {
        ErrorRateLimiter limiter = new ErrorRateLimiter(LogManager.getLogger(getClass()), 1);
        assertTrue(limiter.warn("first", null));
        Thread.sleep(5);
        assertTrue(limiter.warn("second", null));
        assertEquals(0, limiter.suppressedCount());
    }
}
