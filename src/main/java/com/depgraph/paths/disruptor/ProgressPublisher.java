package com.depgraph.paths.disruptor;

import com.depgraph.paths.api.PathSearchListener;
import com.depgraph.paths.util.GuardedPathSearchListener;
import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.EventHandler;
import com.lmax.disruptor.LifecycleAware;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.lmax.disruptor.util.DaemonThreadFactory;
import lombok.extern.log4j.Log4j2;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A {@link PathSearchListener} that hands every callback to a single consumer
 * thread through an LMAX Disruptor ring buffer.
 *
 * <h3>Workflow</h3>
 * <ol>
 * <li>Search threads (many producers) call the listener methods, which
 * translate the callback into a {@link ProgressEvent} slot.</li>
 * <li>Publishing uses {@code tryPublishEvent}: when the buffer is full the
 * notification is dropped and counted instead of waiting for space.</li>
 * <li>The consumer thread replays each event on the delegate listener, so
 * the delegate sees callbacks one at a time.</li>
 * </ol>
 *
 * <p>
 * The constructor returns once the consumer thread is running, so
 * {@link #close()} always sees, and drains, what is already in the buffer.
 */
@Log4j2
public final class ProgressPublisher implements PathSearchListener, AutoCloseable {
    public static final int DEFAULT_BUFFER_SIZE = 1024;
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;

    private final Disruptor<ProgressEvent> disruptor;
    private final RingBuffer<ProgressEvent> ringBuffer;
    private final AtomicLong dropped = new AtomicLong();
    private volatile boolean closed;

    public ProgressPublisher(PathSearchListener delegate) {
        this(delegate, DEFAULT_BUFFER_SIZE);
    }

    /**
     * @param delegate   Listener invoked on the consumer thread.
     * @param bufferSize Ring buffer capacity, a power of two.
     */
    public ProgressPublisher(PathSearchListener delegate, int bufferSize) {
        if (bufferSize <= 0 || Integer.bitCount(bufferSize) != 1)
            throw new IllegalArgumentException("Buffer size must be a power of 2: " + bufferSize);

        this.disruptor = new Disruptor<>(
                ProgressEvent::new,
                bufferSize,
                DaemonThreadFactory.INSTANCE,
                ProducerType.MULTI,
                new BlockingWaitStrategy());
        ProgressEventHandler handler = new ProgressEventHandler(GuardedPathSearchListener.guard(delegate));
        disruptor.handleEventsWith(handler);
        this.ringBuffer = disruptor.start();
        handler.awaitStart();
    }

    /** Notifications lost because the buffer was full or already closed. */
    public long droppedCount() {
        return dropped.get();
    }

    private void publish(ProgressEvent.Type type, String root, String destination, int count, long secondary) {
        if (closed || !ringBuffer.tryPublishEvent((event, sequence) -> event.set(type, root, destination, count,
                secondary)))
            dropped.incrementAndGet();
    }

    @Override
    public void onSelection(int rootCount, int destinationCount) {
        publish(ProgressEvent.Type.SELECTION, null, null, rootCount, destinationCount);
    }

    @Override
    public void onRootLoading(String root) {
        publish(ProgressEvent.Type.ROOT_LOADING, root, null, 0, 0);
    }

    @Override
    public void onClosureResolved(String root, int closureSize) {
        publish(ProgressEvent.Type.CLOSURE_RESOLVED, root, null, closureSize, 0);
    }

    @Override
    public void onFanOut(String root, int destinationCount) {
        publish(ProgressEvent.Type.FAN_OUT, root, null, destinationCount, 0);
    }

    @Override
    public void onSearchStart(String root, String destination) {
        publish(ProgressEvent.Type.SEARCH_START, root, destination, 0, 0);
    }

    @Override
    public void onEdgeProgress(String root, String destination, int pathsFound, long edgesVisited) {
        publish(ProgressEvent.Type.EDGE_PROGRESS, root, destination, pathsFound, edgesVisited);
    }

    @Override
    public void onPathMilestone(String root, String destination, int pathsFound) {
        publish(ProgressEvent.Type.PATH_MILESTONE, root, destination, pathsFound, 0);
    }

    @Override
    public void close() {
        if (closed)
            return;
        closed = true;
        try {
            disruptor.shutdown(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            log.warn("Progress consumer did not drain within {}s, halting", SHUTDOWN_TIMEOUT_SECONDS);
            disruptor.halt();
        }
        long lost = dropped.get();
        if (lost > 0)
            log.debug("{} progress notifications dropped", lost);
    }

    /** Consumer side: replays events on the delegate and releases the slot. */
    private static final class ProgressEventHandler implements EventHandler<ProgressEvent>, LifecycleAware {
        private final PathSearchListener delegate;
        private final CountDownLatch started = new CountDownLatch(1);

        ProgressEventHandler(PathSearchListener delegate) {
            this.delegate = delegate;
        }

        // shutdown() only waits for a backlog once the processor is running
        void awaitStart() {
            try {
                if (!started.await(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS))
                    log.warn("Progress consumer did not start within {}s", SHUTDOWN_TIMEOUT_SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        @Override
        public void onStart() {
            started.countDown();
        }

        @Override
        public void onShutdown() {
        }

        @Override
        public void onEvent(ProgressEvent event, long sequence, boolean endOfBatch) {
            event.dispatchTo(delegate);
            event.clear();
        }
    }
}
