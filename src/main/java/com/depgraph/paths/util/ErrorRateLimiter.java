package com.depgraph.paths.util;

import org.apache.logging.log4j.Logger;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Limits how often the same kind of failure is logged.
 * Failures raised from inside a search loop can repeat thousands of times per
 * second; only the first one per interval is written, together with the
 * number of occurrences that were suppressed since the previous entry.
 */
public class ErrorRateLimiter {
    private final Logger logger;
    private final long minIntervalNanos;
    private final AtomicLong lastLogTime;
    private final AtomicLong suppressed = new AtomicLong();

    public ErrorRateLimiter(Logger logger, long minIntervalMillis) {
        this.logger = logger;
        this.minIntervalNanos = minIntervalMillis * 1_000_000;
        // first call always logs
        this.lastLogTime = new AtomicLong(System.nanoTime() - minIntervalNanos - 1);
    }

    /**
     * Logs {@code message} at WARN unless another failure was already logged
     * within the interval.
     *
     * @return true if the message was written.
     */
    public boolean warn(String message, Throwable t) {
        long now = System.nanoTime();
        long last = lastLogTime.get();
        if (now - last > minIntervalNanos && lastLogTime.compareAndSet(last, now)) {
            long skipped = suppressed.getAndSet(0);
            if (skipped > 0)
                logger.warn("{} ({} similar failures suppressed)", message, skipped, t);
            else
                logger.warn(message, t);
            return true;
        }
        suppressed.incrementAndGet();
        return false;
    }

    /** Number of failures swallowed since the last written entry. */
    public long suppressedCount() {
        return suppressed.get();
    }
}
