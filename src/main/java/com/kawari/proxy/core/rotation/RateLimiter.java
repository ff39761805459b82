package com.kawari.proxy.core.rotation;

import com.kawari.proxy.core.exceptions.RateLimitTimeoutException;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongConsumer;

/**
 * Global admission gate enforcing a minimum spacing between dispatches.
 * Admissions are serialized through a fair lock: the caller holding it waits out the
 * remaining interval and stamps its admission time before releasing, so no two
 * admissions are ever closer than {@code 1 / rate} seconds.
 */
public class RateLimiter {
    private final long intervalNanos;
    private final Duration maxWait;
    private final LongConsumer admissionListener;
    private final ReentrantLock lock = new ReentrantLock(true);
    private long lastAdmissionNanos;
    private boolean admittedBefore;

    /**
     * @param requestsPerSecond rate ceiling, or {@code null} for no limit.
     * @param maxWait           longest a caller may wait, or {@code null} to wait indefinitely.
     */
    public RateLimiter(Double requestsPerSecond, Duration maxWait) {
        this(requestsPerSecond, maxWait, stamp -> { });
    }

    /**
     * @param admissionListener receives each admission's {@link System#nanoTime()} stamp while the lock is held.
     */
    RateLimiter(Double requestsPerSecond, Duration maxWait, LongConsumer admissionListener) {
        if (requestsPerSecond != null && !(requestsPerSecond > 0)) {
            throw new IllegalArgumentException("Rate limit must be positive: " + requestsPerSecond);
        }
        // Saturates at Long.MAX_VALUE for vanishingly small rates.
        this.intervalNanos = requestsPerSecond == null ? 0 : (long) Math.ceil(1_000_000_000d / requestsPerSecond);
        this.maxWait = maxWait;
        this.admissionListener = admissionListener;
    }

    public static RateLimiter unlimited() {
        return new RateLimiter(null, null);
    }

    public boolean isLimited() {
        return intervalNanos > 0;
    }

    /**
     * Blocks until the caller may proceed. Returns immediately when no limit is configured.
     *
     * @throws InterruptedException      if interrupted while waiting.
     * @throws RateLimitTimeoutException if the wait would exceed the configured maximum.
     */
    public void acquire() throws InterruptedException {
        if (intervalNanos == 0) {
            return;
        }
        long start = System.nanoTime();
        if (maxWait == null) {
            lock.lockInterruptibly();
        } else if (!lock.tryLock(maxWait.toNanos(), TimeUnit.NANOSECONDS)) {
            throw new RateLimitTimeoutException(Duration.ofNanos(System.nanoTime() - start), maxWait);
        }
        try {
            long now = System.nanoTime();
            if (admittedBefore) {
                // Elapsed time is never negative, so interval minus elapsed cannot overflow.
                long waitNanos = intervalNanos - (now - lastAdmissionNanos);
                long waitedNanos = now - start;
                if (maxWait != null && waitNanos > maxWait.toNanos() - waitedNanos) {
                    throw new RateLimitTimeoutException(Duration.ofNanos(waitNanos).plusNanos(waitedNanos), maxWait);
                }
                while (waitNanos > 0) {
                    TimeUnit.NANOSECONDS.sleep(waitNanos);
                    now = System.nanoTime();
                    waitNanos = intervalNanos - (now - lastAdmissionNanos);
                }
            }
            lastAdmissionNanos = now;
            admittedBefore = true;
            admissionListener.accept(now);
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return minimum spacing between admissions, zero when unlimited.
     */
    public Duration getInterval() {
        return Duration.ofNanos(intervalNanos);
    }
}
