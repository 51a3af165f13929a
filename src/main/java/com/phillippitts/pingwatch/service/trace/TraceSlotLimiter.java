package com.phillippitts.pingwatch.service.trace;

import com.phillippitts.pingwatch.util.CancellationSignal;
import com.phillippitts.pingwatch.util.ProcessTimeouts;

import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Caps the number of trace subprocesses alive at the same time.
 *
 * <p>Waiting for a slot is bounded only by cancellation: the limiter polls the run's
 * {@link CancellationSignal} between short {@link Semaphore#tryAcquire(long, TimeUnit)}
 * attempts, so a stopped run never leaves tasks parked on the semaphore.
 *
 * <p><b>Thread Safety:</b> This class is thread-safe. The underlying {@link Semaphore}
 * handles concurrent acquire/release operations safely.
 *
 * <p><b>Usage Pattern:</b>
 * <pre>{@code
 * if (limiter.acquire(signal)) {
 *     try {
 *         // ... run one trace ...
 *     } finally {
 *         limiter.release();
 *     }
 * }
 * }</pre>
 */
public final class TraceSlotLimiter {

    private final Semaphore semaphore;
    private final int capacity;

    /**
     * @param capacity maximum number of concurrently held slots
     * @throws IllegalArgumentException if capacity is not positive
     */
    public TraceSlotLimiter(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.semaphore = new Semaphore(capacity, true);
    }

    /**
     * Blocks until a slot is free or the signal fires.
     *
     * @param signal cancellation signal of the run
     * @return {@code true} if a slot was acquired (caller must {@link #release()} it),
     *         {@code false} if the run was cancelled first
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public boolean acquire(CancellationSignal signal) throws InterruptedException {
        long pollMs = ProcessTimeouts.CANCELLATION_POLL_INTERVAL.toMillis();
        while (!signal.isCancelled()) {
            if (semaphore.tryAcquire(pollMs, TimeUnit.MILLISECONDS)) {
                if (signal.isCancelled()) {
                    semaphore.release();
                    return false;
                }
                return true;
            }
        }
        return false;
    }

    public void release() {
        semaphore.release();
    }

    public int capacity() {
        return capacity;
    }

    /**
     * Returns the number of available permits.
     *
     * @return number of permits currently available
     */
    public int availablePermits() {
        return semaphore.availablePermits();
    }
}
