package com.phillippitts.pingwatch.util;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One-shot cooperative cancellation signal shared by the tasks of a monitoring or trace run.
 *
 * <p>Tasks poll {@link #isCancelled()}, sleep through {@link #await(Duration)} (which wakes
 * as soon as the signal fires) and register callbacks for resources that must be released
 * on cancellation, such as a running subprocess.
 *
 * <p><b>Thread Safety:</b> all methods are thread-safe. Callbacks run exactly once, on the
 * thread that calls {@link #cancel()}, or immediately on the registering thread when the
 * signal has already fired.
 *
 * @since 1.0
 */
public final class CancellationSignal {

    private static final Logger LOG = LogManager.getLogger(CancellationSignal.class);

    private final Lock lock = new ReentrantLock();
    private final CountDownLatch fired = new CountDownLatch(1);
    private final List<Runnable> callbacks = new ArrayList<>();
    private boolean cancelled;

    /**
     * Handle returned by {@link #register(Runnable)}; closing it removes the callback.
     */
    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }

    /**
     * Creates a signal that also fires when {@code parent} fires. The returned registration
     * detaches the child from the parent and must be closed when the child's run ends.
     *
     * @param parent signal to piggyback on
     * @param child signal to cancel together with the parent
     * @return registration that unlinks the two signals
     */
    public static Registration link(CancellationSignal parent, CancellationSignal child) {
        Objects.requireNonNull(parent, "parent");
        Objects.requireNonNull(child, "child");
        return parent.register(child::cancel);
    }

    /**
     * Fires the signal. Only the first call runs the registered callbacks.
     *
     * @return {@code true} if this call fired the signal, {@code false} if it had already fired
     */
    public boolean cancel() {
        List<Runnable> toRun;
        lock.lock();
        try {
            if (cancelled) {
                return false;
            }
            cancelled = true;
            toRun = new ArrayList<>(callbacks);
            callbacks.clear();
        } finally {
            lock.unlock();
        }
        fired.countDown();
        for (Runnable callback : toRun) {
            runCallback(callback);
        }
        return true;
    }

    public boolean isCancelled() {
        return fired.getCount() == 0;
    }

    /**
     * Registers a callback to run on cancellation. Runs it immediately if the signal
     * already fired.
     *
     * @param callback action to run once
     * @return registration whose {@code close()} removes the callback
     */
    public Registration register(Runnable callback) {
        Objects.requireNonNull(callback, "callback");
        lock.lock();
        try {
            if (!cancelled) {
                callbacks.add(callback);
                return () -> unregister(callback);
            }
        } finally {
            lock.unlock();
        }
        runCallback(callback);
        return () -> { };
    }

    /**
     * Waits until the signal fires or the timeout elapses.
     *
     * @param timeout maximum time to wait
     * @return {@code true} if the signal fired, {@code false} if the timeout elapsed first
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public boolean await(Duration timeout) throws InterruptedException {
        return fired.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void unregister(Runnable callback) {
        lock.lock();
        try {
            callbacks.remove(callback);
        } finally {
            lock.unlock();
        }
    }

    private static void runCallback(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            LOG.warn("Cancellation callback failed: {}", e.toString());
        }
    }
}
