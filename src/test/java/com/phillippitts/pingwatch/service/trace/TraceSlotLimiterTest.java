package com.phillippitts.pingwatch.service.trace;

import com.phillippitts.pingwatch.util.CancellationSignal;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class TraceSlotLimiterTest {

    @Test
    void rejectsNonPositiveCapacity() {
        assertThatThrownBy(() -> new TraceSlotLimiter(0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void acquireAndReleaseTrackPermits() throws Exception {
        TraceSlotLimiter limiter = new TraceSlotLimiter(2);
        CancellationSignal signal = new CancellationSignal();

        assertThat(limiter.acquire(signal)).isTrue();
        assertThat(limiter.acquire(signal)).isTrue();
        assertThat(limiter.availablePermits()).isZero();

        limiter.release();
        assertThat(limiter.availablePermits()).isEqualTo(1);
        assertThat(limiter.capacity()).isEqualTo(2);
    }

    @Test
    void cancelledSignalNeverAcquires() throws Exception {
        TraceSlotLimiter limiter = new TraceSlotLimiter(1);
        CancellationSignal signal = new CancellationSignal();
        signal.cancel();

        assertThat(limiter.acquire(signal)).isFalse();
        assertThat(limiter.availablePermits()).isEqualTo(1);
    }

    @Test
    void waiterIsReleasedByCancellation() throws Exception {
        TraceSlotLimiter limiter = new TraceSlotLimiter(1);
        CancellationSignal signal = new CancellationSignal();
        assertThat(limiter.acquire(signal)).isTrue();

        CompletableFuture<Boolean> waiter = CompletableFuture.supplyAsync(() -> {
            try {
                return limiter.acquire(signal);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return null;
            }
        });
        await().during(Duration.ofMillis(150)).atMost(Duration.ofSeconds(1)).until(() -> !waiter.isDone());

        signal.cancel();

        assertThat(waiter.get(2, TimeUnit.SECONDS)).isFalse();
        assertThat(limiter.availablePermits()).isZero();
    }

    @Test
    void waiterGetsSlotOnRelease() throws Exception {
        TraceSlotLimiter limiter = new TraceSlotLimiter(1);
        CancellationSignal signal = new CancellationSignal();
        limiter.acquire(signal);

        CompletableFuture<Boolean> waiter = CompletableFuture.supplyAsync(() -> {
            try {
                return limiter.acquire(signal);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return null;
            }
        });
        limiter.release();

        assertThat(waiter.get(2, TimeUnit.SECONDS)).isTrue();
    }
}
