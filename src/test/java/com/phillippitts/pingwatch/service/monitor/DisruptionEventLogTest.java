package com.phillippitts.pingwatch.service.monitor;

import com.phillippitts.pingwatch.domain.DisruptionEvent;
import com.phillippitts.pingwatch.domain.StatisticsSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DisruptionEventLogTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private DisruptionEventLog log;
    private DisruptionEvent a;
    private DisruptionEvent b;
    private DisruptionEvent c;

    @BeforeEach
    void setUp() {
        log = new DisruptionEventLog();
        a = event("10.0.0.3", "gamma", 0, 30, 3, 12.0);
        b = event("10.0.0.1", "alpha", 10, 15, 5, 40.0);
        c = event("10.0.0.2", "beta", 20, 80, 5, 8.0);
        log.append(a);
        log.append(b);
        log.append(c);
    }

    private static DisruptionEvent event(String address, String host, long downOffset, long recoveryOffset,
                                         int failures, double postAvg) {
        return new DisruptionEvent(address, host, T0.plusSeconds(downOffset), T0.plusSeconds(recoveryOffset),
                failures, StatisticsSnapshot.EMPTY, new StatisticsSnapshot(postAvg, 1, 100, 99, 0.0, 0.0));
    }

    @Test
    void snapshotKeepsCreationOrderUntilSorted() {
        assertThat(log.snapshot()).containsExactly(a, b, c);
        assertThat(log.currentSort()).isEmpty();
        assertThat(log.size()).isEqualTo(3);
    }

    @Test
    void sortingByNewFieldStartsAscending() {
        SortOrder order = log.sortBy(DisruptionSortField.ADDRESS);

        assertThat(order).isEqualTo(new SortOrder(DisruptionSortField.ADDRESS, SortDirection.ASCENDING));
        assertThat(log.snapshot()).containsExactly(b, c, a);
    }

    @Test
    void reselectingSameFieldTogglesDirection() {
        log.sortBy(DisruptionSortField.DURATION);
        assertThat(log.snapshot()).containsExactly(b, a, c);

        SortOrder order = log.sortBy(DisruptionSortField.DURATION);

        assertThat(order.direction()).isEqualTo(SortDirection.DESCENDING);
        assertThat(log.snapshot()).containsExactly(c, a, b);

        assertThat(log.sortBy(DisruptionSortField.DURATION).direction()).isEqualTo(SortDirection.ASCENDING);
    }

    @Test
    void switchingFieldResetsToAscending() {
        log.sortBy(DisruptionSortField.HOST);
        log.sortBy(DisruptionSortField.HOST);

        SortOrder order = log.sortBy(DisruptionSortField.POST_AVERAGE);

        assertThat(order.direction()).isEqualTo(SortDirection.ASCENDING);
        assertThat(log.snapshot()).containsExactly(c, a, b);
    }

    @Test
    void sortIsStableForEqualKeys() {
        // b and c share failure count 5 and keep their relative order
        log.sortBy(DisruptionSortField.FAILURE_COUNT);
        assertThat(log.snapshot()).containsExactly(a, b, c);

        log.sortBy(DisruptionSortField.FAILURE_COUNT, SortDirection.DESCENDING);
        assertThat(log.snapshot()).containsExactly(b, c, a);
    }

    @Test
    void explicitDirectionOverridesToggle() {
        log.sortBy(DisruptionSortField.RECOVERY_TIME, SortDirection.DESCENDING);
        assertThat(log.snapshot()).containsExactly(c, a, b);

        log.sortBy(DisruptionSortField.RECOVERY_TIME, SortDirection.DESCENDING);
        assertThat(log.snapshot()).containsExactly(c, a, b);
        assertThat(log.currentSort()).contains(
                new SortOrder(DisruptionSortField.RECOVERY_TIME, SortDirection.DESCENDING));
    }

    @Test
    void clearRemovesEventsAndSort() {
        log.sortBy(DisruptionSortField.DOWN_START);

        log.clear();

        assertThat(log.size()).isZero();
        assertThat(log.snapshot()).isEmpty();
        assertThat(log.currentSort()).isEmpty();
    }

    @Test
    void snapshotIsImmutable() {
        List<DisruptionEvent> snapshot = log.snapshot();

        assertThatThrownBy(() -> snapshot.add(a)).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void concurrentAppendsAreAllKept() throws Exception {
        log.clear();
        int threads = 8;
        int perThread = 250;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        for (int t = 0; t < threads; t++) {
            String address = "10.0.1." + t;
            pool.submit(() -> {
                start.await();
                for (int i = 0; i < perThread; i++) {
                    log.append(event(address, "h", i, i + 1, 1, 1.0));
                    if (i % 50 == 0) {
                        log.sortBy(DisruptionSortField.DOWN_START, SortDirection.ASCENDING);
                    }
                }
                return null;
            });
        }
        start.countDown();
        pool.shutdown();
        assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        assertThat(log.size()).isEqualTo(threads * perThread);
    }
}
