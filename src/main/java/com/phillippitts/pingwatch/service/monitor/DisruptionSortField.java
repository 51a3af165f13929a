package com.phillippitts.pingwatch.service.monitor;

import com.phillippitts.pingwatch.domain.DisruptionEvent;
import com.phillippitts.pingwatch.domain.StatisticsSnapshot;

import java.util.Comparator;

/**
 * Closed set of disruption log columns that can be sorted, each with its own comparator.
 *
 * <p>Comparators work on a {@link SortView} that captures an event's post-recovery
 * statistics once per sort, so an open event refreshed by its probe loop mid-sort cannot
 * make the ordering inconsistent.
 */
public enum DisruptionSortField {

    ADDRESS(Comparator.comparing((SortView v) -> v.event().getAddress(), String.CASE_INSENSITIVE_ORDER)),
    HOST(Comparator.comparing((SortView v) -> v.event().getHostLabel(), String.CASE_INSENSITIVE_ORDER)),
    DOWN_START(Comparator.comparing((SortView v) -> v.event().getDownStart())),
    RECOVERY_TIME(Comparator.comparing((SortView v) -> v.event().getRecoveryTime())),
    FAILURE_COUNT(Comparator.comparingInt((SortView v) -> v.event().getFailureCount())),
    DURATION(Comparator.comparing((SortView v) -> v.event().getDuration())),
    PRE_AVERAGE(Comparator.comparingDouble((SortView v) -> v.event().getPreDown().average())),
    POST_AVERAGE(Comparator.comparingDouble((SortView v) -> v.postRecovery().average()));

    private final Comparator<SortView> comparator;

    DisruptionSortField(Comparator<SortView> comparator) {
        this.comparator = comparator;
    }

    Comparator<SortView> comparator(SortDirection direction) {
        return direction == SortDirection.ASCENDING ? comparator : comparator.reversed();
    }

    /**
     * An event paired with the post-recovery statistics it had when the sort started.
     */
    record SortView(DisruptionEvent event, StatisticsSnapshot postRecovery) {
        static SortView of(DisruptionEvent event) {
            return new SortView(event, event.getPostRecovery());
        }
    }
}
