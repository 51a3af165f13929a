package com.phillippitts.pingwatch.service.monitor;

import com.phillippitts.pingwatch.domain.DisruptionEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Shared, append-only log of disruption episodes across all targets.
 *
 * <p>Events are kept in creation order (the moment of recovery) until the log is sorted.
 * Every probe loop appends here, so appends are serialized; readers get immutable copies.
 *
 * <p>Sorting follows the usual column-header behaviour: sorting again by the same field
 * flips the direction, a different field starts ascending. Sorting is stable.
 *
 * <p>Single events are never removed. {@link #clear()} is the explicit bulk reset used when
 * a new monitoring run starts or the user clears the session.
 */
@Component
public class DisruptionEventLog {

    private static final Logger LOG = LogManager.getLogger(DisruptionEventLog.class);

    private final Lock lock = new ReentrantLock();
    private final List<DisruptionEvent> events = new ArrayList<>();
    private SortOrder currentSort;

    /**
     * Appends a newly created event.
     *
     * @param event event created at a target's recovery
     */
    public void append(DisruptionEvent event) {
        Objects.requireNonNull(event, "event");
        lock.lock();
        try {
            events.add(event);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Sorts by {@code field}; toggles the direction when the log is already sorted by it,
     * otherwise sorts ascending.
     *
     * @param field column to sort by
     * @return the applied sort order
     */
    public SortOrder sortBy(DisruptionSortField field) {
        Objects.requireNonNull(field, "field");
        lock.lock();
        try {
            SortDirection direction = currentSort != null && currentSort.field() == field
                    ? currentSort.direction().toggle()
                    : SortDirection.ASCENDING;
            return applySort(field, direction);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Sorts by {@code field} in an explicit direction.
     *
     * @param field column to sort by
     * @param direction sort direction
     * @return the applied sort order
     */
    public SortOrder sortBy(DisruptionSortField field, SortDirection direction) {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(direction, "direction");
        lock.lock();
        try {
            return applySort(field, direction);
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return immutable copy of the events in their current order
     */
    public List<DisruptionEvent> snapshot() {
        lock.lock();
        try {
            return List.copyOf(events);
        } finally {
            lock.unlock();
        }
    }

    public Optional<SortOrder> currentSort() {
        lock.lock();
        try {
            return Optional.ofNullable(currentSort);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return events.size();
        } finally {
            lock.unlock();
        }
    }

    /** Removes every event and forgets the current sort. */
    public void clear() {
        lock.lock();
        try {
            int removed = events.size();
            events.clear();
            currentSort = null;
            LOG.debug("Disruption log cleared ({} events)", removed);
        } finally {
            lock.unlock();
        }
    }

    private SortOrder applySort(DisruptionSortField field, SortDirection direction) {
        List<DisruptionSortField.SortView> views = new ArrayList<>(events.size());
        for (DisruptionEvent event : events) {
            views.add(DisruptionSortField.SortView.of(event));
        }
        // List.sort is a stable merge sort
        views.sort(field.comparator(direction));
        events.clear();
        for (DisruptionSortField.SortView view : views) {
            events.add(view.event());
        }
        currentSort = new SortOrder(field, direction);
        return currentSort;
    }
}
