package com.phillippitts.pingwatch.service.monitor;

/**
 * Direction of a disruption log sort.
 */
public enum SortDirection {
    ASCENDING,
    DESCENDING;

    public SortDirection toggle() {
        return this == ASCENDING ? DESCENDING : ASCENDING;
    }
}
