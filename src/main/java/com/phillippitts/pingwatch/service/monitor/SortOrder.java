package com.phillippitts.pingwatch.service.monitor;

/**
 * Sort currently applied to the disruption log.
 *
 * @param field sorted field
 * @param direction sort direction
 */
public record SortOrder(DisruptionSortField field, SortDirection direction) {
}
