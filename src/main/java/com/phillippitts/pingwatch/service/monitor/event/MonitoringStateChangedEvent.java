package com.phillippitts.pingwatch.service.monitor.event;

import com.phillippitts.pingwatch.domain.MonitoringState;

import java.time.Instant;

/**
 * Emitted when the monitoring session changes state.
 *
 * @param previous state before the transition
 * @param current state after the transition
 * @param timestamp when the transition happened
 */
public record MonitoringStateChangedEvent(
        MonitoringState previous,
        MonitoringState current,
        Instant timestamp
) {}
