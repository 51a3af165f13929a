package com.phillippitts.pingwatch.service.monitor.event;

import com.phillippitts.pingwatch.domain.TargetSnapshot;

import java.time.Instant;

/**
 * Emitted after every probe result has been applied to a target.
 *
 * @param snapshot target state after the probe
 * @param timestamp when the probe result was applied
 */
public record TargetUpdatedEvent(
        TargetSnapshot snapshot,
        Instant timestamp
) {}
