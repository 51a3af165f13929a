package com.phillippitts.pingwatch.service.trace.event;

import com.phillippitts.pingwatch.service.trace.TraceOutcome;

import java.util.UUID;

/**
 * Emitted once per address when its terminal trailer is written.
 *
 * @param runId trace run
 * @param address traced address
 * @param outcome completed or stopped by user
 */
public record TraceTerminatedEvent(
        UUID runId,
        String address,
        TraceOutcome outcome
) {}
