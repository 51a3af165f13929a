package com.phillippitts.pingwatch.domain;

import java.time.Instant;

/**
 * Summary of the current (or last) monitoring session.
 *
 * @param state session lifecycle state
 * @param startedAt start of the session, null when idle
 * @param stoppedAt end of the session, null unless stopped
 * @param intervalMs probe interval used by the session
 * @param timeoutMs probe timeout used by the session
 * @param targetCount number of targets in the session
 */
public record MonitoringSessionInfo(
        MonitoringState state,
        Instant startedAt,
        Instant stoppedAt,
        long intervalMs,
        long timeoutMs,
        int targetCount
) {
}
