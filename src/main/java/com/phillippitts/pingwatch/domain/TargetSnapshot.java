package com.phillippitts.pingwatch.domain;

import java.time.Duration;

/**
 * Immutable per-probe copy of a monitored target's display state.
 *
 * <p>Published after every probe and returned by queries; consumers build their own view
 * models from it and never touch the live target.
 *
 * @param sequence display order
 * @param address probed address
 * @param hostLabel label shown next to the address
 * @param status reachability state
 * @param statusLabel display label: "OK", "Recovered" (first success after a disruption), "Down" or ""
 * @param sendCount probes sent
 * @param failCount probes failed
 * @param consecutiveFailCount failures since the last success
 * @param currentDownDuration length of the ongoing disruption, {@link Duration#ZERO} while up
 * @param maxDisruptionDuration longest disruption observed so far
 * @param currentRtt RTT of the most recent probe, 0 on failure
 * @param session statistics of the current up session
 * @param intervalMs delay between probes
 * @param timeoutMs probe timeout
 * @param traceSelected whether the target takes part in the next trace run
 */
public record TargetSnapshot(
        int sequence,
        String address,
        String hostLabel,
        TargetStatus status,
        String statusLabel,
        long sendCount,
        long failCount,
        int consecutiveFailCount,
        Duration currentDownDuration,
        Duration maxDisruptionDuration,
        long currentRtt,
        StatisticsSnapshot session,
        long intervalMs,
        long timeoutMs,
        boolean traceSelected
) {

    public long successCount() {
        return sendCount - failCount;
    }
}
