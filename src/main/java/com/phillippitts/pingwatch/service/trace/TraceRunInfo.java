package com.phillippitts.pingwatch.service.trace;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Read-only summary of a trace run.
 *
 * @param runId run identifier
 * @param addresses traced addresses in submission order
 * @param timeoutMs per-hop timeout actually passed to the trace command
 * @param startedAt when the run was started
 * @param finished whether the run finalizer has completed
 */
public record TraceRunInfo(
        UUID runId,
        List<String> addresses,
        long timeoutMs,
        Instant startedAt,
        boolean finished
) {}
