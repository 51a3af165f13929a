package com.phillippitts.pingwatch.service.trace.event;

import java.util.UUID;

/**
 * Emitted for every line appended to a traced address's buffer.
 *
 * @param runId trace run the line belongs to
 * @param address source address
 * @param line output line without timestamp prefix
 */
public record TraceOutputEvent(
        UUID runId,
        String address,
        String line
) {}
