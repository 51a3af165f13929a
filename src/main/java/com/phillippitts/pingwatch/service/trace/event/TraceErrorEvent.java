package com.phillippitts.pingwatch.service.trace.event;

/**
 * Emitted when a trace subprocess cannot be started or its output cannot be read.
 *
 * @param address traced address
 * @param reason short failure category (spawn, read)
 * @param message failure detail
 */
public record TraceErrorEvent(
        String address,
        String reason,
        String message
) {}
