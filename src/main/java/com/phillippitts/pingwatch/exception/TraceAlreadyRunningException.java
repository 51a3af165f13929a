package com.phillippitts.pingwatch.exception;

import java.util.UUID;

/**
 * Thrown when a trace run is requested while another run is still active.
 */
public class TraceAlreadyRunningException extends PingWatchException {

    private final UUID activeRunId;

    public TraceAlreadyRunningException(UUID activeRunId) {
        super("A trace run is already active: " + activeRunId);
        this.activeRunId = activeRunId;
    }

    public UUID getActiveRunId() {
        return activeRunId;
    }
}
