package com.phillippitts.pingwatch.exception;

/**
 * Thrown when a trace command cannot be started or its output cannot be read.
 *
 * <p>Trace failures never abort a run. The orchestrator writes the message inline into the
 * affected address's output buffer and carries on with the other addresses.
 */
public class TraceException extends PingWatchException {

    private final String address;

    public TraceException(String message) {
        super(message);
        this.address = "unknown";
    }

    public TraceException(String message, String address) {
        super(message + " (address: " + address + ")");
        this.address = address;
    }

    public TraceException(String message, String address, Throwable cause) {
        super(message + " (address: " + address + ")", cause);
        this.address = address;
    }

    public String getAddress() {
        return address;
    }
}
