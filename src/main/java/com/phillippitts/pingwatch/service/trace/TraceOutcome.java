package com.phillippitts.pingwatch.service.trace;

/**
 * How the trace of one address ended. Each address receives exactly one trailer.
 */
public enum TraceOutcome {

    /** The subprocess ran to its natural end (including spawn and read errors). */
    COMPLETED("--- completed ---"),

    /** The run was cancelled before the subprocess finished or before it started. */
    STOPPED("--- stopped by user ---");

    private final String trailer;

    TraceOutcome(String trailer) {
        this.trailer = trailer;
    }

    public String trailer() {
        return trailer;
    }
}
