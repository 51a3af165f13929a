package com.phillippitts.pingwatch.service.probe;

/**
 * Outcome of one echo attempt.
 *
 * @param success whether a reply arrived within the timeout
 * @param rttMs round-trip time in milliseconds, 0 on failure
 */
public record ProbeResult(boolean success, long rttMs) {

    private static final ProbeResult FAILURE = new ProbeResult(false, 0L);

    public ProbeResult {
        if (rttMs < 0) {
            rttMs = 0;
        }
    }

    public static ProbeResult success(long rttMs) {
        return new ProbeResult(true, rttMs);
    }

    public static ProbeResult failure() {
        return FAILURE;
    }
}
