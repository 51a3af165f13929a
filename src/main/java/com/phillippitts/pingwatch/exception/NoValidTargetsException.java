package com.phillippitts.pingwatch.exception;

/**
 * Thrown when monitoring is started without a single target that has an address.
 */
public class NoValidTargetsException extends PingWatchException {

    private final int submittedCount;

    public NoValidTargetsException(int submittedCount) {
        super("No valid targets to monitor (" + submittedCount + " submitted, none with an address)");
        this.submittedCount = submittedCount;
    }

    public int getSubmittedCount() {
        return submittedCount;
    }
}
