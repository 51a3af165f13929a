package com.phillippitts.pingwatch.exception;

/**
 * Base exception for all pingwatch application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class PingWatchException extends RuntimeException {

    public PingWatchException(String message) {
        super(message);
    }

    public PingWatchException(String message, Throwable cause) {
        super(message, cause);
    }

    public PingWatchException(Throwable cause) {
        super(cause);
    }
}
