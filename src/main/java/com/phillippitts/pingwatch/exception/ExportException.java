package com.phillippitts.pingwatch.exception;

import java.nio.file.Path;

/**
 * Thrown when saving or loading a report, address list or trace transcript fails.
 */
public class ExportException extends PingWatchException {

    private final Path path;

    public ExportException(String message, Path path, Throwable cause) {
        super(message + ": " + path, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
