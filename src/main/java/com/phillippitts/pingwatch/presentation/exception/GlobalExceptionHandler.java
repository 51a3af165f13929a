package com.phillippitts.pingwatch.presentation.exception;

import com.phillippitts.pingwatch.exception.ExportException;
import com.phillippitts.pingwatch.exception.NoValidTargetsException;
import com.phillippitts.pingwatch.exception.TraceAlreadyRunningException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * Logs errors for monitoring while keeping file system paths out of client responses.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Client error - nothing to monitor (HTTP 400).
     */
    @ExceptionHandler(NoValidTargetsException.class)
    ResponseEntity<ApiError> handleNoValidTargets(NoValidTargetsException ex) {
        LOG.warn("Start rejected: submitted={}", ex.getSubmittedCount());
        return error(HttpStatus.BAD_REQUEST, ex, "No valid targets", ex.getMessage());
    }

    /**
     * Client error - invalid argument or request body (HTTP 400).
     */
    @ExceptionHandler({IllegalArgumentException.class,
            MethodArgumentNotValidException.class,
            MethodArgumentTypeMismatchException.class})
    ResponseEntity<ApiError> handleBadRequest(Exception ex) {
        LOG.warn("Bad request: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, ex, "Invalid request", ex.getMessage());
    }

    /**
     * Conflict - another trace run is active (HTTP 409).
     */
    @ExceptionHandler(TraceAlreadyRunningException.class)
    ResponseEntity<ApiError> handleTraceRunning(TraceAlreadyRunningException ex) {
        LOG.info("Trace start rejected: activeRunId={}", ex.getActiveRunId());
        return error(HttpStatus.CONFLICT, ex, "Trace run already active", "Stop the active run first");
    }

    /**
     * Conflict - command not allowed in the current monitoring state (HTTP 409).
     */
    @ExceptionHandler(IllegalStateException.class)
    ResponseEntity<ApiError> handleIllegalState(IllegalStateException ex) {
        LOG.info("Command rejected: {}", ex.getMessage());
        return error(HttpStatus.CONFLICT, ex, "Command not allowed now", ex.getMessage());
    }

    /**
     * Export I/O failure (HTTP 500). The path is logged, never returned.
     */
    @ExceptionHandler(ExportException.class)
    ResponseEntity<ApiError> handleExport(ExportException ex) {
        LOG.error("Export failed: path={}", ex.getPath(), ex);
        String cause = ex.getCause() != null ? ex.getCause().getClass().getSimpleName() : "unknown";
        return error(HttpStatus.INTERNAL_SERVER_ERROR, ex, "File operation failed", "I/O error: " + cause);
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                "InternalServerError",
                "An unexpected error occurred",
                "Please contact support with request ID",
                Instant.now()
            ));
    }

    private static ResponseEntity<ApiError> error(HttpStatus status, Exception ex, String message, String details) {
        return ResponseEntity
            .status(status)
            .body(new ApiError(ex.getClass().getSimpleName(), message, details, Instant.now()));
    }

    /**
     * Standardized error response for API clients.
     */
    record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
