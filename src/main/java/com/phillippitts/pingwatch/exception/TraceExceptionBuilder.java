package com.phillippitts.pingwatch.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for {@link TraceException} with contextual details.
 *
 * <p><b>Usage:</b>
 * <pre>
 * TraceException ex = TraceExceptionBuilder.create("trace spawn error")
 *         .address("10.0.0.1")
 *         .cause(ioException)
 *         .durationMs(12)
 *         .metadata("command", "traceroute -n -w 2 10.0.0.1")
 *         .build();
 * </pre>
 */
public final class TraceExceptionBuilder {

    private final String message;
    private String address;
    private Throwable cause;
    private Integer exitCode;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private TraceExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null)
     * @return new builder instance
     */
    public static TraceExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new TraceExceptionBuilder(message);
    }

    public TraceExceptionBuilder address(String address) {
        this.address = address;
        return this;
    }

    public TraceExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    public TraceExceptionBuilder exitCode(int exitCode) {
        this.exitCode = exitCode;
        return this;
    }

    public TraceExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Adds a metadata key-value pair to the exception message. Null keys or values are ignored.
     */
    public TraceExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Builds the exception. The final message format is:
     * <pre>
     * {message}: {cause message} (exitCode={code}, durationMs={ms}, {key1}={val1}, ...) (address: {address})
     * </pre>
     */
    public TraceException build() {
        String detailedMessage = buildDetailedMessage();
        String target = address != null ? address : "unknown";

        if (cause != null) {
            return new TraceException(detailedMessage, target, cause);
        }
        return new TraceException(detailedMessage, target);
    }

    private String buildDetailedMessage() {
        StringBuilder sb = new StringBuilder(message);
        if (cause != null && cause.getMessage() != null) {
            sb.append(": ").append(cause.getMessage());
        }

        boolean hasDetails = exitCode != null || durationMs != null || !metadata.isEmpty();
        if (!hasDetails) {
            return sb.toString();
        }

        sb.append(" (");
        boolean first = true;

        if (exitCode != null) {
            sb.append("exitCode=").append(exitCode);
            first = false;
        }

        if (durationMs != null) {
            if (!first) {
                sb.append(", ");
            }
            sb.append("durationMs=").append(durationMs);
            first = false;
        }

        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append("=").append(entry.getValue());
            first = false;
        }

        sb.append(")");
        return sb.toString();
    }
}
