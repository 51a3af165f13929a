package com.phillippitts.pingwatch.util;

import java.time.Duration;

/**
 * Standard timeout values for subprocess and worker-thread management.
 *
 * <p>Centralized timeout constants keep the trace runner and the system ping prober
 * consistent when they wait for or terminate external commands.
 *
 * @see com.phillippitts.pingwatch.service.process.ProcessReaper
 * @see com.phillippitts.pingwatch.service.trace.TraceOrchestrator
 * @since 1.0
 */
public final class ProcessTimeouts {

    /**
     * Timeout for a trace command to exit after its output stream reached end-of-file.
     */
    public static final Duration EXIT_AFTER_EOF_TIMEOUT = Duration.ofMillis(1000);

    /**
     * Timeout for graceful process shutdown via {@link Process#destroy()}.
     *
     * <p>Most processes terminate within 100-200ms. 500ms provides headroom for
     * slower shutdowns while keeping total cleanup time reasonable.
     */
    public static final Duration GRACEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(500);

    /**
     * Timeout for forceful process termination via {@link Process#destroyForcibly()}.
     *
     * <p>Processes that survive this are typically unkillable due to OS bugs.
     */
    public static final Duration FORCEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(1000);

    /**
     * Extra time granted to a one-shot {@code ping} command beyond its own reply timeout.
     */
    public static final Duration PING_COMMAND_GRACE = Duration.ofMillis(1000);

    /**
     * Interval at which a waiter re-checks its cancellation signal while blocked on a permit.
     */
    public static final Duration CANCELLATION_POLL_INTERVAL = Duration.ofMillis(50);

    private ProcessTimeouts() {
        // Utility class - prevent instantiation
    }
}
