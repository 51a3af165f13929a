package com.phillippitts.pingwatch.domain;

/**
 * Lifecycle of the monitoring session.
 *
 * <pre>
 * IDLE → RUNNING (startMonitoring)
 * RUNNING → STOPPED (stopMonitoring)
 * STOPPED → RUNNING (startMonitoring, statistics reset)
 * STOPPED → IDLE (resetAll)
 * </pre>
 */
public enum MonitoringState {
    IDLE,
    RUNNING,
    STOPPED
}
