package com.phillippitts.pingwatch.domain;

/**
 * Reachability state of a monitored target.
 *
 * <pre>
 * UNKNOWN → UP | DOWN
 * UP ⇄ DOWN
 * </pre>
 */
public enum TargetStatus {
    UNKNOWN,
    UP,
    DOWN
}
