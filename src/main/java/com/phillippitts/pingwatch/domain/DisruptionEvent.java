package com.phillippitts.pingwatch.domain;

import com.phillippitts.pingwatch.util.TimeUtils;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * One disruption episode of a target: the interval between going down and recovering.
 *
 * <p>Created at the moment a down target answers again. While the target stays up, the
 * post-recovery statistics are replaced in place so the event mirrors the live session;
 * the event is closed once the target goes down again and never changes afterwards.
 *
 * <p><b>Thread Safety:</b> identity fields are immutable. The post-recovery snapshot is a
 * volatile reference to an immutable record, written only by the owning target's probe
 * loop and readable from any thread.
 */
public final class DisruptionEvent {

    private final String address;
    private final String hostLabel;
    private final Instant downStart;
    private final Instant recoveryTime;
    private final int failureCount;
    private final Duration duration;
    private final StatisticsSnapshot preDown;

    private volatile StatisticsSnapshot postRecovery;
    private volatile boolean closed;

    public DisruptionEvent(String address,
                           String hostLabel,
                           Instant downStart,
                           Instant recoveryTime,
                           int failureCount,
                           StatisticsSnapshot preDown,
                           StatisticsSnapshot postRecovery) {
        this.address = Objects.requireNonNull(address, "address");
        this.hostLabel = hostLabel == null ? "" : hostLabel;
        this.downStart = Objects.requireNonNull(downStart, "downStart");
        this.recoveryTime = Objects.requireNonNull(recoveryTime, "recoveryTime");
        this.failureCount = failureCount;
        this.duration = Duration.between(downStart, recoveryTime);
        this.preDown = Objects.requireNonNull(preDown, "preDown");
        this.postRecovery = Objects.requireNonNull(postRecovery, "postRecovery");
    }

    /**
     * Replaces the post-recovery statistics with the target's current session figures.
     *
     * @param stats fresh session statistics
     * @throws IllegalStateException if the event has been closed
     */
    public void updatePostRecovery(StatisticsSnapshot stats) {
        if (closed) {
            throw new IllegalStateException("Disruption event for " + address + " is closed");
        }
        this.postRecovery = Objects.requireNonNull(stats, "stats");
    }

    /** Freezes the event; called when its target goes down again or is reset. */
    public void close() {
        this.closed = true;
    }

    public boolean isClosed() {
        return closed;
    }

    public String getAddress() {
        return address;
    }

    public String getHostLabel() {
        return hostLabel;
    }

    public Instant getDownStart() {
        return downStart;
    }

    public Instant getRecoveryTime() {
        return recoveryTime;
    }

    public int getFailureCount() {
        return failureCount;
    }

    public Duration getDuration() {
        return duration;
    }

    public String getDurationText() {
        return TimeUtils.formatDuration(duration);
    }

    public StatisticsSnapshot getPreDown() {
        return preDown;
    }

    public StatisticsSnapshot getPostRecovery() {
        return postRecovery;
    }

    @Override
    public String toString() {
        return "DisruptionEvent{address=" + address
                + ", downStart=" + downStart
                + ", recoveryTime=" + recoveryTime
                + ", failures=" + failureCount
                + ", duration=" + getDurationText() + '}';
    }
}
