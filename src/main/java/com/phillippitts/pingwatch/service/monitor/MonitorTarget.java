package com.phillippitts.pingwatch.service.monitor;

import com.phillippitts.pingwatch.domain.DisruptionEvent;
import com.phillippitts.pingwatch.domain.StatisticsSnapshot;
import com.phillippitts.pingwatch.domain.TargetDefinition;
import com.phillippitts.pingwatch.domain.TargetSnapshot;
import com.phillippitts.pingwatch.domain.TargetStatus;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Reachability state machine and session statistics of one monitored endpoint.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * UNKNOWN --success--> UP
 * UNKNOWN --failure--> DOWN   (episode starts, pre-down snapshot is empty)
 * UP      --failure--> DOWN   (episode starts, pre-down snapshot taken)
 * DOWN    --success--> UP     (recovery: event created, session statistics restart)
 * </pre>
 *
 * <p>A recovery appends a new {@link DisruptionEvent} to the {@link DisruptionEventLog} and
 * keeps a reference to it as the open event. Every later success while up refreshes that
 * event's post-recovery statistics; the next failure closes it and drops the reference.
 *
 * <p><b>Invariants:</b> {@code sendCount >= failCount >= 0};
 * {@code consecutiveFailCount == 0} iff the last probe succeeded;
 * {@code continuousDownStart != null} iff status is DOWN.
 *
 * <p><b>Thread Safety:</b> probes for one target are fed sequentially by its probe loop.
 * A {@link ReentrantLock} guards all state so snapshots taken from other threads (REST,
 * export, health) are consistent.
 */
public final class MonitorTarget {

    private static final Logger LOG = LogManager.getLogger(MonitorTarget.class);

    static final String LABEL_OK = "OK";
    static final String LABEL_RECOVERED = "Recovered";
    static final String LABEL_DOWN = "Down";

    private final int sequence;
    private final String address;
    private final String hostLabel;
    private final long intervalMs;
    private final long timeoutMs;
    private final Clock clock;
    private final DisruptionEventLog eventLog;

    private final Lock lock = new ReentrantLock();
    private final StatisticsAccumulator session = new StatisticsAccumulator();

    private volatile boolean traceSelected;

    private TargetStatus status;
    private String statusLabel;
    private long sendCount;
    private long failCount;
    private int consecutiveFailCount;
    private long currentRtt;

    private Instant continuousDownStart;
    private Duration currentDownDuration;
    private Duration maxDisruptionDuration;
    private int currentDisruptionFailureCount;
    private StatisticsSnapshot preDownSnapshot;

    private DisruptionEvent openEvent;

    public MonitorTarget(TargetDefinition definition,
                         long intervalMs,
                         long timeoutMs,
                         Clock clock,
                         DisruptionEventLog eventLog) {
        Objects.requireNonNull(definition, "definition");
        if (!definition.hasAddress()) {
            throw new IllegalArgumentException("Target address must not be blank");
        }
        if (intervalMs <= 0 || timeoutMs <= 0) {
            throw new IllegalArgumentException("interval and timeout must be positive");
        }
        this.sequence = definition.sequence();
        this.address = definition.address();
        this.hostLabel = definition.hostLabel();
        this.traceSelected = definition.traceSelected();
        this.intervalMs = intervalMs;
        this.timeoutMs = timeoutMs;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.eventLog = Objects.requireNonNull(eventLog, "eventLog");
        clearState();
    }

    /**
     * Feeds a successful probe.
     *
     * @param rtt round-trip time in milliseconds
     */
    public void recordSuccess(long rtt) {
        lock.lock();
        try {
            Instant now = clock.instant();
            sendCount++;
            boolean recovered = status == TargetStatus.DOWN;
            if (recovered) {
                recover(now, rtt);
            }

            session.record(rtt);
            StatisticsSnapshot stats = session.snapshot();
            if (openEvent != null) {
                openEvent.updatePostRecovery(stats);
            }

            currentRtt = rtt;
            status = TargetStatus.UP;
            statusLabel = recovered ? LABEL_RECOVERED : LABEL_OK;
            consecutiveFailCount = 0;
            currentDownDuration = Duration.ZERO;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Feeds a failed probe. Transport errors, timeouts and non-success replies all land here.
     */
    public void recordFailure() {
        lock.lock();
        try {
            Instant now = clock.instant();
            sendCount++;
            if (status != TargetStatus.DOWN) {
                beginDisruption(now);
            }

            failCount++;
            consecutiveFailCount++;
            currentDisruptionFailureCount++;
            currentRtt = 0;

            currentDownDuration = Duration.between(continuousDownStart, now);
            if (currentDownDuration.compareTo(maxDisruptionDuration) > 0) {
                maxDisruptionDuration = currentDownDuration;
            }
            status = TargetStatus.DOWN;
            statusLabel = LABEL_DOWN;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the target to its freshly created state. An open disruption event is closed
     * but stays in the log.
     */
    public void reset() {
        lock.lock();
        try {
            if (openEvent != null) {
                openEvent.close();
            }
            clearState();
        } finally {
            lock.unlock();
        }
    }

    public TargetSnapshot snapshot() {
        lock.lock();
        try {
            return new TargetSnapshot(sequence, address, hostLabel, status, statusLabel,
                    sendCount, failCount, consecutiveFailCount, currentDownDuration,
                    maxDisruptionDuration, currentRtt, session.snapshot(), intervalMs, timeoutMs,
                    traceSelected);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the disruption event currently tracking this target's up session, or null when
     * the target has not recovered from a disruption in this session.
     */
    public DisruptionEvent openEvent() {
        lock.lock();
        try {
            return openEvent;
        } finally {
            lock.unlock();
        }
    }

    /** Pre-down statistics of the ongoing or most recent disruption. */
    StatisticsSnapshot preDownSnapshot() {
        lock.lock();
        try {
            return preDownSnapshot;
        } finally {
            lock.unlock();
        }
    }

    public int getSequence() {
        return sequence;
    }

    public String getAddress() {
        return address;
    }

    public String getHostLabel() {
        return hostLabel;
    }

    public long getIntervalMs() {
        return intervalMs;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }

    public boolean isTraceSelected() {
        return traceSelected;
    }

    public void setTraceSelected(boolean traceSelected) {
        this.traceSelected = traceSelected;
    }

    private void beginDisruption(Instant now) {
        preDownSnapshot = session.snapshot();
        continuousDownStart = now;
        currentDisruptionFailureCount = 0;
        session.breakPairChain();
        if (openEvent != null) {
            openEvent.close();
            openEvent = null;
        }
        LOG.warn("Target down: address={}, host={}, sessionAvg={}ms",
                address, hostLabel, String.format("%.1f", preDownSnapshot.average()));
    }

    private void recover(Instant now, long rtt) {
        DisruptionEvent event = new DisruptionEvent(address, hostLabel, continuousDownStart, now,
                currentDisruptionFailureCount, preDownSnapshot, StatisticsSnapshot.ofSingleSample(rtt));
        session.reset();
        continuousDownStart = null;
        currentDisruptionFailureCount = 0;
        eventLog.append(event);
        openEvent = event;
        LOG.info("Target recovered: address={}, host={}, failures={}, duration={}",
                address, hostLabel, event.getFailureCount(), event.getDurationText());
    }

    private void clearState() {
        session.reset();
        status = TargetStatus.UNKNOWN;
        statusLabel = "";
        sendCount = 0;
        failCount = 0;
        consecutiveFailCount = 0;
        currentRtt = 0;
        continuousDownStart = null;
        currentDownDuration = Duration.ZERO;
        maxDisruptionDuration = Duration.ZERO;
        currentDisruptionFailureCount = 0;
        preDownSnapshot = StatisticsSnapshot.EMPTY;
        openEvent = null;
    }
}
