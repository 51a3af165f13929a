package com.phillippitts.pingwatch.service.monitor;

import com.phillippitts.pingwatch.config.properties.MonitorProperties;
import com.phillippitts.pingwatch.domain.MonitoringSessionInfo;
import com.phillippitts.pingwatch.domain.MonitoringState;
import com.phillippitts.pingwatch.domain.TargetDefinition;
import com.phillippitts.pingwatch.domain.TargetSnapshot;
import com.phillippitts.pingwatch.exception.NoValidTargetsException;
import com.phillippitts.pingwatch.service.metrics.ProbeMetrics;
import com.phillippitts.pingwatch.service.monitor.event.MonitoringStateChangedEvent;
import com.phillippitts.pingwatch.service.probe.Prober;
import com.phillippitts.pingwatch.util.CancellationSignal;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Session controller: owns the monitored targets and their probe loops.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * IDLE    --start--> RUNNING
 * STOPPED --start--> RUNNING   (statistics reset, disruption log cleared)
 * RUNNING --start--> RUNNING   (current run stopped first)
 * RUNNING --stop---> STOPPED   (statistics kept for export)
 * STOPPED --reset--> IDLE
 * </pre>
 *
 * <p>Each run gets a fresh {@link CancellationSignal}. Stopping fires it, which wakes every
 * loop out of its interval wait, then joins the loops for at most
 * {@code pingwatch.monitor.stop-join-timeout-ms} before interrupting stragglers.
 *
 * <p><b>Thread Safety:</b> commands are serialized by a {@link ReentrantLock}. Targets are
 * read through their own snapshots.
 */
@Service
public class MonitoringService {

    private static final Logger LOG = LogManager.getLogger(MonitoringService.class);

    private final MonitorProperties properties;
    private final DisruptionEventLog eventLog;
    private final Prober prober;
    private final ProbeMetrics metrics;
    private final ApplicationEventPublisher publisher;
    private final AsyncTaskExecutor probeExecutor;
    private final Clock clock;

    private final Lock lock = new ReentrantLock();
    private final Map<String, MonitorTarget> targets = new LinkedHashMap<>();
    private final Map<String, Future<?>> tasks = new LinkedHashMap<>();

    private MonitoringState state = MonitoringState.IDLE;
    private CancellationSignal signal;
    private Instant startedAt;
    private Instant stoppedAt;
    private long intervalMs;
    private long timeoutMs;

    public MonitoringService(MonitorProperties properties,
                             DisruptionEventLog eventLog,
                             Prober prober,
                             ProbeMetrics metrics,
                             ApplicationEventPublisher publisher,
                             @Qualifier("probeExecutor") AsyncTaskExecutor probeExecutor,
                             Clock clock) {
        this.properties = Objects.requireNonNull(properties, "properties");
        this.eventLog = Objects.requireNonNull(eventLog, "eventLog");
        this.prober = Objects.requireNonNull(prober, "prober");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.probeExecutor = Objects.requireNonNull(probeExecutor, "probeExecutor");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.intervalMs = properties.getDefaultIntervalMs();
        this.timeoutMs = properties.getDefaultTimeoutMs();
    }

    /**
     * Starts monitoring with the configured default interval and timeout.
     */
    public MonitoringSessionInfo startMonitoring(List<TargetDefinition> definitions) {
        return startMonitoring(definitions, properties.getDefaultIntervalMs(), properties.getDefaultTimeoutMs());
    }

    /**
     * Starts a new run. A running session is stopped first. Targets without an address are
     * dropped, as are repeated addresses. Statistics start from zero and the disruption log
     * is cleared.
     *
     * @param definitions targets in display order
     * @param intervalMs wait between probes of one target
     * @param timeoutMs probe timeout
     * @return the new session
     * @throws NoValidTargetsException if no definition has an address
     * @throws IllegalArgumentException if interval or timeout is not positive, or there are
     *         more targets than {@code pingwatch.monitor.max-targets}
     */
    public MonitoringSessionInfo startMonitoring(List<TargetDefinition> definitions, long intervalMs, long timeoutMs) {
        Objects.requireNonNull(definitions, "definitions");
        if (intervalMs <= 0 || timeoutMs <= 0) {
            throw new IllegalArgumentException("intervalMs and timeoutMs must be positive");
        }
        List<TargetDefinition> valid = filterValid(definitions);
        if (valid.isEmpty()) {
            throw new NoValidTargetsException(definitions.size());
        }
        if (valid.size() > properties.getMaxTargets()) {
            throw new IllegalArgumentException("Too many targets: " + valid.size()
                    + " (max " + properties.getMaxTargets() + ")");
        }

        lock.lock();
        try {
            if (state == MonitoringState.RUNNING) {
                stopInternal();
            }
            eventLog.clear();
            targets.clear();
            tasks.clear();
            this.intervalMs = intervalMs;
            this.timeoutMs = timeoutMs;
            for (TargetDefinition def : valid) {
                targets.put(def.address(), new MonitorTarget(def, intervalMs, timeoutMs, clock, eventLog));
            }

            CancellationSignal runSignal = new CancellationSignal();
            this.signal = runSignal;
            this.startedAt = clock.instant();
            this.stoppedAt = null;
            try {
                for (MonitorTarget target : targets.values()) {
                    ProbeLoop loop = new ProbeLoop(target, prober, runSignal, publisher, metrics, clock);
                    tasks.put(target.getAddress(), probeExecutor.submit(loop));
                }
            } catch (RejectedExecutionException e) {
                runSignal.cancel();
                joinTasks();
                this.stoppedAt = clock.instant();
                transition(MonitoringState.STOPPED);
                throw new IllegalStateException("Probe executor rejected monitoring tasks", e);
            }
            transition(MonitoringState.RUNNING);
            LOG.info("Monitoring started: targets={}, interval={}ms, timeout={}ms, prober={}",
                    targets.size(), intervalMs, timeoutMs, prober.name());
            return sessionInfo();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stops the running session and waits for its probe loops to exit.
     *
     * @return {@code true} if a running session was stopped
     */
    public boolean stopMonitoring() {
        lock.lock();
        try {
            if (state != MonitoringState.RUNNING) {
                return false;
            }
            stopInternal();
            LOG.info("Monitoring stopped: targets={}, disruptions={}", targets.size(), eventLog.size());
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Resets the statistics of the target(s) with the given address.
     *
     * @throws IllegalStateException while monitoring is running
     * @throws IllegalArgumentException if no target has that address
     */
    public void resetTarget(String address) {
        lock.lock();
        try {
            requireNotRunning("reset a target");
            MonitorTarget target = targets.get(address == null ? "" : address.trim());
            if (target == null) {
                throw new IllegalArgumentException("Unknown target: " + address);
            }
            target.reset();
            LOG.info("Target reset: address={}", target.getAddress());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Resets every target, clears the disruption log and returns to IDLE.
     *
     * @throws IllegalStateException while monitoring is running
     */
    public void resetAll() {
        lock.lock();
        try {
            requireNotRunning("reset");
            targets.values().forEach(MonitorTarget::reset);
            eventLog.clear();
            startedAt = null;
            stoppedAt = null;
            transition(MonitoringState.IDLE);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Marks a target for the next trace run.
     *
     * @throws IllegalArgumentException if no target has that address
     */
    public void setTraceSelected(String address, boolean selected) {
        lock.lock();
        try {
            MonitorTarget target = targets.get(address == null ? "" : address.trim());
            if (target == null) {
                throw new IllegalArgumentException("Unknown target: " + address);
            }
            target.setTraceSelected(selected);
        } finally {
            lock.unlock();
        }
    }

    public MonitoringState getState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Snapshots of all targets ordered by sequence number.
     */
    public List<TargetSnapshot> targets() {
        List<MonitorTarget> current;
        lock.lock();
        try {
            current = new ArrayList<>(targets.values());
        } finally {
            lock.unlock();
        }
        return current.stream()
                .map(MonitorTarget::snapshot)
                .sorted(Comparator.comparingInt(TargetSnapshot::sequence))
                .toList();
    }

    /**
     * Addresses of the targets selected for tracing, in sequence order.
     */
    public List<String> traceSelectedAddresses() {
        return targets().stream()
                .filter(TargetSnapshot::traceSelected)
                .map(TargetSnapshot::address)
                .toList();
    }

    public MonitoringSessionInfo session() {
        lock.lock();
        try {
            return sessionInfo();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Cancellation signal of the current or last run, empty before the first start.
     */
    public Optional<CancellationSignal> monitoringSignal() {
        lock.lock();
        try {
            return Optional.ofNullable(signal);
        } finally {
            lock.unlock();
        }
    }

    @PreDestroy
    void shutdown() {
        stopMonitoring();
    }

    private void stopInternal() {
        signal.cancel();
        joinTasks();
        stoppedAt = clock.instant();
        transition(MonitoringState.STOPPED);
    }

    private void joinTasks() {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(properties.getStopJoinTimeoutMs());
        boolean interrupted = false;
        for (Map.Entry<String, Future<?>> entry : tasks.entrySet()) {
            Future<?> future = entry.getValue();
            if (interrupted) {
                future.cancel(true);
                continue;
            }
            long remaining = Math.max(0, deadline - System.nanoTime());
            try {
                future.get(remaining, TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                LOG.warn("Probe loop did not stop in time, interrupting: address={}", entry.getKey());
                future.cancel(true);
            } catch (ExecutionException e) {
                LOG.error("Probe loop failed: address={}", entry.getKey(), e.getCause());
            } catch (CancellationException e) {
                LOG.debug("Probe loop already cancelled: address={}", entry.getKey());
            } catch (InterruptedException e) {
                interrupted = true;
                future.cancel(true);
            }
        }
        tasks.clear();
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    private void requireNotRunning(String action) {
        if (state == MonitoringState.RUNNING) {
            throw new IllegalStateException("Cannot " + action + " while monitoring is running");
        }
    }

    private void transition(MonitoringState next) {
        MonitoringState previous = state;
        state = next;
        if (previous != next) {
            publisher.publishEvent(new MonitoringStateChangedEvent(previous, next, clock.instant()));
        }
    }

    private MonitoringSessionInfo sessionInfo() {
        return new MonitoringSessionInfo(state, startedAt, stoppedAt, intervalMs, timeoutMs, targets.size());
    }

    private static List<TargetDefinition> filterValid(List<TargetDefinition> definitions) {
        Map<String, TargetDefinition> byAddress = new LinkedHashMap<>();
        int position = 0;
        for (TargetDefinition def : definitions) {
            if (def == null || !def.hasAddress()) {
                continue;
            }
            position++;
            if (byAddress.containsKey(def.address())) {
                LOG.warn("Ignoring repeated target address: {}", def.address());
                continue;
            }
            byAddress.put(def.address(), def.sequence() > 0 ? def : def.withSequence(position));
        }
        return new ArrayList<>(byAddress.values());
    }
}
