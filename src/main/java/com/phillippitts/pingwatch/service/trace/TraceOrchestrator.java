package com.phillippitts.pingwatch.service.trace;

import com.phillippitts.pingwatch.config.properties.TraceProperties;
import com.phillippitts.pingwatch.exception.TraceAlreadyRunningException;
import com.phillippitts.pingwatch.exception.TraceException;
import com.phillippitts.pingwatch.exception.TraceExceptionBuilder;
import com.phillippitts.pingwatch.service.metrics.ProbeMetrics;
import com.phillippitts.pingwatch.service.monitor.MonitoringService;
import com.phillippitts.pingwatch.service.process.ProcessFactory;
import com.phillippitts.pingwatch.service.process.ProcessReaper;
import com.phillippitts.pingwatch.service.trace.event.TraceErrorEvent;
import com.phillippitts.pingwatch.service.trace.event.TraceOutputEvent;
import com.phillippitts.pingwatch.service.trace.event.TraceTerminatedEvent;
import com.phillippitts.pingwatch.util.CancellationSignal;
import com.phillippitts.pingwatch.util.ProcessTimeouts;
import com.phillippitts.pingwatch.util.TimeUtils;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.Charset;
import java.time.Clock;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs OS trace commands against a set of addresses with bounded concurrency and streams
 * their output into per-address buffers.
 *
 * <p>Each address runs as one task on the trace executor. A task waits for a
 * {@link TraceSlotLimiter} slot, writes its start banner, spawns the subprocess through the
 * {@link ProcessFactory} and copies stdout line by line into its buffer, publishing a
 * {@link TraceOutputEvent} per line. Spawn and read errors are written inline and end that
 * address only.
 *
 * <p><b>Cancellation:</b> {@link #stopTrace()} fires the run's {@link CancellationSignal}.
 * The signal kills in-flight subprocesses through per-process callbacks, releases tasks
 * waiting for a slot and completes the run's join early. The stop handler then writes the
 * stopped trailer to every unfinished address; the run finalizer applies the same atomic rule
 * once the join unwinds (see {@link TraceSession}).
 *
 * <p>Only one run is active at a time.
 */
@Service
public class TraceOrchestrator {

    private static final Logger LOG = LogManager.getLogger(TraceOrchestrator.class);

    static final String MDC_TRACE = "trace";

    private final TraceProperties properties;
    private final TraceCommandBuilder commandBuilder;
    private final ProcessFactory processFactory;
    private final MonitoringService monitoringService;
    private final ProbeMetrics metrics;
    private final ApplicationEventPublisher publisher;
    private final AsyncTaskExecutor traceExecutor;
    private final Clock clock;
    private final TraceSlotLimiter limiter;

    private final AtomicReference<TraceSession> active = new AtomicReference<>();
    private final AtomicReference<TraceSession> last = new AtomicReference<>();

    public TraceOrchestrator(TraceProperties properties,
                             TraceCommandBuilder commandBuilder,
                             ProcessFactory processFactory,
                             MonitoringService monitoringService,
                             ProbeMetrics metrics,
                             ApplicationEventPublisher publisher,
                             @Qualifier("traceExecutor") AsyncTaskExecutor traceExecutor,
                             Clock clock) {
        this.properties = Objects.requireNonNull(properties, "properties");
        this.commandBuilder = Objects.requireNonNull(commandBuilder, "commandBuilder");
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
        this.monitoringService = Objects.requireNonNull(monitoringService, "monitoringService");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.traceExecutor = Objects.requireNonNull(traceExecutor, "traceExecutor");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.limiter = new TraceSlotLimiter(properties.getMaxConcurrent());
    }

    /**
     * Starts a trace run. Returns immediately; output arrives through events and
     * {@link #output(String)}.
     *
     * @param addresses addresses to trace; blanks and repeats are dropped
     * @param timeoutMs requested per-hop timeout, raised to the configured minimum
     * @return the new session
     * @throws IllegalArgumentException if no address remains
     * @throws TraceAlreadyRunningException if another run is still active
     */
    public TraceSession runTrace(List<String> addresses, long timeoutMs) {
        Objects.requireNonNull(addresses, "addresses");
        Set<String> unique = new LinkedHashSet<>();
        for (String address : addresses) {
            if (address != null && !address.isBlank()) {
                unique.add(address.trim());
            }
        }
        if (unique.isEmpty()) {
            throw new IllegalArgumentException("No addresses to trace");
        }

        TraceSession session = new TraceSession(UUID.randomUUID(), List.copyOf(unique),
                commandBuilder.effectiveTimeoutMs(timeoutMs), clock.instant());
        if (!active.compareAndSet(null, session)) {
            TraceSession current = active.get();
            throw new TraceAlreadyRunningException(current == null ? null : current.id());
        }
        last.set(session);
        metrics.recordTraceRun(session.addresses().size());

        CancellationSignal.Registration monitoringLink = linkToMonitoring(session);
        session.broadcast("=== trace run started " + TimeUtils.TIMESTAMP_FORMAT.format(session.startedAt())
                + " (" + session.addresses().size() + " addresses) ===");
        LOG.info("Trace run started: runId={}, addresses={}, timeout={}ms, maxConcurrent={}",
                session.id(), session.addresses().size(), session.timeoutMs(), limiter.capacity());

        List<CompletableFuture<Void>> tasks = session.addresses().stream()
                .map(address -> CompletableFuture.runAsync(() -> traceAddress(session, address), traceExecutor))
                .toList();
        CompletableFuture<Void> join = CompletableFuture.allOf(tasks.toArray(new CompletableFuture[0]));
        CancellationSignal.Registration joinCancel = session.signal().register(() -> join.cancel(true));
        join.whenCompleteAsync((ignored, error) -> {
            joinCancel.close();
            finishRun(session, tasks, monitoringLink);
        }, traceExecutor);
        return session;
    }

    /**
     * Stops the active run: kills in-flight subprocesses and annotates every unfinished
     * address as stopped.
     *
     * @return {@code true} if a run was active
     */
    public boolean stopTrace() {
        TraceSession session = active.get();
        if (session == null) {
            return false;
        }
        if (session.signal().cancel()) {
            LOG.info("Trace run stop requested: runId={}", session.id());
        }
        publishStopped(session, session.annotatePendingStopped());
        return true;
    }

    public boolean isRunning() {
        return active.get() != null;
    }

    /**
     * Active run, or the last finished one.
     */
    public Optional<TraceSession> currentSession() {
        TraceSession session = active.get();
        return Optional.ofNullable(session != null ? session : last.get());
    }

    /**
     * Output lines of an address in the active or last run.
     */
    public Optional<List<String>> output(String address) {
        return currentSession().flatMap(s -> s.output(address));
    }

    TraceSlotLimiter limiter() {
        return limiter;
    }

    @PreDestroy
    void shutdown() {
        stopTrace();
    }

    private CancellationSignal.Registration linkToMonitoring(TraceSession session) {
        if (!properties.isLinkToMonitoring()) {
            return () -> { };
        }
        // a stopped monitoring run must not cancel traces started after it
        return monitoringService.monitoringSignal()
                .filter(parent -> !parent.isCancelled())
                .map(parent -> CancellationSignal.link(parent, session.signal()))
                .orElse(() -> { });
    }

    void traceAddress(TraceSession session, String address) {
        ThreadContext.put(MDC_TRACE, address);
        CancellationSignal signal = session.signal();
        TraceOutcome outcome = TraceOutcome.COMPLETED;
        AtomicBoolean killRequested = new AtomicBoolean();
        CancellationSignal.Registration killOnCancel = null;
        Process process = null;
        boolean acquired = false;
        long startTime = System.nanoTime();
        try {
            acquired = limiter.acquire(signal);
            if (!acquired || signal.isCancelled()) {
                outcome = TraceOutcome.STOPPED;
                return;
            }

            List<String> command = commandBuilder.build(address, session.timeoutMs());
            emit(session, address, commandBuilder.banner(address, session.timeoutMs()));
            try {
                process = processFactory.start(command);
            } catch (IOException e) {
                reportError(session, address, "spawn", "(trace spawn error: " + e.getMessage() + ")",
                        TraceExceptionBuilder.create("Trace spawn failed")
                                .address(address)
                                .cause(e)
                                .durationMs(TimeUtils.elapsedMillis(startTime))
                                .metadata("command", command.get(0))
                                .build());
                return;
            }

            Process started = process;
            killOnCancel = signal.register(() -> {
                if (started.isAlive()) {
                    killRequested.set(true);
                    started.destroy();
                }
            });
            readOutput(session, address, started, startTime);
            if (!signal.isCancelled()) {
                awaitExit(started, address);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            outcome = TraceOutcome.STOPPED;
        } catch (RuntimeException e) {
            LOG.error("Trace task failed unexpectedly: address={}", address, e);
        } finally {
            if (killOnCancel != null) {
                killOnCancel.close();
            }
            if (process != null && process.isAlive()) {
                ProcessReaper.destroy(process);
            }
            if (acquired) {
                limiter.release();
            }
            if (killRequested.get()) {
                outcome = TraceOutcome.STOPPED;
            }
            if (session.finish(address, outcome)) {
                publishTerminated(session, address, outcome);
            }
            LOG.debug("Trace task finished: outcome={}, elapsed={}ms", outcome, TimeUtils.elapsedMillis(startTime));
            ThreadContext.remove(MDC_TRACE);
        }
    }

    private void readOutput(TraceSession session, String address, Process process, long startTime) {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), Charset.defaultCharset()))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (session.signal().isCancelled()) {
                    break;
                }
                emit(session, address, line);
            }
        } catch (IOException e) {
            if (session.signal().isCancelled()) {
                LOG.debug("Trace output closed after stop: {}", e.toString());
                return;
            }
            reportError(session, address, "read", "(trace output read error: " + e.getMessage() + ")",
                    TraceExceptionBuilder.create("Trace output read failed")
                            .address(address)
                            .cause(e)
                            .durationMs(TimeUtils.elapsedMillis(startTime))
                            .build());
        }
    }

    private void awaitExit(Process process, String address) throws InterruptedException {
        boolean exited = process.waitFor(ProcessTimeouts.EXIT_AFTER_EOF_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
        if (exited) {
            LOG.debug("Trace process exited: address={}, exitCode={}", address, process.exitValue());
        }
    }

    private void finishRun(TraceSession session,
                           List<CompletableFuture<Void>> tasks,
                           CancellationSignal.Registration monitoringLink) {
        try {
            publishStopped(session, session.annotatePendingStopped());
            awaitTasks(session, tasks);
            session.broadcast("=== trace run finished " + TimeUtils.TIMESTAMP_FORMAT.format(clock.instant()) + " ===");
            LOG.info("Trace run finished: runId={}, stopped={}", session.id(), session.signal().isCancelled());
        } finally {
            monitoringLink.close();
            active.compareAndSet(session, null);
            session.markFinished();
        }
    }

    private void awaitTasks(TraceSession session, List<CompletableFuture<Void>> tasks) {
        long graceMs = ProcessTimeouts.GRACEFUL_SHUTDOWN_TIMEOUT.plus(ProcessTimeouts.FORCEFUL_SHUTDOWN_TIMEOUT).toMillis();
        try {
            CompletableFuture.allOf(tasks.toArray(new CompletableFuture[0])).get(graceMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            LOG.warn("Trace tasks still running after {}ms: runId={}", graceMs, session.id());
        } catch (ExecutionException e) {
            LOG.warn("Trace task failed: runId={}", session.id(), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void emit(TraceSession session, String address, String line) {
        if (session.append(address, line)) {
            publisher.publishEvent(new TraceOutputEvent(session.id(), address, line));
        }
    }

    private void reportError(TraceSession session, String address, String reason, String inlineLine, TraceException error) {
        LOG.warn(error.getMessage());
        emit(session, address, inlineLine);
        publisher.publishEvent(new TraceErrorEvent(address, reason, error.getMessage()));
    }

    private void publishStopped(TraceSession session, List<String> addresses) {
        for (String address : addresses) {
            publishTerminated(session, address, TraceOutcome.STOPPED);
        }
    }

    private void publishTerminated(TraceSession session, String address, TraceOutcome outcome) {
        metrics.recordTraceOutcome(outcome.name().toLowerCase());
        publisher.publishEvent(new TraceTerminatedEvent(session.id(), address, outcome));
    }
}
