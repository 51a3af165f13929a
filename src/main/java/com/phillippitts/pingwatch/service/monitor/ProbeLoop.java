package com.phillippitts.pingwatch.service.monitor;

import com.phillippitts.pingwatch.domain.DisruptionEvent;
import com.phillippitts.pingwatch.service.metrics.ProbeMetrics;
import com.phillippitts.pingwatch.service.monitor.event.DisruptionRecordedEvent;
import com.phillippitts.pingwatch.service.monitor.event.TargetUpdatedEvent;
import com.phillippitts.pingwatch.service.probe.ProbeResult;
import com.phillippitts.pingwatch.service.probe.Prober;
import com.phillippitts.pingwatch.util.CancellationSignal;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

/**
 * Probe-wait cycle of one target, run on the probe executor until the session's
 * {@link CancellationSignal} fires.
 *
 * <p>Each iteration sends one probe, applies the outcome to the {@link MonitorTarget},
 * publishes a {@link TargetUpdatedEvent} and, when the target's open disruption event was
 * created or refreshed, a {@link DisruptionRecordedEvent}. Prober exceptions become failed
 * probes; nothing escapes the loop.
 *
 * <p>A probe that is still in flight when the signal fires is discarded, so stopping never
 * records a trailing failure.
 */
public final class ProbeLoop implements Runnable {

    private static final Logger LOG = LogManager.getLogger(ProbeLoop.class);

    static final String MDC_TARGET = "target";

    private final MonitorTarget target;
    private final Prober prober;
    private final CancellationSignal signal;
    private final ApplicationEventPublisher publisher;
    private final ProbeMetrics metrics;
    private final Clock clock;

    public ProbeLoop(MonitorTarget target,
                     Prober prober,
                     CancellationSignal signal,
                     ApplicationEventPublisher publisher,
                     ProbeMetrics metrics,
                     Clock clock) {
        this.target = Objects.requireNonNull(target, "target");
        this.prober = Objects.requireNonNull(prober, "prober");
        this.signal = Objects.requireNonNull(signal, "signal");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public void run() {
        ThreadContext.put(MDC_TARGET, target.getAddress());
        Duration interval = Duration.ofMillis(target.getIntervalMs());
        LOG.debug("Probe loop started: interval={}ms, timeout={}ms, prober={}",
                target.getIntervalMs(), target.getTimeoutMs(), prober.name());
        try {
            while (!signal.isCancelled()) {
                ProbeResult result = probeOnce();
                if (signal.isCancelled()) {
                    break;
                }
                apply(result);
                if (signal.await(interval)) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            LOG.debug("Probe loop finished");
            ThreadContext.remove(MDC_TARGET);
        }
    }

    /**
     * Sends one probe. Transport errors and unexpected exceptions map to a failure.
     *
     * @throws InterruptedException if the loop was interrupted while probing
     */
    ProbeResult probeOnce() throws InterruptedException {
        metrics.recordSent(prober.name());
        try {
            ProbeResult result = prober.probe(target.getAddress(), target.getTimeoutMs());
            if (result.success()) {
                metrics.recordSuccess(prober.name(), result.rttMs());
            } else {
                metrics.recordFailure(prober.name(), "timeout");
            }
            return result;
        } catch (IOException e) {
            LOG.debug("Probe transport error: {}", e.toString());
            metrics.recordFailure(prober.name(), "error");
            return ProbeResult.failure();
        } catch (RuntimeException e) {
            LOG.warn("Prober {} failed unexpectedly: {}", prober.name(), e.toString());
            metrics.recordFailure(prober.name(), "error");
            return ProbeResult.failure();
        }
    }

    void apply(ProbeResult result) {
        DisruptionEvent before = target.openEvent();
        if (result.success()) {
            target.recordSuccess(result.rttMs());
        } else {
            target.recordFailure();
        }
        DisruptionEvent after = target.openEvent();

        LOG.debug("Probe: success={}, rtt={}ms", result.success(), result.rttMs());
        publisher.publishEvent(new TargetUpdatedEvent(target.snapshot(), clock.instant()));
        if (after != null) {
            boolean created = after != before;
            if (created) {
                metrics.recordDisruption(after.getDuration().toMillis());
            }
            publisher.publishEvent(new DisruptionRecordedEvent(after, created));
        }
    }
}
