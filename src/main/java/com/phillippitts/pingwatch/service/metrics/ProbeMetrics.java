package com.phillippitts.pingwatch.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics tracking for probes, disruptions and trace runs.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Probe round-trip time per prober</li>
 *   <li>Probe sent/success/failure counts per prober</li>
 *   <li>Recovered disruptions</li>
 *   <li>Trace runs started and trace terminations by outcome</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class ProbeMetrics {

    private static final String METRIC_PREFIX = "pingwatch";

    private final MeterRegistry registry;

    public ProbeMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordSent(String proberName) {
        Counter.builder(METRIC_PREFIX + ".probe.sent")
                .description("Number of probes sent")
                .tag("prober", proberName)
                .register(registry)
                .increment();
    }

    /**
     * Records a successful probe and its round-trip time.
     *
     * @param proberName name of the prober (inet, system-ping)
     * @param rttMs round-trip time in milliseconds
     */
    public void recordSuccess(String proberName, long rttMs) {
        Timer.builder(METRIC_PREFIX + ".probe.rtt")
                .description("Round-trip time of successful probes")
                .tag("prober", proberName)
                .register(registry)
                .record(rttMs, TimeUnit.MILLISECONDS);
        Counter.builder(METRIC_PREFIX + ".probe.success")
                .description("Number of successful probes")
                .tag("prober", proberName)
                .register(registry)
                .increment();
    }

    /**
     * Increments the failure counter.
     *
     * @param proberName name of the prober (inet, system-ping)
     * @param reason failure reason (timeout, error)
     */
    public void recordFailure(String proberName, String reason) {
        Counter.builder(METRIC_PREFIX + ".probe.failure")
                .description("Number of failed probes")
                .tag("prober", proberName)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordDisruption(long durationMs) {
        Timer.builder(METRIC_PREFIX + ".disruption.duration")
                .description("Duration of recovered disruptions")
                .register(registry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    public void recordTraceRun(int addresses) {
        Counter.builder(METRIC_PREFIX + ".trace.runs")
                .description("Number of trace runs started")
                .register(registry)
                .increment();
        Counter.builder(METRIC_PREFIX + ".trace.addresses")
                .description("Number of addresses traced across all runs")
                .register(registry)
                .increment(addresses);
    }

    /**
     * Counts a terminated trace.
     *
     * @param outcome completed or stopped
     */
    public void recordTraceOutcome(String outcome) {
        Counter.builder(METRIC_PREFIX + ".trace.terminated")
                .description("Number of terminated traces by outcome")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }
}
