package com.phillippitts.pingwatch.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class ProbeMetricsTest {

    private MeterRegistry registry;
    private ProbeMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new ProbeMetrics(registry);
    }

    @Test
    void shouldRecordRttAndSuccessPerProber() {
        metrics.recordSuccess("inet", 12);
        metrics.recordSuccess("inet", 18);

        Timer timer = registry.find("pingwatch.probe.rtt").tag("prober", "inet").timer();
        Counter success = registry.find("pingwatch.probe.success").tag("prober", "inet").counter();

        assertThat(timer).isNotNull();
        assertThat(timer.count()).isEqualTo(2);
        assertThat(timer.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(30.0);
        assertThat(success).isNotNull();
        assertThat(success.count()).isEqualTo(2.0);
    }

    @Test
    void shouldTagFailuresByReason() {
        metrics.recordFailure("system-ping", "timeout");
        metrics.recordFailure("system-ping", "timeout");
        metrics.recordFailure("system-ping", "error");

        assertThat(registry.find("pingwatch.probe.failure").tags("prober", "system-ping", "reason", "timeout")
                .counter().count()).isEqualTo(2.0);
        assertThat(registry.find("pingwatch.probe.failure").tags("prober", "system-ping", "reason", "error")
                .counter().count()).isEqualTo(1.0);
    }

    @Test
    void shouldRecordDisruptionDuration() {
        metrics.recordDisruption(3_000);

        Timer timer = registry.find("pingwatch.disruption.duration").timer();
        assertThat(timer).isNotNull();
        assertThat(timer.totalTime(TimeUnit.SECONDS)).isEqualTo(3.0);
    }

    @Test
    void shouldCountTraceOutcomes() {
        metrics.recordTraceOutcome("completed");
        metrics.recordTraceOutcome("stopped");
        metrics.recordTraceOutcome("stopped");

        assertThat(registry.find("pingwatch.trace.terminated").tag("outcome", "completed").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.find("pingwatch.trace.terminated").tag("outcome", "stopped").counter().count())
                .isEqualTo(2.0);
    }

    @Test
    void shouldCountProbesSentPerProber() {
        metrics.recordSent("inet");
        metrics.recordSent("inet");
        metrics.recordSent("system-ping");

        assertThat(registry.find("pingwatch.probe.sent").tag("prober", "inet").counter().count())
                .isEqualTo(2.0);
        assertThat(registry.find("pingwatch.probe.sent").tag("prober", "system-ping").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void shouldCountTraceRunsAndAddresses() {
        metrics.recordTraceRun(3);
        metrics.recordTraceRun(2);

        assertThat(registry.find("pingwatch.trace.runs").counter().count()).isEqualTo(2.0);
        assertThat(registry.find("pingwatch.trace.addresses").counter().count()).isEqualTo(5.0);
    }
}
