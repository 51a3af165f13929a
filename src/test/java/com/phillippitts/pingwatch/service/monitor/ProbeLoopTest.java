package com.phillippitts.pingwatch.service.monitor;

import com.phillippitts.pingwatch.domain.TargetDefinition;
import com.phillippitts.pingwatch.domain.TargetStatus;
import com.phillippitts.pingwatch.service.metrics.ProbeMetrics;
import com.phillippitts.pingwatch.service.monitor.event.DisruptionRecordedEvent;
import com.phillippitts.pingwatch.service.monitor.event.TargetUpdatedEvent;
import com.phillippitts.pingwatch.service.probe.ProbeResult;
import com.phillippitts.pingwatch.service.probe.Prober;
import com.phillippitts.pingwatch.testutil.EventCapturingPublisher;
import com.phillippitts.pingwatch.testutil.FakeProber;
import com.phillippitts.pingwatch.testutil.MutableClock;
import com.phillippitts.pingwatch.util.CancellationSignal;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class ProbeLoopTest {

    private static final String ADDRESS = "192.0.2.10";

    private MutableClock clock;
    private DisruptionEventLog log;
    private EventCapturingPublisher publisher;
    private SimpleMeterRegistry registry;
    private ProbeMetrics metrics;
    private CancellationSignal signal;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        log = new DisruptionEventLog();
        publisher = new EventCapturingPublisher();
        registry = new SimpleMeterRegistry();
        metrics = new ProbeMetrics(registry);
        signal = new CancellationSignal();
    }

    private MonitorTarget target(long intervalMs) {
        return new MonitorTarget(new TargetDefinition(1, ADDRESS, "edge"), intervalMs, 100, clock, log);
    }

    private ProbeLoop loop(MonitorTarget target, Prober prober) {
        return new ProbeLoop(target, prober, signal, publisher, metrics, clock);
    }

    @Test
    void publishesSnapshotAfterEveryProbe() {
        MonitorTarget target = target(1000);
        ProbeLoop loop = loop(target, new FakeProber());

        loop.apply(ProbeResult.success(12));
        loop.apply(ProbeResult.failure());

        List<TargetUpdatedEvent> updates = publisher.eventsOfType(TargetUpdatedEvent.class);
        assertThat(updates).hasSize(2);
        assertThat(updates.get(0).snapshot().status()).isEqualTo(TargetStatus.UP);
        assertThat(updates.get(1).snapshot().status()).isEqualTo(TargetStatus.DOWN);
        assertThat(publisher.eventsOfType(DisruptionRecordedEvent.class)).isEmpty();
    }

    @Test
    void publishesCreatedThenUpdatedDisruption() {
        MonitorTarget target = target(1000);
        ProbeLoop loop = loop(target, new FakeProber());

        loop.apply(ProbeResult.failure());
        clock.advanceSeconds(2);
        loop.apply(ProbeResult.success(20));
        loop.apply(ProbeResult.success(30));

        List<DisruptionRecordedEvent> recorded = publisher.eventsOfType(DisruptionRecordedEvent.class);
        assertThat(recorded).hasSize(2);
        assertThat(recorded.get(0).created()).isTrue();
        assertThat(recorded.get(1).created()).isFalse();
        assertThat(recorded.get(1).event()).isSameAs(recorded.get(0).event());
        assertThat(registry.find("pingwatch.disruption.duration").timer().count()).isEqualTo(1);
    }

    @Test
    void transportErrorBecomesFailedProbe() throws Exception {
        ProbeLoop loop = loop(target(1000), new FakeProber().failWithIo(true));

        ProbeResult result = loop.probeOnce();

        assertThat(result.success()).isFalse();
        Counter failures = registry.find("pingwatch.probe.failure").tag("reason", "error").counter();
        assertThat(failures).isNotNull();
        assertThat(failures.count()).isEqualTo(1.0);
        assertThat(registry.find("pingwatch.probe.sent").counter().count()).isEqualTo(1.0);
    }

    @Test
    void unexpectedProberExceptionBecomesFailedProbe() throws Exception {
        FakeProber prober = new FakeProber().throwFor(ADDRESS, new IllegalStateException("boom"));
        ProbeLoop loop = loop(target(1000), prober);

        assertThat(loop.probeOnce()).isEqualTo(ProbeResult.failure());
    }

    @Test
    void timeoutIsCountedAsTimeoutFailure() throws Exception {
        FakeProber prober = new FakeProber().respond(ADDRESS, ProbeResult.failure());
        ProbeLoop loop = loop(target(1000), prober);

        loop.probeOnce();

        assertThat(registry.find("pingwatch.probe.failure").tag("reason", "timeout").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void loopProbesUntilCancelledAndExitsPromptly() throws Exception {
        FakeProber prober = new FakeProber();
        MonitorTarget target = target(20);
        Thread thread = new Thread(loop(target, prober), "probe-test");
        thread.start();

        await().atMost(Duration.ofSeconds(5)).until(() -> prober.probeCount(ADDRESS) >= 3);
        signal.cancel();
        thread.join(2000);

        assertThat(thread.isAlive()).isFalse();
        long sent = target.snapshot().sendCount();
        Thread.sleep(100);
        assertThat(target.snapshot().sendCount()).isEqualTo(sent);
    }

    @Test
    void longIntervalWaitIsCutShortByCancellation() throws Exception {
        FakeProber prober = new FakeProber();
        Thread thread = new Thread(loop(target(60_000), prober), "probe-test");
        thread.start();

        await().atMost(Duration.ofSeconds(5)).until(() -> prober.probeCount(ADDRESS) == 1);
        signal.cancel();
        thread.join(1000);

        assertThat(thread.isAlive()).isFalse();
        assertThat(prober.probeCount(ADDRESS)).isEqualTo(1);
    }

    @Test
    void probeInFlightWhenCancelledIsDiscarded() {
        MonitorTarget target = target(1000);
        Prober cancellingProber = new Prober() {
            @Override
            public ProbeResult probe(String address, long timeoutMs) {
                signal.cancel();
                return ProbeResult.failure();
            }

            @Override
            public String name() {
                return "cancelling";
            }
        };

        loop(target, cancellingProber).run();

        assertThat(target.snapshot().sendCount()).isZero();
        assertThat(target.snapshot().status()).isEqualTo(TargetStatus.UNKNOWN);
        assertThat(publisher.eventsOfType(TargetUpdatedEvent.class)).isEmpty();
    }

    @Test
    void alreadyCancelledSignalSendsNoProbe() {
        FakeProber prober = new FakeProber();
        signal.cancel();

        loop(target(1000), prober).run();

        assertThat(prober.probeCount(ADDRESS)).isZero();
    }
}
