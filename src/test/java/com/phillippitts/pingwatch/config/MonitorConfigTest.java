package com.phillippitts.pingwatch.config;

import com.phillippitts.pingwatch.config.properties.MonitorProperties;
import com.phillippitts.pingwatch.config.properties.TraceProperties;
import com.phillippitts.pingwatch.service.probe.InetAddressProber;
import com.phillippitts.pingwatch.service.probe.SystemPingProber;
import com.phillippitts.pingwatch.testutil.FakeProcess;
import com.phillippitts.pingwatch.testutil.FakeProcessFactory;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MonitorConfigTest {

    private final MonitorConfig config = new MonitorConfig();

    @Test
    void shouldDefaultToInetProber() {
        assertThat(config.prober(new MonitorProperties(), config.processFactory()))
                .isInstanceOf(InetAddressProber.class);
    }

    @Test
    void shouldSelectSystemPingProber() {
        MonitorProperties properties = new MonitorProperties();
        properties.setProber(MonitorProperties.ProberType.SYSTEM_PING);

        assertThat(config.prober(properties, new FakeProcessFactory(a -> FakeProcess.finishedWith())))
                .isInstanceOf(SystemPingProber.class);
    }

    @Test
    void shouldPickTraceBinaryForPlatform() {
        String expected = MonitorConfig.isWindows() ? "tracert" : "traceroute";

        assertThat(config.traceCommandBuilder(new TraceProperties()).binary()).isEqualTo(expected);
    }
}
