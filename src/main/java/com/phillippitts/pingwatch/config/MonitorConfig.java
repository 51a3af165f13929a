package com.phillippitts.pingwatch.config;

import com.phillippitts.pingwatch.config.properties.MonitorProperties;
import com.phillippitts.pingwatch.config.properties.TraceProperties;
import com.phillippitts.pingwatch.service.probe.InetAddressProber;
import com.phillippitts.pingwatch.service.probe.Prober;
import com.phillippitts.pingwatch.service.probe.SystemPingProber;
import com.phillippitts.pingwatch.service.process.DefaultProcessFactory;
import com.phillippitts.pingwatch.service.process.ProcessFactory;
import com.phillippitts.pingwatch.service.trace.TraceCommandBuilder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the monitoring and trace collaborators that depend on the OS or on configuration.
 */
@Configuration
public class MonitorConfig {

    private static final Logger LOG = LogManager.getLogger(MonitorConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public ProcessFactory processFactory() {
        return new DefaultProcessFactory();
    }

    /**
     * Selects the prober from {@code pingwatch.monitor.prober}.
     */
    @Bean
    public Prober prober(MonitorProperties properties, ProcessFactory processFactory) {
        Prober prober = switch (properties.getProber()) {
            case SYSTEM_PING -> new SystemPingProber(processFactory, properties.getPingCommand(), isWindows());
            case INET -> new InetAddressProber();
        };
        LOG.info("Using prober: {}", prober.name());
        return prober;
    }

    @Bean
    public TraceCommandBuilder traceCommandBuilder(TraceProperties properties) {
        TraceCommandBuilder builder = new TraceCommandBuilder(properties, isWindows());
        LOG.info("Using trace command: {}", builder.binary());
        return builder;
    }

    static boolean isWindows() {
        return System.getProperty("os.name", "").toLowerCase().startsWith("windows");
    }
}
