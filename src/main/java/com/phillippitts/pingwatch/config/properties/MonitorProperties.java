package com.phillippitts.pingwatch.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for reachability monitoring.
 *
 * <p>Example application.properties:
 * <pre>
 * pingwatch.monitor.default-interval-ms=1000
 * pingwatch.monitor.default-timeout-ms=2000
 * pingwatch.monitor.prober=inet
 * pingwatch.monitor.ping-command=ping
 * pingwatch.monitor.max-targets=256
 * pingwatch.monitor.stop-join-timeout-ms=2000
 * </pre>
 */
@Validated
@ConfigurationProperties(prefix = "pingwatch.monitor")
public class MonitorProperties {

    public enum ProberType { INET, SYSTEM_PING }

    /** Probe interval used when a start request does not specify one. */
    @Positive(message = "Default interval must be positive")
    private long defaultIntervalMs = 1000;

    /** Probe timeout used when a start request does not specify one. */
    @Positive(message = "Default timeout must be positive")
    private long defaultTimeoutMs = 2000;

    /** Probe implementation: InetAddress.isReachable or the OS ping command. */
    @NotNull
    private ProberType prober = ProberType.INET;

    /** Executable used by the system-ping prober. */
    private String pingCommand = "ping";

    /** Upper bound on targets per session; each target owns one probe thread. */
    @Positive
    @Max(value = 1024, message = "At most 1024 targets are supported")
    private int maxTargets = 256;

    /** How long stopMonitoring waits for probe loops to exit. */
    @Positive
    private long stopJoinTimeoutMs = 2000;

    public long getDefaultIntervalMs() {
        return defaultIntervalMs;
    }

    public void setDefaultIntervalMs(long defaultIntervalMs) {
        this.defaultIntervalMs = defaultIntervalMs;
    }

    public long getDefaultTimeoutMs() {
        return defaultTimeoutMs;
    }

    public void setDefaultTimeoutMs(long defaultTimeoutMs) {
        this.defaultTimeoutMs = defaultTimeoutMs;
    }

    public ProberType getProber() {
        return prober;
    }

    public void setProber(ProberType prober) {
        this.prober = prober;
    }

    public String getPingCommand() {
        return pingCommand;
    }

    public void setPingCommand(String pingCommand) {
        this.pingCommand = pingCommand;
    }

    public int getMaxTargets() {
        return maxTargets;
    }

    public void setMaxTargets(int maxTargets) {
        this.maxTargets = maxTargets;
    }

    public long getStopJoinTimeoutMs() {
        return stopJoinTimeoutMs;
    }

    public void setStopJoinTimeoutMs(long stopJoinTimeoutMs) {
        this.stopJoinTimeoutMs = stopJoinTimeoutMs;
    }
}
