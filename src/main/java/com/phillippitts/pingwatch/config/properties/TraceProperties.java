package com.phillippitts.pingwatch.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for path-trace diagnostics.
 *
 * <p>Example application.properties:
 * <pre>
 * pingwatch.trace.max-concurrent=4
 * pingwatch.trace.min-hop-timeout-ms=100
 * pingwatch.trace.no-resolve=true
 * pingwatch.trace.command=
 * pingwatch.trace.link-to-monitoring=false
 * </pre>
 */
@Validated
@ConfigurationProperties(prefix = "pingwatch.trace")
public class TraceProperties {

    /** Maximum number of trace subprocesses alive at the same time. */
    @Positive(message = "Max concurrent traces must be positive")
    @Max(value = 16, message = "Max concurrent traces must not exceed 16")
    private int maxConcurrent = 4;

    /** Floor for the per-hop timeout derived from the probe timeout. */
    @Min(value = 1, message = "Minimum hop timeout must be at least 1ms")
    private long minHopTimeoutMs = 100;

    /** Skip reverse DNS for hops (-n / -d). */
    private boolean noResolve = true;

    /** Overrides the trace executable; blank means traceroute (or tracert on Windows). */
    private String command = "";

    /** Also stop the trace run when the monitoring session is stopped. */
    private boolean linkToMonitoring = false;

    public int getMaxConcurrent() {
        return maxConcurrent;
    }

    public void setMaxConcurrent(int maxConcurrent) {
        this.maxConcurrent = maxConcurrent;
    }

    public long getMinHopTimeoutMs() {
        return minHopTimeoutMs;
    }

    public void setMinHopTimeoutMs(long minHopTimeoutMs) {
        this.minHopTimeoutMs = minHopTimeoutMs;
    }

    public boolean isNoResolve() {
        return noResolve;
    }

    public void setNoResolve(boolean noResolve) {
        this.noResolve = noResolve;
    }

    public String getCommand() {
        return command;
    }

    public void setCommand(String command) {
        this.command = command;
    }

    public boolean isLinkToMonitoring() {
        return linkToMonitoring;
    }

    public void setLinkToMonitoring(boolean linkToMonitoring) {
        this.linkToMonitoring = linkToMonitoring;
    }
}
