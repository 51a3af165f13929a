package com.phillippitts.pingwatch.service.trace;

import com.phillippitts.pingwatch.config.properties.TraceProperties;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Builds the OS trace command line for one address.
 *
 * <p>CLI contract:
 * <pre>
 * Windows: tracert [-d] -w &lt;ms&gt; &lt;address&gt;
 * Others:  traceroute [-n] -w &lt;seconds&gt; &lt;address&gt;
 * </pre>
 * The per-hop timeout is the requested timeout raised to
 * {@code pingwatch.trace.min-hop-timeout-ms}. Seconds are rounded up.
 */
public final class TraceCommandBuilder {

    static final String WINDOWS_BINARY = "tracert";
    static final String UNIX_BINARY = "traceroute";

    private final String binary;
    private final boolean windows;
    private final boolean noResolve;
    private final long minHopTimeoutMs;

    public TraceCommandBuilder(TraceProperties properties, boolean windows) {
        Objects.requireNonNull(properties, "properties");
        String override = properties.getCommand();
        this.windows = windows;
        this.binary = (override == null || override.isBlank())
                ? (windows ? WINDOWS_BINARY : UNIX_BINARY)
                : override.trim();
        this.noResolve = properties.isNoResolve();
        this.minHopTimeoutMs = properties.getMinHopTimeoutMs();
    }

    public List<String> build(String address, long timeoutMs) {
        long hopTimeoutMs = effectiveTimeoutMs(timeoutMs);
        List<String> cmd = new ArrayList<>();
        cmd.add(binary);
        if (windows) {
            if (noResolve) {
                cmd.add("-d");
            }
            cmd.add("-w");
            cmd.add(String.valueOf(hopTimeoutMs));
        } else {
            if (noResolve) {
                cmd.add("-n");
            }
            cmd.add("-w");
            cmd.add(String.valueOf(Math.max(1, (hopTimeoutMs + 999) / 1000)));
        }
        cmd.add(address);
        return cmd;
    }

    public long effectiveTimeoutMs(long timeoutMs) {
        return Math.max(minHopTimeoutMs, timeoutMs);
    }

    /**
     * Start line written to an address's buffer before its subprocess is launched.
     */
    public String banner(String address, long timeoutMs) {
        return "--- " + binary + " " + address + " (timeout=" + effectiveTimeoutMs(timeoutMs)
                + "ms, no-resolve=" + noResolve + ") ---";
    }

    public String binary() {
        return binary;
    }
}
