package com.phillippitts.pingwatch.service.probe;

import com.phillippitts.pingwatch.service.process.ProcessFactory;
import com.phillippitts.pingwatch.service.process.ProcessReaper;
import com.phillippitts.pingwatch.util.ProcessTimeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Prober that shells out to the operating system's {@code ping} command for one echo.
 *
 * <p>Useful when the JVM lacks the privilege to send raw ICMP and
 * {@link InetAddressProber} would silently fall back to TCP.
 *
 * <p>CLI contract:
 * <pre>
 * Windows: ping -n 1 -w {timeoutMs} {address}
 * Others:  ping -c 1 -W {timeoutSeconds} {address}
 * </pre>
 * A probe succeeds when the command exits with status 0 and its output contains a
 * {@code time=12.3 ms} (or {@code time<1ms}) token.
 */
public final class SystemPingProber implements Prober {

    private static final Logger LOG = LogManager.getLogger(SystemPingProber.class);

    private static final Pattern RTT_PATTERN = Pattern.compile("time\\s*([=<])\\s*([0-9]+(?:\\.[0-9]+)?)\\s*ms");

    private final ProcessFactory processFactory;
    private final String command;
    private final boolean windows;

    public SystemPingProber(ProcessFactory processFactory, String command, boolean windows) {
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
        this.command = command == null || command.isBlank() ? "ping" : command;
        this.windows = windows;
    }

    @Override
    public ProbeResult probe(String address, long timeoutMs) throws IOException, InterruptedException {
        Process process = processFactory.start(buildCommand(address, timeoutMs));
        try {
            List<String> output = readOutput(process);
            long waitMs = timeoutMs + ProcessTimeouts.PING_COMMAND_GRACE.toMillis();
            if (!process.waitFor(waitMs, TimeUnit.MILLISECONDS)) {
                LOG.debug("ping {} did not exit within {}ms", address, waitMs);
                return ProbeResult.failure();
            }
            if (process.exitValue() != 0) {
                return ProbeResult.failure();
            }
            return parseRtt(output);
        } finally {
            ProcessReaper.destroy(process);
        }
    }

    @Override
    public String name() {
        return "system-ping";
    }

    List<String> buildCommand(String address, long timeoutMs) {
        List<String> cmd = new ArrayList<>();
        cmd.add(command);
        if (windows) {
            cmd.add("-n");
            cmd.add("1");
            cmd.add("-w");
            cmd.add(String.valueOf(timeoutMs));
        } else {
            cmd.add("-c");
            cmd.add("1");
            cmd.add("-W");
            cmd.add(String.valueOf(Math.max(1L, (timeoutMs + 999) / 1000)));
        }
        cmd.add(address);
        return cmd;
    }

    /**
     * Extracts the RTT from ping output; {@code time<1ms} counts as 0ms.
     */
    static ProbeResult parseRtt(List<String> lines) {
        for (String line : lines) {
            Matcher m = RTT_PATTERN.matcher(line);
            if (m.find()) {
                if ("<".equals(m.group(1))) {
                    return ProbeResult.success(0);
                }
                return ProbeResult.success(Math.round(Double.parseDouble(m.group(2))));
            }
        }
        return ProbeResult.failure();
    }

    private static List<String> readOutput(Process process) throws IOException {
        List<String> lines = new ArrayList<>();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), Charset.defaultCharset()))) {
            String line;
            while ((line = reader.readLine()) != null) {
                lines.add(line);
            }
        }
        return lines;
    }
}
