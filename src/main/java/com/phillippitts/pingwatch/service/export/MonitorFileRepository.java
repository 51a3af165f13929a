package com.phillippitts.pingwatch.service.export;

import com.phillippitts.pingwatch.config.properties.ExportProperties;
import com.phillippitts.pingwatch.domain.DisruptionEvent;
import com.phillippitts.pingwatch.domain.MonitoringSessionInfo;
import com.phillippitts.pingwatch.domain.StatisticsSnapshot;
import com.phillippitts.pingwatch.domain.TargetDefinition;
import com.phillippitts.pingwatch.domain.TargetSnapshot;
import com.phillippitts.pingwatch.exception.ExportException;
import com.phillippitts.pingwatch.util.LogSanitizer;
import com.phillippitts.pingwatch.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Repository;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Reads and writes the plain-text files of a monitoring session: appended result reports,
 * address lists and trace transcripts.
 *
 * <p>Every {@link IOException} surfaces as an {@link ExportException}.
 */
@Repository
public class MonitorFileRepository {

    private static final Logger LOG = LogManager.getLogger(MonitorFileRepository.class);

    static final String ADDRESS_HEADER = "address,host";
    static final String REPORT_SEPARATOR = "================================================================";
    static final String TRANSCRIPT_SEPARATOR = "----------------------------------------------------------------";
    static final String NO_DISRUPTIONS = "No disruption events recorded.";

    private static final String MONITOR_HEADER = "status,sequence,address,host,send,fail,consecutive fail,"
            + "down time[hh:mm:ss],max down time[hh:mm:ss],rtt[ms],avg[ms],min[ms],max[ms],"
            + "jitter1[ms],jitter2[ms],stddev";
    private static final String DISRUPTION_HEADER = "address,host,down start,recovery,failures,duration[hh:mm:ss],"
            + "pre avg[ms],pre min[ms],pre max[ms],"
            + "post avg[ms],post min[ms],post max[ms],"
            + "pre jitter1,pre jitter2,pre stddev,"
            + "post jitter1,post jitter2,post stddev";
    private static final DateTimeFormatter FILE_DATE = DateTimeFormatter.ofPattern("yyyyMMdd");
    private static final char[] COMMENT_PREFIXES = {'[', '#', ';', '\''};

    private final ExportProperties properties;
    private final Charset charset;
    private final Clock clock;

    public MonitorFileRepository(ExportProperties properties, Clock clock) {
        this.properties = Objects.requireNonNull(properties, "properties");
        this.charset = Charset.forName(properties.getCharset());
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Appends a report block to {@code file}, creating parent folders as needed.
     *
     * @param file report file; relative paths resolve against {@code pingwatch.export.results-dir}
     * @param session session summary (start, end, interval, timeout)
     * @param targets target snapshots, written in sequence order
     * @param events disruption events, written in recovery order
     * @return the file written
     * @throws ExportException on I/O failure
     */
    public Path saveResults(Path file,
                            MonitoringSessionInfo session,
                            List<TargetSnapshot> targets,
                            List<DisruptionEvent> events) {
        Path target = resolve(file, properties.getResultsDir());
        try {
            createParent(target);
            try (BufferedWriter w = Files.newBufferedWriter(target, charset,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
                writeLine(w, REPORT_SEPARATOR);
                writeLine(w, "Saved: " + formatInstant(clock.instant()));
                w.newLine();
                writeLine(w, "Start: " + formatInstant(session.startedAt()));
                writeLine(w, "End: " + formatInstant(session.stoppedAt()));
                writeLine(w, "Interval: " + session.intervalMs() + " [ms]     Timeout: " + session.timeoutMs() + " [ms]");
                w.newLine();

                writeLine(w, "--- Monitoring statistics ---");
                writeLine(w, MONITOR_HEADER);
                List<TargetSnapshot> ordered = new ArrayList<>(targets);
                ordered.sort(Comparator.comparingInt(TargetSnapshot::sequence));
                for (TargetSnapshot t : ordered) {
                    writeLine(w, monitorRow(t));
                }
                w.newLine();
                w.newLine();

                writeLine(w, "--- Disruption event log ---");
                if (events.isEmpty()) {
                    writeLine(w, NO_DISRUPTIONS);
                } else {
                    writeLine(w, DISRUPTION_HEADER);
                    List<DisruptionEvent> byRecovery = new ArrayList<>(events);
                    byRecovery.sort(Comparator.comparing(DisruptionEvent::getRecoveryTime));
                    for (DisruptionEvent e : byRecovery) {
                        writeLine(w, disruptionRow(e));
                    }
                }
                w.newLine();
            }
        } catch (IOException e) {
            throw new ExportException("Failed to save monitoring results", target, e);
        }
        LOG.info("Saved monitoring results: file={}, targets={}, events={}", target, targets.size(), events.size());
        return target;
    }

    /**
     * Writes the address list as {@code address,host} CSV with a header line.
     *
     * @throws ExportException on I/O failure
     */
    public Path saveAddresses(Path file, List<TargetDefinition> targets) {
        Path target = resolve(file, properties.getResultsDir());
        try {
            createParent(target);
            try (BufferedWriter w = Files.newBufferedWriter(target, charset)) {
                writeLine(w, ADDRESS_HEADER);
                for (TargetDefinition t : targets) {
                    if (t.address().isEmpty() && t.hostLabel().isEmpty()) {
                        continue;
                    }
                    writeLine(w, csvField(t.address()) + "," + csvField(t.hostLabel()));
                }
            }
        } catch (IOException e) {
            throw new ExportException("Failed to save address list", target, e);
        }
        LOG.info("Saved address list: file={}, targets={}", target, targets.size());
        return target;
    }

    /**
     * Loads an address list.
     *
     * <p>Accepted line formats:
     * <ul>
     *   <li>the CSV written by {@link #saveAddresses} (detected by its header)</li>
     *   <li>{@code address host words...} separated by spaces or tabs</li>
     *   <li>{@code address,host}</li>
     *   <li>a bare address</li>
     * </ul>
     * Blank lines and lines starting with {@code [ # ; '} are skipped. Sequence numbers
     * start at 1.
     *
     * @throws ExportException on I/O failure
     */
    public List<TargetDefinition> loadAddresses(Path file) {
        List<String> lines;
        try {
            lines = new ArrayList<>(Files.readAllLines(file, charset));
        } catch (IOException e) {
            throw new ExportException("Failed to load address list", file, e);
        }

        boolean savedCsv = false;
        if (!lines.isEmpty() && lines.get(0).trim().replace(" ", "").equalsIgnoreCase(ADDRESS_HEADER)) {
            lines.remove(0);
            savedCsv = true;
        }

        List<TargetDefinition> result = new ArrayList<>();
        int sequence = 1;
        for (String line : lines) {
            String trimmed = line.trim();
            if (trimmed.isEmpty() || isComment(trimmed)) {
                continue;
            }
            String[] parsed = savedCsv ? splitComma(trimmed) : parseFreeForm(trimmed);
            if (parsed[0].isEmpty()) {
                continue;
            }
            result.add(new TargetDefinition(sequence++, parsed[0], parsed[1]));
        }
        LOG.info("Loaded address list: file={}, targets={}, format={}", file, result.size(), savedCsv ? "csv" : "free-form");
        return result;
    }

    /**
     * Appends a trace transcript to
     * {@code Traceroute_result_<yyyyMMdd>_<address>_<host>.log} in {@code folder}.
     *
     * @return the file written, empty when {@code content} is empty
     * @throws ExportException on I/O failure
     */
    public Optional<Path> saveTraceTranscript(Path folder, String address, String host, String content) {
        if (content == null || content.isEmpty()) {
            return Optional.empty();
        }
        Path dir = folder == null ? Path.of(properties.getTraceDir()) : folder;
        Instant now = clock.instant();
        String fileName = "Traceroute_result_" + FILE_DATE.format(now.atZone(clock.getZone()))
                + "_" + LogSanitizer.sanitizeFileName(address)
                + "_" + LogSanitizer.sanitizeFileName(host) + ".log";
        Path target = dir.resolve(fileName);
        try {
            Files.createDirectories(dir);
            try (BufferedWriter w = Files.newBufferedWriter(target, charset,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
                writeLine(w, TRANSCRIPT_SEPARATOR);
                writeLine(w, "Saved: " + formatInstant(now));
                writeLine(w, content);
                w.newLine();
            }
        } catch (IOException e) {
            throw new ExportException("Failed to save trace transcript", target, e);
        }
        LOG.info("Saved trace transcript: file={}", target);
        return Optional.of(target);
    }

    private String monitorRow(TargetSnapshot t) {
        StatisticsSnapshot s = t.session();
        return String.join(",",
                t.statusLabel(),
                String.valueOf(t.sequence()),
                csvField(t.address()),
                csvField(t.hostLabel()),
                String.valueOf(t.sendCount()),
                String.valueOf(t.failCount()),
                String.valueOf(t.consecutiveFailCount()),
                TimeUtils.formatDuration(t.currentDownDuration()),
                TimeUtils.formatDuration(t.maxDisruptionDuration()),
                String.valueOf(t.currentRtt()),
                f1(s.average()),
                String.valueOf(s.min()),
                String.valueOf(s.max()),
                String.valueOf(s.jitterMaxMin()),
                f1(s.jitterPairAverage()),
                f2(s.standardDeviation()));
    }

    private String disruptionRow(DisruptionEvent e) {
        StatisticsSnapshot pre = e.getPreDown();
        StatisticsSnapshot post = e.getPostRecovery();
        return String.join(",",
                csvField(e.getAddress()),
                csvField(e.getHostLabel()),
                formatInstant(e.getDownStart()),
                formatInstant(e.getRecoveryTime()),
                String.valueOf(e.getFailureCount()),
                e.getDurationText(),
                f1(pre.average()), String.valueOf(pre.min()), String.valueOf(pre.max()),
                f1(post.average()), String.valueOf(post.min()), String.valueOf(post.max()),
                String.valueOf(pre.jitterMaxMin()), f1(pre.jitterPairAverage()), f2(pre.standardDeviation()),
                String.valueOf(post.jitterMaxMin()), f1(post.jitterPairAverage()), f2(post.standardDeviation()));
    }

    static String[] parseFreeForm(String line) {
        int separator = -1;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == ' ' || c == '\t') {
                separator = i;
                break;
            }
        }
        if (separator != -1) {
            String address = line.substring(0, separator).trim();
            String host = line.substring(separator).trim().replaceAll("\\s+", " ");
            return new String[] {address, host};
        }
        if (line.indexOf(',') >= 0) {
            return splitComma(line);
        }
        return new String[] {line, ""};
    }

    private static String[] splitComma(String line) {
        String[] parts = line.split(",", 2);
        return new String[] {unquote(parts[0].trim()), parts.length > 1 ? unquote(parts[1].trim()) : ""};
    }

    /**
     * Quotes a field containing a comma, quote or line break, doubling embedded quotes.
     */
    static String csvField(String value) {
        if (value.indexOf(',') < 0 && value.indexOf('"') < 0
                && value.indexOf('\n') < 0 && value.indexOf('\r') < 0) {
            return value;
        }
        return '"' + value.replace("\"", "\"\"") + '"';
    }

    private static String unquote(String field) {
        if (field.length() >= 2 && field.startsWith("\"") && field.endsWith("\"")) {
            return field.substring(1, field.length() - 1).replace("\"\"", "\"").trim();
        }
        return field;
    }

    private static boolean isComment(String trimmed) {
        char first = trimmed.charAt(0);
        for (char prefix : COMMENT_PREFIXES) {
            if (first == prefix) {
                return true;
            }
        }
        return false;
    }

    private static Path resolve(Path file, String defaultDir) {
        Objects.requireNonNull(file, "file");
        if (file.isAbsolute() || file.getParent() != null) {
            return file;
        }
        return Path.of(defaultDir).resolve(file);
    }

    private static void createParent(Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }

    private static void writeLine(BufferedWriter w, String line) throws IOException {
        w.write(line);
        w.newLine();
    }

    private static String formatInstant(Instant instant) {
        return instant == null ? "" : TimeUtils.TIMESTAMP_FORMAT.format(instant);
    }

    private static String f1(double v) {
        return String.format(Locale.ROOT, "%.1f", v);
    }

    private static String f2(double v) {
        return String.format(Locale.ROOT, "%.2f", v);
    }
}
