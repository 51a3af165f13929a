package com.phillippitts.pingwatch.service.events;

import com.phillippitts.pingwatch.domain.DisruptionEvent;
import com.phillippitts.pingwatch.service.monitor.event.DisruptionRecordedEvent;
import com.phillippitts.pingwatch.service.monitor.event.MonitoringStateChangedEvent;
import com.phillippitts.pingwatch.service.trace.event.TraceErrorEvent;
import com.phillippitts.pingwatch.service.trace.event.TraceTerminatedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Central log sink for monitoring and trace events. Repeated trace errors are throttled to
 * avoid log spam.
 */
@Component
class MonitorEventsListener {
    private static final Logger LOG = LogManager.getLogger(MonitorEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    @EventListener
    void onDisruptionRecorded(DisruptionRecordedEvent e) {
        if (!e.created()) {
            return;
        }
        DisruptionEvent event = e.event();
        LOG.info("Disruption recorded: address={}, host={}, downStart={}, duration={}, failures={}",
                event.getAddress(), event.getHostLabel(), event.getDownStart(),
                event.getDurationText(), event.getFailureCount());
    }

    @EventListener
    void onStateChanged(MonitoringStateChangedEvent e) {
        LOG.info("Monitoring state: {} -> {}", e.previous(), e.current());
    }

    @EventListener
    void onTraceTerminated(TraceTerminatedEvent e) {
        LOG.debug("Trace terminated: runId={}, address={}, outcome={}", e.runId(), e.address(), e.outcome());
    }

    @EventListener
    void onTraceError(TraceErrorEvent e) {
        String key = "trace-" + e.reason() + '-' + e.address();
        if (shouldLog(key)) {
            LOG.warn("Trace {} error: address={}, message={}. Check that the trace command is installed.",
                    e.reason(), e.address(), e.message());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
