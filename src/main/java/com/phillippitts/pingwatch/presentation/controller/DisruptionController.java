package com.phillippitts.pingwatch.presentation.controller;

import com.phillippitts.pingwatch.domain.DisruptionEvent;
import com.phillippitts.pingwatch.domain.StatisticsSnapshot;
import com.phillippitts.pingwatch.service.monitor.DisruptionEventLog;
import com.phillippitts.pingwatch.service.monitor.DisruptionSortField;
import com.phillippitts.pingwatch.service.monitor.SortDirection;
import com.phillippitts.pingwatch.service.monitor.SortOrder;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;

/**
 * Read access to the disruption event log and its sort order.
 */
@RestController
@RequestMapping("/api/disruptions")
class DisruptionController {

    private final DisruptionEventLog eventLog;

    DisruptionController(DisruptionEventLog eventLog) {
        this.eventLog = eventLog;
    }

    @GetMapping
    ResponseEntity<DisruptionPage> list() {
        return ResponseEntity.ok(page());
    }

    /**
     * Sorts the log. Without {@code direction}, re-selecting the current field toggles it.
     */
    @PostMapping("/sort")
    ResponseEntity<DisruptionPage> sort(@RequestParam DisruptionSortField field,
                                        @RequestParam(required = false) SortDirection direction) {
        if (direction == null) {
            eventLog.sortBy(field);
        } else {
            eventLog.sortBy(field, direction);
        }
        return ResponseEntity.ok(page());
    }

    private DisruptionPage page() {
        List<DisruptionView> events = eventLog.snapshot().stream().map(DisruptionView::of).toList();
        return new DisruptionPage(eventLog.currentSort().orElse(null), events);
    }

    record DisruptionPage(SortOrder sort, List<DisruptionView> events) {}

    record DisruptionView(
            String address,
            String host,
            Instant downStart,
            Instant recoveryTime,
            int failureCount,
            String duration,
            StatisticsSnapshot preDown,
            StatisticsSnapshot postRecovery,
            boolean closed
    ) {
        static DisruptionView of(DisruptionEvent e) {
            return new DisruptionView(e.getAddress(), e.getHostLabel(), e.getDownStart(), e.getRecoveryTime(),
                    e.getFailureCount(), e.getDurationText(), e.getPreDown(), e.getPostRecovery(), e.isClosed());
        }
    }
}
