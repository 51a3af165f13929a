package com.phillippitts.pingwatch.presentation.controller;

import com.phillippitts.pingwatch.config.properties.MonitorProperties;
import com.phillippitts.pingwatch.domain.MonitoringSessionInfo;
import com.phillippitts.pingwatch.domain.TargetDefinition;
import com.phillippitts.pingwatch.domain.TargetSnapshot;
import com.phillippitts.pingwatch.service.monitor.MonitoringService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Monitoring session commands and queries.
 */
@RestController
@RequestMapping("/api/monitor")
class MonitorController {

    private static final Logger LOG = LogManager.getLogger(MonitorController.class);

    private final MonitoringService monitoringService;
    private final MonitorProperties properties;

    MonitorController(MonitoringService monitoringService, MonitorProperties properties) {
        this.monitoringService = monitoringService;
        this.properties = properties;
    }

    @PostMapping("/start")
    ResponseEntity<MonitoringSessionInfo> start(@Valid @RequestBody StartRequest request) {
        long interval = request.intervalMs() != null ? request.intervalMs() : properties.getDefaultIntervalMs();
        long timeout = request.timeoutMs() != null ? request.timeoutMs() : properties.getDefaultTimeoutMs();
        List<TargetDefinition> definitions = new ArrayList<>();
        int sequence = 1;
        for (TargetRequest t : request.targets()) {
            definitions.add(new TargetDefinition(sequence++, t.address(), t.host(), t.traceSelected()));
        }
        LOG.info("Start requested: targets={}", definitions.size());
        return ResponseEntity.ok(monitoringService.startMonitoring(definitions, interval, timeout));
    }

    @PostMapping("/stop")
    ResponseEntity<Map<String, Object>> stop() {
        boolean stopped = monitoringService.stopMonitoring();
        return ResponseEntity.ok(Map.of(
                "stopped", stopped,
                "session", monitoringService.session()
        ));
    }

    @PostMapping("/reset")
    ResponseEntity<MonitoringSessionInfo> reset() {
        monitoringService.resetAll();
        return ResponseEntity.ok(monitoringService.session());
    }

    @PostMapping("/targets/{address}/reset")
    ResponseEntity<List<TargetSnapshot>> resetTarget(@PathVariable String address) {
        monitoringService.resetTarget(address);
        return ResponseEntity.ok(monitoringService.targets());
    }

    @PutMapping("/targets/{address}/trace")
    ResponseEntity<Void> selectForTrace(@PathVariable String address, @RequestParam boolean selected) {
        monitoringService.setTraceSelected(address, selected);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/targets")
    ResponseEntity<List<TargetSnapshot>> targets() {
        return ResponseEntity.ok(monitoringService.targets());
    }

    @GetMapping("/session")
    ResponseEntity<MonitoringSessionInfo> session() {
        return ResponseEntity.ok(monitoringService.session());
    }

    record TargetRequest(String address, String host, boolean traceSelected) {}

    record StartRequest(
            @NotNull List<TargetRequest> targets,
            @Positive Long intervalMs,
            @Positive Long timeoutMs
    ) {}
}
