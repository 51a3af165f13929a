package com.phillippitts.pingwatch.presentation.controller;

import com.phillippitts.pingwatch.service.monitor.MonitoringService;
import com.phillippitts.pingwatch.service.trace.TraceOrchestrator;
import com.phillippitts.pingwatch.service.trace.TraceRunInfo;
import com.phillippitts.pingwatch.service.trace.TraceSession;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Trace run commands and per-address output.
 */
@RestController
@RequestMapping("/api/trace")
class TraceController {

    private final TraceOrchestrator orchestrator;
    private final MonitoringService monitoringService;

    TraceController(TraceOrchestrator orchestrator, MonitoringService monitoringService) {
        this.orchestrator = orchestrator;
        this.monitoringService = monitoringService;
    }

    /**
     * Starts a run. Without addresses the trace-selected targets are used; without a timeout
     * the monitoring session's probe timeout is used.
     */
    @PostMapping
    ResponseEntity<TraceRunInfo> start(@RequestBody(required = false) TraceRequest request) {
        List<String> addresses = request == null || request.addresses() == null || request.addresses().isEmpty()
                ? monitoringService.traceSelectedAddresses()
                : request.addresses();
        long timeout = request != null && request.timeoutMs() != null
                ? request.timeoutMs()
                : monitoringService.session().timeoutMs();
        TraceSession session = orchestrator.runTrace(addresses, timeout);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(session.info());
    }

    @PostMapping("/stop")
    ResponseEntity<Map<String, Object>> stop() {
        return ResponseEntity.ok(Map.of("stopped", orchestrator.stopTrace()));
    }

    @GetMapping
    ResponseEntity<TraceRunInfo> current() {
        return orchestrator.currentSession()
                .map(s -> ResponseEntity.ok(s.info()))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/output/{address}")
    ResponseEntity<List<String>> output(@PathVariable String address) {
        return orchestrator.output(address)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    record TraceRequest(List<String> addresses, Long timeoutMs) {}
}
