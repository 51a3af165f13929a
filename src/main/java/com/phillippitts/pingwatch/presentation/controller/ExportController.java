package com.phillippitts.pingwatch.presentation.controller;

import com.phillippitts.pingwatch.domain.TargetDefinition;
import com.phillippitts.pingwatch.domain.TargetSnapshot;
import com.phillippitts.pingwatch.service.export.MonitorFileRepository;
import com.phillippitts.pingwatch.service.monitor.DisruptionEventLog;
import com.phillippitts.pingwatch.service.monitor.MonitoringService;
import com.phillippitts.pingwatch.service.trace.TraceOrchestrator;
import com.phillippitts.pingwatch.service.trace.TraceSession;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Report, address list and trace transcript files.
 */
@RestController
@RequestMapping("/api/export")
class ExportController {

    private final MonitorFileRepository repository;
    private final MonitoringService monitoringService;
    private final DisruptionEventLog eventLog;
    private final TraceOrchestrator traceOrchestrator;

    ExportController(MonitorFileRepository repository,
                     MonitoringService monitoringService,
                     DisruptionEventLog eventLog,
                     TraceOrchestrator traceOrchestrator) {
        this.repository = repository;
        this.monitoringService = monitoringService;
        this.eventLog = eventLog;
        this.traceOrchestrator = traceOrchestrator;
    }

    @PostMapping("/results")
    ResponseEntity<Map<String, String>> saveResults(@Valid @RequestBody PathRequest request) {
        Path written = repository.saveResults(Path.of(request.path()), monitoringService.session(),
                monitoringService.targets(), eventLog.snapshot());
        return ResponseEntity.ok(Map.of("path", written.toString()));
    }

    /**
     * Saves the transcript of every address of the current or last trace run.
     */
    @PostMapping("/trace")
    ResponseEntity<List<String>> saveTrace(@RequestBody(required = false) FolderRequest request) {
        Path folder = request == null || request.folder() == null || request.folder().isBlank()
                ? null
                : Path.of(request.folder());
        Map<String, String> hosts = monitoringService.targets().stream()
                .collect(Collectors.toMap(TargetSnapshot::address, TargetSnapshot::hostLabel, (a, b) -> a));
        List<String> written = new ArrayList<>();
        traceOrchestrator.currentSession().ifPresent(session -> {
            for (String address : session.addresses()) {
                saveTranscript(session, folder, address, hosts.getOrDefault(address, ""))
                        .ifPresent(p -> written.add(p.toString()));
            }
        });
        return ResponseEntity.ok(written);
    }

    @PostMapping("/addresses")
    ResponseEntity<Map<String, String>> saveAddresses(@Valid @RequestBody PathRequest request) {
        List<TargetDefinition> definitions = monitoringService.targets().stream()
                .map(t -> new TargetDefinition(t.sequence(), t.address(), t.hostLabel(), t.traceSelected()))
                .toList();
        Path written = repository.saveAddresses(Path.of(request.path()), definitions);
        return ResponseEntity.ok(Map.of("path", written.toString()));
    }

    @PostMapping("/addresses/load")
    ResponseEntity<List<TargetDefinition>> loadAddresses(@Valid @RequestBody PathRequest request) {
        return ResponseEntity.ok(repository.loadAddresses(Path.of(request.path())));
    }

    private Optional<Path> saveTranscript(TraceSession session, Path folder, String address, String host) {
        return session.transcript(address)
                .flatMap(content -> repository.saveTraceTranscript(folder, address, host, content));
    }

    record PathRequest(@NotBlank String path) {}

    record FolderRequest(String folder) {}
}
