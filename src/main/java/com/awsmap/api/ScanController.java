package com.awsmap.api;

import com.awsmap.config.AwsMapProperties;
import com.awsmap.export.ReportExporter;
import com.awsmap.export.ReportExporters;
import com.awsmap.export.ReportFileNames;
import com.awsmap.inventory.InventoryService;
import com.awsmap.inventory.model.ScanResult;
import com.awsmap.run.ScanRun;
import com.awsmap.run.ScanRunRegistry;
import jakarta.validation.Valid;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api")
public class ScanController {

    private final InventoryService inventoryService;
    private final ScanRunRegistry runRegistry;
    private final ReportExporters reportExporters;
    private final AwsMapProperties properties;

    public ScanController(InventoryService inventoryService,
                          ScanRunRegistry runRegistry,
                          ReportExporters reportExporters,
                          AwsMapProperties properties) {
        this.inventoryService = inventoryService;
        this.runRegistry = runRegistry;
        this.reportExporters = reportExporters;
        this.properties = properties;
    }

    @PostMapping("/scans")
    public ScanResult scan(@Valid @RequestBody ScanRequestBody request) {
        return inventoryService.scan(request.toScanRequest(properties));
    }

    @PostMapping("/scans/async")
    public ScanStartResponse startScan(@Valid @RequestBody ScanRequestBody request) {
        ScanRun run = runRegistry.start(request.toScanRequest(properties));
        return new ScanStartResponse(run.runId(), run.startedAt());
    }

    @GetMapping("/scans/{runId}")
    public ScanStatusResponse status(@PathVariable String runId) {
        return ScanStatusResponse.from(findRun(runId));
    }

    @PostMapping("/scans/{runId}/cancel")
    public CancelRunResponse cancel(@PathVariable String runId) {
        ScanRun run = findRun(runId);
        if (run.status().finished()) {
            return CancelRunResponse.alreadyFinished(runId);
        }
        runRegistry.cancel(runId);
        return CancelRunResponse.requested(runId);
    }

    @GetMapping("/scans/{runId}/export")
    public ResponseEntity<String> export(@PathVariable String runId,
                                         @RequestParam(defaultValue = "json") String format) {
        ScanRun run = findRun(runId);
        ScanResult result = run.result();
        if (result == null) {
            throw new RunNotFinishedException(runId, run.status());
        }
        ReportExporter exporter = reportExporters.forFormat(format);
        String fileName = ReportFileNames.defaultFileName(result.metadata().accountId(),
                result.metadata().timestamp(), exporter.format());
        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(exporter.contentType()))
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + fileName + "\"")
                .body(exporter.render(result));
    }

    @GetMapping("/services")
    public List<ServiceInfo> services() {
        return inventoryService.availableServices().stream()
                .map(ServiceInfo::from)
                .toList();
    }

    private ScanRun findRun(String runId) {
        return runRegistry.find(runId).orElseThrow(() -> new UnknownRunException(runId));
    }
}
