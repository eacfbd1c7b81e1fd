package com.awsmap.api;

import com.awsmap.config.AwsMapProperties;
import com.awsmap.export.CsvReportExporter;
import com.awsmap.export.ReportExporters;
import com.awsmap.inventory.InventoryService;
import com.awsmap.inventory.ScanRequest;
import com.awsmap.inventory.catalog.ServiceCatalog;
import com.awsmap.inventory.catalog.ServiceDescriptor;
import com.awsmap.inventory.model.ResourceRecord;
import com.awsmap.inventory.model.ScanMetadata;
import com.awsmap.inventory.model.ScanResult;
import com.awsmap.run.ScanRun;
import com.awsmap.run.ScanRunRegistry;
import com.awsmap.run.ScanRunStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ScanController.class)
class ScanControllerTest {

    private static final Instant STARTED = Instant.parse("2024-03-05T14:07:09Z");

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private InventoryService inventoryService;

    @MockitoBean
    private ScanRunRegistry runRegistry;

    @MockitoBean
    private ReportExporters reportExporters;

    @MockitoBean
    private AwsMapProperties properties;

    @BeforeEach
    void setUp() {
        when(properties.getWorkers()).thenReturn(40);
    }

    @Test
    void testListServices() throws Exception {
        when(inventoryService.availableServices()).thenReturn(List.of(
                ServiceDescriptor.regional("kms"),
                ServiceDescriptor.global("iam", ServiceCatalog.US_EAST_1)));

        mockMvc.perform(get("/api/services"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value("kms"))
                .andExpect(jsonPath("$[0].global").value(false))
                .andExpect(jsonPath("$[1].controlPlaneRegion").value("us-east-1"));
    }

    @Test
    void testSynchronousScanUsesDefaults() throws Exception {
        when(inventoryService.scan(any(ScanRequest.class))).thenReturn(result());

        mockMvc.perform(post("/api/scans")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"regions\":[\"eu-west-1\"],\"tags\":[\"Env=prod\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.records[0].id").value("logs"))
                .andExpect(jsonPath("$.metadata.accountId").value("123456789012"));

        ArgumentCaptor<ScanRequest> captor = ArgumentCaptor.forClass(ScanRequest.class);
        verify(inventoryService).scan(captor.capture());
        assertEquals(40, captor.getValue().workers());
        assertEquals(List.of("eu-west-1"), captor.getValue().regions());
        assertNull(captor.getValue().timeout());
    }

    @Test
    void testWorkerBoundsValidated() throws Exception {
        mockMvc.perform(post("/api/scans")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"workers\":0}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_FAILED"));

        verify(inventoryService, never()).scan(any(ScanRequest.class));
    }

    @Test
    void testMalformedTagIsBadRequest() throws Exception {
        when(inventoryService.scan(any(ScanRequest.class)))
                .thenThrow(new IllegalArgumentException("Tag filter must use Key=Value format: Env"));

        mockMvc.perform(post("/api/scans")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"tags\":[\"Env\"]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_ARGUMENT"));
    }

    @Test
    void testStartAsyncScan() throws Exception {
        ScanRun run = run("run-1", ScanRunStatus.RUNNING, null);
        when(runRegistry.start(any(ScanRequest.class))).thenReturn(run);

        mockMvc.perform(post("/api/scans/async")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"services\":[\"s3\"],\"timeout\":\"PT5M\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.runId").value("run-1"));
    }

    @Test
    void testRunStatus() throws Exception {
        ScanRun run = run("run-1", ScanRunStatus.RUNNING, null);
        when(run.completedUnits()).thenReturn(7);
        when(runRegistry.find("run-1")).thenReturn(Optional.of(run));

        mockMvc.perform(get("/api/scans/{runId}", "run-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("RUNNING"))
                .andExpect(jsonPath("$.completedUnits").value(7))
                .andExpect(jsonPath("$.result").doesNotExist());
    }

    @Test
    void testUnknownRunIsNotFound() throws Exception {
        when(runRegistry.find("missing")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/scans/{runId}", "missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"));
    }

    @Test
    void testCancelRunningRun() throws Exception {
        ScanRun run = run("run-1", ScanRunStatus.RUNNING, null);
        when(runRegistry.find("run-1")).thenReturn(Optional.of(run));

        mockMvc.perform(post("/api/scans/{runId}/cancel", "run-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("cancel-requested"));

        verify(runRegistry).cancel("run-1");
    }

    @Test
    void testCancelFinishedRun() throws Exception {
        ScanRun run = run("run-1", ScanRunStatus.COMPLETED, result());
        when(runRegistry.find("run-1")).thenReturn(Optional.of(run));

        mockMvc.perform(post("/api/scans/{runId}/cancel", "run-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("finished"));

        verify(runRegistry, never()).cancel("run-1");
    }

    @Test
    void testExportBeforeFinishIsConflict() throws Exception {
        ScanRun run = run("run-1", ScanRunStatus.RUNNING, null);
        when(runRegistry.find("run-1")).thenReturn(Optional.of(run));

        mockMvc.perform(get("/api/scans/{runId}/export", "run-1"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("RUN_NOT_FINISHED"));
    }

    @Test
    void testExportCsv() throws Exception {
        ScanRun run = run("run-1", ScanRunStatus.COMPLETED, result());
        when(runRegistry.find("run-1")).thenReturn(Optional.of(run));
        when(reportExporters.forFormat("csv")).thenReturn(new CsvReportExporter());

        mockMvc.perform(get("/api/scans/{runId}/export", "run-1").param("format", "csv"))
                .andExpect(status().isOk())
                .andExpect(header().string("Content-Disposition",
                        org.hamcrest.Matchers.startsWith("attachment; filename=\"123456789012_inventory_")))
                .andExpect(content().string(org.hamcrest.Matchers.containsString("s3,bucket,logs,logs,eu-west-1")));
    }

    private static ScanRun run(String runId, ScanRunStatus status, ScanResult result) {
        ScanRun run = mock(ScanRun.class);
        when(run.runId()).thenReturn(runId);
        when(run.status()).thenReturn(status);
        when(run.startedAt()).thenReturn(STARTED);
        when(run.result()).thenReturn(result);
        return run;
    }

    private static ScanResult result() {
        ResourceRecord bucket = new ResourceRecord("s3", "bucket", "logs", "arn:aws:s3:::logs", "logs", "eu-west-1",
                Map.of(), Map.of());
        ScanMetadata metadata = new ScanMetadata("123456789012", STARTED, 1.5, 1, 1, 1, 1, 1, Map.of(), List.of(),
                false, List.of());
        return new ScanResult(List.of(bucket), List.of(), metadata);
    }
}
