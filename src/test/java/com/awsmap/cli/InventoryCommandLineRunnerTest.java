package com.awsmap.cli;

import com.awsmap.config.AwsMapProperties;
import com.awsmap.export.CsvReportExporter;
import com.awsmap.export.ReportExporters;
import com.awsmap.inventory.InventoryService;
import com.awsmap.inventory.ScanRequest;
import com.awsmap.inventory.execution.ScanCancellation;
import com.awsmap.inventory.execution.ScanProgressListener;
import com.awsmap.inventory.model.ResourceRecord;
import com.awsmap.inventory.model.ScanMetadata;
import com.awsmap.inventory.model.ScanResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class InventoryCommandLineRunnerTest {

    @TempDir
    Path tempDir;

    @Test
    void testWritesReportToConfiguredOutput() throws Exception {
        InventoryService inventoryService = mock(InventoryService.class);
        ScanMetadata metadata = new ScanMetadata("123456789012", Instant.now(), 1.0, 1, 1, 1, 1, 1, Map.of(),
                List.of(), false, List.of());
        ResourceRecord key = new ResourceRecord("kms", "key", "k-1", null, null, "eu-west-1", Map.of(), Map.of());
        when(inventoryService.scan(any(ScanRequest.class), any(ScanCancellation.class), any(ScanProgressListener.class)))
                .thenReturn(new ScanResult(List.of(key), List.of(), metadata));

        AwsMapProperties properties = new AwsMapProperties();
        properties.setWorkers(8);
        properties.getScan().setRegions(List.of("eu-west-1"));
        properties.getCli().setFormat("csv");
        Path output = tempDir.resolve("inventory.csv");
        properties.getCli().setOutput(output.toString());

        new InventoryCommandLineRunner(inventoryService, new ReportExporters(List.of(new CsvReportExporter())), properties)
                .run();

        ArgumentCaptor<ScanRequest> request = ArgumentCaptor.forClass(ScanRequest.class);
        verify(inventoryService).scan(request.capture(), any(ScanCancellation.class), any(ScanProgressListener.class));
        assertEquals(8, request.getValue().workers());
        assertEquals(List.of("eu-west-1"), request.getValue().regions());
        assertEquals("service,type,id,name,region,arn,tags\nkms,key,k-1,,eu-west-1,,\n", Files.readString(output));
    }

    @Test
    void testUnknownFormatFailsBeforeScanning() {
        InventoryService inventoryService = mock(InventoryService.class);
        AwsMapProperties properties = new AwsMapProperties();
        properties.getCli().setFormat("xml");

        InventoryCommandLineRunner runner = new InventoryCommandLineRunner(inventoryService,
                new ReportExporters(List.of(new CsvReportExporter())), properties);

        assertThrows(IllegalArgumentException.class, runner::run);
        verifyNoInteractions(inventoryService);
    }
}
