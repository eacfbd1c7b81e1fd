package com.awsmap.cli;

import com.awsmap.config.AwsMapProperties;
import com.awsmap.export.ReportExporter;
import com.awsmap.export.ReportExporters;
import com.awsmap.export.ReportFileNames;
import com.awsmap.inventory.InventoryService;
import com.awsmap.inventory.ScanRequest;
import com.awsmap.inventory.execution.ScanCancellation;
import com.awsmap.inventory.execution.ScanProgressListener;
import com.awsmap.inventory.execution.ServiceProgress;
import com.awsmap.inventory.model.ScanResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * One-shot scan driven by {@code awsmap.*} properties. Run with
 * {@code --awsmap.cli.enabled=true --spring.main.web-application-type=none}.
 */
@Component
@Slf4j
@ConditionalOnProperty(prefix = "awsmap.cli", name = "enabled", havingValue = "true")
public class InventoryCommandLineRunner implements CommandLineRunner {

    private final InventoryService inventoryService;
    private final ReportExporters reportExporters;
    private final AwsMapProperties properties;

    public InventoryCommandLineRunner(InventoryService inventoryService,
                                      ReportExporters reportExporters,
                                      AwsMapProperties properties) {
        this.inventoryService = inventoryService;
        this.reportExporters = reportExporters;
        this.properties = properties;
    }

    @Override
    public void run(String... args) throws IOException {
        ReportExporter exporter = reportExporters.forFormat(properties.getCli().getFormat());
        ScanRequest request = new ScanRequest(
                properties.getScan().getRegions(),
                properties.getScan().getServices(),
                properties.getScan().getTags(),
                properties.getWorkers(),
                properties.isIncludeGlobal(),
                properties.isTimings(),
                null);

        ScanCancellation cancellation = ScanCancellation.create();
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            if (cancellation.cancel()) {
                log.warn("Interrupted: no further work units will be dispatched.");
            }
        }, "scan-interrupt"));

        ScanResult result = inventoryService.scan(request, cancellation, new ProgressLogger());
        Path output = outputPath(result, exporter);
        Files.writeString(output, exporter.render(result), StandardCharsets.UTF_8);
        log.info("Output saved to: {}", output.toAbsolutePath());
    }

    private Path outputPath(ScanResult result, ReportExporter exporter) {
        String configured = properties.getCli().getOutput();
        if (StringUtils.hasText(configured)) {
            return Path.of(configured);
        }
        return Path.of(ReportFileNames.defaultFileName(result.metadata().accountId(), result.metadata().timestamp(),
                exporter.format()));
    }

    static class ProgressLogger implements ScanProgressListener {
        @Override
        public void serviceCompleted(ServiceProgress progress) {
            if (progress.failedUnits() > 0) {
                log.info("{}: Done: {} resources ({} of {} units failed)", progress.service(), progress.resources(),
                        progress.failedUnits(), progress.totalUnits());
            } else {
                log.info("{}: Done: {} resources", progress.service(), progress.resources());
            }
        }
    }
}
