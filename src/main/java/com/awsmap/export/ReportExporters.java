package com.awsmap.export;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

@Component
public class ReportExporters {

    private final Map<String, ReportExporter> byFormat;

    public ReportExporters(List<ReportExporter> exporters) {
        this.byFormat = exporters.stream()
                .collect(Collectors.toMap(ReportExporter::format, Function.identity(), (a, b) -> {
                    throw new IllegalStateException("Two exporters for format " + a.format());
                }, TreeMap::new));
    }

    /**
     * @throws IllegalArgumentException for an unsupported format
     */
    public ReportExporter forFormat(String format) {
        String key = format == null ? "" : format.trim().toLowerCase(Locale.ROOT);
        ReportExporter exporter = byFormat.get(key);
        if (exporter == null) {
            throw new IllegalArgumentException("Unsupported report format '" + format + "'. Supported: "
                    + String.join(", ", byFormat.keySet()));
        }
        return exporter;
    }
}
