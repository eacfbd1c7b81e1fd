package com.awsmap.export;

import com.awsmap.inventory.model.ResourceRecord;
import com.awsmap.inventory.model.ScanResult;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * One row per resource: service, type, id, name, region, arn, tags. Tags are flattened to
 * {@code k=v; k2=v2}.
 */
@Component
public class CsvReportExporter implements ReportExporter {

    static final List<String> COLUMNS = List.of("service", "type", "id", "name", "region", "arn", "tags");

    @Override
    public String format() {
        return "csv";
    }

    @Override
    public String contentType() {
        return "text/csv";
    }

    @Override
    public String render(ScanResult result) {
        StringBuilder csv = new StringBuilder(String.join(",", COLUMNS)).append('\n');
        for (ResourceRecord record : result.records()) {
            String tags = record.tags().entrySet().stream()
                    .map(tag -> tag.getKey() + "=" + tag.getValue())
                    .collect(Collectors.joining("; "));
            csv.append(row(record.service(), record.type(), record.id(), record.name(), record.region(),
                    record.arn(), tags)).append('\n');
        }
        return csv.toString();
    }

    private String row(String... cells) {
        StringBuilder row = new StringBuilder();
        for (int i = 0; i < cells.length; i++) {
            if (i > 0) {
                row.append(',');
            }
            row.append(escape(cells[i]));
        }
        return row.toString();
    }

    static String escape(String value) {
        if (value == null) {
            return "";
        }
        if (value.indexOf(',') < 0 && value.indexOf('"') < 0 && value.indexOf('\n') < 0 && value.indexOf('\r') < 0) {
            return value;
        }
        return '"' + value.replace("\"", "\"\"") + '"';
    }
}
