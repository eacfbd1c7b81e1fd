package com.awsmap.export;

import com.awsmap.inventory.model.ScanResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class JsonReportExporter implements ReportExporter {

    private final ObjectMapper objectMapper;

    @Override
    public String format() {
        return "json";
    }

    @Override
    public String contentType() {
        return MediaType.APPLICATION_JSON_VALUE;
    }

    @Override
    public String render(ScanResult result) {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("metadata", result.metadata());
        document.put("resources", result.records());
        document.put("errors", result.errors());
        try {
            return objectMapper.writer()
                    .without(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                    .withDefaultPrettyPrinter()
                    .writeValueAsString(document);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to render scan result as JSON", ex);
        }
    }
}
