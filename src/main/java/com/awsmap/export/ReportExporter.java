package com.awsmap.export;

import com.awsmap.inventory.model.ScanResult;

/**
 * Renders a finished {@link ScanResult} as a report document.
 */
public interface ReportExporter {

    /**
     * Format name, also used as the file extension.
     */
    String format();

    String contentType();

    String render(ScanResult result);
}
