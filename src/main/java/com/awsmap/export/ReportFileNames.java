package com.awsmap.export;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

public final class ReportFileNames {

    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private ReportFileNames() {
    }

    /**
     * {@code <account>_inventory_<yyyyMMdd_HHmmss>.<format>}, stamped in the local time zone.
     */
    public static String defaultFileName(String accountId, Instant timestamp, String format) {
        return accountId + "_inventory_" + STAMP.format(timestamp.atZone(ZoneId.systemDefault())) + "." + format;
    }
}
