package com.awsmap.export;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CsvReportExporterTest {

    private final CsvReportExporter exporter = new CsvReportExporter();

    @Test
    void testRendersOneRowPerRecord() {
        String[] lines = exporter.render(ExportFixtures.result()).split("\n");

        assertEquals(3, lines.length);
        assertEquals("service,type,id,name,region,arn,tags", lines[0]);
        assertEquals("iam,role,AROA123,\"say \"\"hi\"\"\",us-east-1,arn:aws:iam::123456789012:role/admin,", lines[1]);
        assertEquals("s3,bucket,logs,logs,eu-west-1,arn:aws:s3:::logs,\"Env=prod; Team=core, platform\"", lines[2]);
    }

    @Test
    void testEscape() {
        assertEquals("", CsvReportExporter.escape(null));
        assertEquals("plain", CsvReportExporter.escape("plain"));
        assertEquals("\"a,b\"", CsvReportExporter.escape("a,b"));
        assertEquals("\"line\nbreak\"", CsvReportExporter.escape("line\nbreak"));
    }
}
