package com.awsmap.inventory.plan;

import com.awsmap.inventory.catalog.ServiceCatalog;
import com.awsmap.inventory.collector.Collector;
import com.awsmap.inventory.collector.CollectorRegistry;
import com.awsmap.inventory.model.WorkUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RegionResolverTest {

    private static final List<String> ENABLED = List.of("us-east-1", "us-west-2", "eu-west-1");

    private RegionResolver resolver;

    @BeforeEach
    void setUp() {
        ServiceCatalog catalog = ServiceCatalog.of(List.of(
                ServiceCatalog.describe("ec2"),
                ServiceCatalog.describe("s3"),
                ServiceCatalog.describe("iam"),
                ServiceCatalog.describe("globalaccelerator")));
        Map<String, Collector> collectors = new LinkedHashMap<>();
        catalog.allServices().forEach(service -> collectors.put(service, region -> List.of()));
        resolver = new RegionResolver(catalog, new CollectorRegistry(catalog, collectors));
    }

    @Test
    void testFullScanCoversEnabledRegionsAndGlobalsOnce() {
        ScanPlan plan = resolver.plan(ENABLED, List.of(), List.of(), false);

        assertEquals(List.of(
                "ec2@us-east-1", "ec2@us-west-2", "ec2@eu-west-1",
                "globalaccelerator@us-west-2",
                "iam@us-east-1",
                "s3@us-east-1", "s3@us-west-2", "s3@eu-west-1"), labels(plan));
        assertFalse(plan.regionFilterRequested());
        assertEquals(ENABLED, plan.effectiveRegions());
    }

    @Test
    void testRegionFilterWithoutControlPlaneSkipsGlobals() {
        ScanPlan plan = resolver.plan(ENABLED, List.of("eu-west-1"), List.of(), false);

        assertEquals(List.of("ec2@eu-west-1", "s3@eu-west-1"), labels(plan));
        assertTrue(plan.regionFilterRequested());
    }

    @Test
    void testRegionFilterContainingControlPlaneKeepsThatGlobal() {
        ScanPlan plan = resolver.plan(ENABLED, List.of("us-east-1"), List.of("iam", "globalaccelerator"), false);

        assertEquals(List.of("iam@us-east-1"), labels(plan));
    }

    @Test
    void testIncludeGlobalForcesGlobalsIntoFilteredScan() {
        ScanPlan plan = resolver.plan(ENABLED, List.of("eu-west-1"), List.of("iam", "globalaccelerator", "ec2"), true);

        assertEquals(List.of("ec2@eu-west-1", "globalaccelerator@us-west-2", "iam@us-east-1"), labels(plan));
    }

    @Test
    void testGlobalUnitIsNeverDuplicatedAcrossRegions() {
        ScanPlan plan = resolver.plan(ENABLED, List.of("us-east-1", "us-west-2"), List.of("iam"), true);

        assertEquals(List.of("iam@us-east-1"), labels(plan));
    }

    @Test
    void testUnknownServicesRejectedIndividually() {
        ScanPlan plan = resolver.plan(ENABLED, List.of("eu-west-1"), List.of("ec2", "nosuchservice", "lambda"), false);

        assertEquals(List.of("ec2@eu-west-1"), labels(plan));
        assertEquals(List.of("nosuchservice", "lambda"), plan.rejectedServices());
        assertEquals(List.of("ec2"), plan.services());
    }

    @Test
    void testEmptyRegionSetStillEvaluatesGlobals() {
        ScanPlan plan = resolver.plan(List.of(), List.of(), List.of(), false);

        assertEquals(List.of("globalaccelerator@us-west-2", "iam@us-east-1"), labels(plan));
        assertTrue(plan.effectiveRegions().isEmpty());
    }

    @Test
    void testRequestedValuesAreNormalized() {
        ScanPlan plan = resolver.plan(ENABLED, List.of(" EU-WEST-1 ,eu-west-1"), List.of("EC2, s3", "ec2"), false);

        assertEquals(List.of("ec2@eu-west-1", "s3@eu-west-1"), labels(plan));
        assertEquals(List.of("eu-west-1"), plan.effectiveRegions());
    }

    @Test
    void testBlankEntriesNormalizeToEmpty() {
        assertEquals(List.of(), RegionResolver.normalize(List.of("", " ", ",")));
        assertEquals(List.of(), RegionResolver.normalize(null));
        assertEquals(List.of("eu-west-1", "us-east-1"), RegionResolver.normalize(List.of(" EU-West-1,us-east-1", "eu-west-1")));
    }

    @Test
    void testUnitsCarryTheirCollector() {
        ScanPlan plan = resolver.plan(ENABLED, List.of("eu-west-1"), List.of("ec2"), false);

        WorkUnit unit = plan.units().get(0);
        assertNotNull(unit.collector());
        assertTrue(plan.inScope("eu-west-1"));
        assertFalse(plan.inScope("us-east-1"));
    }

    private static List<String> labels(ScanPlan plan) {
        return plan.units().stream().map(WorkUnit::label).toList();
    }
}
