package com.awsmap.inventory.catalog;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ServiceCatalogTest {

    private final ServiceCatalog catalog = ServiceCatalog.standard();

    @Test
    void testStandardCatalogListsShippedServicesSorted() {
        assertEquals(List.of("events", "globalaccelerator", "iam", "kms", "route53", "s3"),
                List.copyOf(catalog.allServices()));
    }

    @Test
    void testGlobalServicesArePinnedToControlPlane() {
        assertTrue(catalog.isGlobal("iam"));
        assertEquals("us-east-1", catalog.controlPlaneRegion("iam").orElseThrow());
        assertEquals("us-east-1", catalog.controlPlaneRegion("route53").orElseThrow());
        assertTrue(catalog.isGlobal("globalaccelerator"));
        assertEquals("us-west-2", catalog.controlPlaneRegion("globalaccelerator").orElseThrow());
    }

    @Test
    void testS3IsRegionalAndSelfReporting() {
        assertFalse(catalog.isGlobal("s3"));
        assertTrue(catalog.isRegionSelfReporting("s3"));
        assertTrue(catalog.controlPlaneRegion("s3").isEmpty());
        assertFalse(catalog.isRegionSelfReporting("kms"));
    }

    @Test
    void testDescribeUsesStaticTables() {
        assertEquals(ServiceDescriptor.global("cloudfront", "us-east-1"), ServiceCatalog.describe("cloudfront"));
        assertEquals(ServiceDescriptor.global("networkmanager", "us-west-2"), ServiceCatalog.describe("networkmanager"));
        assertEquals(ServiceDescriptor.regional("ec2"), ServiceCatalog.describe("ec2"));
    }

    @Test
    void testDuplicateEntriesRejected() {
        assertThrows(IllegalArgumentException.class, () -> ServiceCatalog.of(List.of(
                ServiceDescriptor.regional("ec2"), ServiceDescriptor.regional("ec2"))));
    }

    @Test
    void testUnknownServiceLookupRejected() {
        assertFalse(catalog.contains("ec2"));
        assertThrows(IllegalArgumentException.class, () -> catalog.isGlobal("ec2"));
    }

    @Test
    void testInconsistentDescriptorsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ServiceDescriptor("iam", true, null, false));
        assertThrows(IllegalArgumentException.class, () -> new ServiceDescriptor("ec2", false, "us-east-1", false));
        assertThrows(IllegalArgumentException.class, () -> new ServiceDescriptor("iam", true, "us-east-1", true));
        assertThrows(IllegalArgumentException.class, () -> ServiceDescriptor.regional(" "));
    }
}
