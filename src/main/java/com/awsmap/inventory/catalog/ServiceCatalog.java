package com.awsmap.inventory.catalog;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Static, read-only metadata for every service the inventory knows how to scan.
 *
 * <p>Global services are scanned once per account and attributed to their control-plane region.
 * See https://docs.aws.amazon.com/whitepapers/latest/aws-fault-isolation-boundaries/global-services.html
 */
public final class ServiceCatalog {

    public static final String US_EAST_1 = "us-east-1";
    public static final String US_WEST_2 = "us-west-2";

    public static final List<String> US_EAST_1_GLOBAL_SERVICES = List.of(
            "iam", "organizations", "route53", "route53domains", "cloudfront", "shield", "budgets", "ce", "health");
    public static final List<String> US_WEST_2_GLOBAL_SERVICES = List.of(
            "networkmanager", "globalaccelerator");

    public static final List<String> REGION_SELF_REPORTING_SERVICES = List.of("s3");

    // Services with a collector in this build.
    private static final List<String> SHIPPED_SERVICES = List.of(
            "events", "globalaccelerator", "iam", "kms", "route53", "s3");

    private final Map<String, ServiceDescriptor> descriptors;

    private ServiceCatalog(Map<String, ServiceDescriptor> descriptors) {
        this.descriptors = Collections.unmodifiableMap(descriptors);
    }

    public static ServiceCatalog of(Collection<ServiceDescriptor> entries) {
        Map<String, ServiceDescriptor> byId = new TreeMap<>();
        for (ServiceDescriptor entry : entries) {
            if (byId.putIfAbsent(entry.id(), entry) != null) {
                throw new IllegalArgumentException("Duplicate catalog entry for service " + entry.id());
            }
        }
        return new ServiceCatalog(byId);
    }

    public static ServiceCatalog standard() {
        return of(SHIPPED_SERVICES.stream().map(ServiceCatalog::describe).toList());
    }

    /**
     * Builds the descriptor for a service id from the static global / self-reporting tables. Services in
     * neither table are regional.
     */
    public static ServiceDescriptor describe(String serviceId) {
        if (US_EAST_1_GLOBAL_SERVICES.contains(serviceId)) {
            return ServiceDescriptor.global(serviceId, US_EAST_1);
        }
        if (US_WEST_2_GLOBAL_SERVICES.contains(serviceId)) {
            return ServiceDescriptor.global(serviceId, US_WEST_2);
        }
        if (REGION_SELF_REPORTING_SERVICES.contains(serviceId)) {
            return ServiceDescriptor.regionSelfReporting(serviceId);
        }
        return ServiceDescriptor.regional(serviceId);
    }

    public boolean contains(String service) {
        return descriptors.containsKey(service);
    }

    public boolean isGlobal(String service) {
        return descriptor(service).global();
    }

    public Optional<String> controlPlaneRegion(String service) {
        return Optional.ofNullable(descriptor(service).controlPlaneRegion());
    }

    public boolean isRegionSelfReporting(String service) {
        return descriptor(service).regionSelfReporting();
    }

    public SortedSet<String> allServices() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(descriptors.keySet()));
    }

    public Collection<ServiceDescriptor> descriptors() {
        return descriptors.values();
    }

    public ServiceDescriptor descriptor(String service) {
        ServiceDescriptor descriptor = descriptors.get(service);
        if (descriptor == null) {
            throw new IllegalArgumentException("Service not in catalog: " + service);
        }
        return descriptor;
    }
}
