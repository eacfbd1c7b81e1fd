package com.awsmap.api;

import com.awsmap.inventory.catalog.ServiceDescriptor;

public record ServiceInfo(
        String id,
        boolean global,
        String controlPlaneRegion,
        boolean regionSelfReporting
) {
    public static ServiceInfo from(ServiceDescriptor descriptor) {
        return new ServiceInfo(descriptor.id(), descriptor.global(), descriptor.controlPlaneRegion(),
                descriptor.regionSelfReporting());
    }
}
