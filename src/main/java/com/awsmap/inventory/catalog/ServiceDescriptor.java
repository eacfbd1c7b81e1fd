package com.awsmap.inventory.catalog;

import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;

public record ServiceDescriptor(
        String id,
        boolean global,
        @Nullable String controlPlaneRegion,
        boolean regionSelfReporting
) {
    public ServiceDescriptor {
        if (!StringUtils.hasText(id)) {
            throw new IllegalArgumentException("Service id must not be blank.");
        }
        if (global && !StringUtils.hasText(controlPlaneRegion)) {
            throw new IllegalArgumentException("Global service " + id + " needs a control-plane region.");
        }
        if (!global && controlPlaneRegion != null) {
            throw new IllegalArgumentException("Regional service " + id + " cannot declare a control-plane region.");
        }
        if (global && regionSelfReporting) {
            throw new IllegalArgumentException("Global service " + id + " cannot be region self-reporting.");
        }
    }

    public static ServiceDescriptor regional(String id) {
        return new ServiceDescriptor(id, false, null, false);
    }

    public static ServiceDescriptor global(String id, String controlPlaneRegion) {
        return new ServiceDescriptor(id, true, controlPlaneRegion, false);
    }

    /**
     * A service scanned per region whose records carry the region the provider reports for each resource
     * rather than the region the scan ran in.
     */
    public static ServiceDescriptor regionSelfReporting(String id) {
        return new ServiceDescriptor(id, false, null, true);
    }
}
