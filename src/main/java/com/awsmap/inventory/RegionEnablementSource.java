package com.awsmap.inventory;

import java.util.List;

/**
 * Regions enabled for the account. Only consulted when no region filter is given.
 */
@FunctionalInterface
public interface RegionEnablementSource {

    List<String> enabledRegions();
}
