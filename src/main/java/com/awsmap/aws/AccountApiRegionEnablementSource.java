package com.awsmap.aws;

import com.awsmap.inventory.RegionEnablementSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.account.AccountClient;
import software.amazon.awssdk.services.account.model.ListRegionsRequest;
import software.amazon.awssdk.services.account.model.ListRegionsResponse;
import software.amazon.awssdk.services.account.model.RegionOptStatus;

import java.util.ArrayList;
import java.util.List;

/**
 * Enabled regions from the Account API: regions enabled by default plus opted-in ones.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class AccountApiRegionEnablementSource implements RegionEnablementSource {

    private final AwsClientFactory clients;

    @Override
    public List<String> enabledRegions() {
        AccountClient account = clients.account();
        List<String> regions = new ArrayList<>();
        String token = null;
        do {
            ListRegionsResponse page = account.listRegions(ListRegionsRequest.builder()
                    .regionOptStatusContains(RegionOptStatus.ENABLED, RegionOptStatus.ENABLED_BY_DEFAULT)
                    .nextToken(token)
                    .build());
            page.regions().forEach(region -> regions.add(region.regionName()));
            token = page.nextToken();
        } while (token != null);
        log.debug("Account has {} enabled regions.", regions.size());
        return regions;
    }
}
