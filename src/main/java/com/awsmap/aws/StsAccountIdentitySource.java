package com.awsmap.aws;

import com.awsmap.inventory.AccountIdentitySource;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.sts.model.GetCallerIdentityRequest;

@Component
@RequiredArgsConstructor
public class StsAccountIdentitySource implements AccountIdentitySource {

    private final AwsClientFactory clients;

    @Override
    public String currentAccountId() {
        try {
            return clients.sts().getCallerIdentity(GetCallerIdentityRequest.builder().build()).account();
        } catch (SdkException ex) {
            throw new IllegalStateException("Could not resolve the AWS account of the current credentials: "
                    + ex.getMessage(), ex);
        }
    }
}
