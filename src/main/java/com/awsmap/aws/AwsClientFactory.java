package com.awsmap.aws;

import com.awsmap.config.AwsMapProperties;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.ProfileCredentialsProvider;
import software.amazon.awssdk.core.SdkClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.account.AccountClient;
import software.amazon.awssdk.services.eventbridge.EventBridgeClient;
import software.amazon.awssdk.services.globalaccelerator.GlobalAcceleratorClient;
import software.amazon.awssdk.services.iam.IamClient;
import software.amazon.awssdk.services.kms.KmsClient;
import software.amazon.awssdk.services.route53.Route53Client;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.sts.StsClient;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Lazily built, shared SDK clients, one per (service, region). SDK clients are thread safe.
 */
@Component
@Slf4j
public class AwsClientFactory {

    private final AwsCredentialsProvider credentialsProvider;
    private final Map<String, SdkClient> clients = new ConcurrentHashMap<>();

    public AwsClientFactory(AwsMapProperties properties) {
        if (StringUtils.hasText(properties.getProfile())) {
            log.info("Using AWS profile '{}'.", properties.getProfile());
            this.credentialsProvider = ProfileCredentialsProvider.create(properties.getProfile());
        } else {
            this.credentialsProvider = DefaultCredentialsProvider.create();
        }
    }

    public S3Client s3(String region) {
        return client("s3", Region.of(region), r -> S3Client.builder()
                .region(r)
                .crossRegionAccessEnabled(true)
                .credentialsProvider(credentialsProvider)
                .build());
    }

    public IamClient iam() {
        return client("iam", Region.AWS_GLOBAL, r -> IamClient.builder()
                .region(r)
                .credentialsProvider(credentialsProvider)
                .build());
    }

    public Route53Client route53() {
        return client("route53", Region.AWS_GLOBAL, r -> Route53Client.builder()
                .region(r)
                .credentialsProvider(credentialsProvider)
                .build());
    }

    // Global Accelerator only serves its API from us-west-2.
    public GlobalAcceleratorClient globalAccelerator() {
        return client("globalaccelerator", Region.US_WEST_2, r -> GlobalAcceleratorClient.builder()
                .region(r)
                .credentialsProvider(credentialsProvider)
                .build());
    }

    public EventBridgeClient eventBridge(String region) {
        return client("events", Region.of(region), r -> EventBridgeClient.builder()
                .region(r)
                .credentialsProvider(credentialsProvider)
                .build());
    }

    public KmsClient kms(String region) {
        return client("kms", Region.of(region), r -> KmsClient.builder()
                .region(r)
                .credentialsProvider(credentialsProvider)
                .build());
    }

    public StsClient sts() {
        return client("sts", Region.US_EAST_1, r -> StsClient.builder()
                .region(r)
                .credentialsProvider(credentialsProvider)
                .build());
    }

    public AccountClient account() {
        return client("account", Region.US_EAST_1, r -> AccountClient.builder()
                .region(r)
                .credentialsProvider(credentialsProvider)
                .build());
    }

    @SuppressWarnings("unchecked")
    private <C extends SdkClient> C client(String service, Region region, Function<Region, C> builder) {
        return (C) clients.computeIfAbsent(service + "@" + region.id(), key -> builder.apply(region));
    }

    @PreDestroy
    public void close() {
        clients.values().forEach(SdkClient::close);
        clients.clear();
    }
}
