package com.awsmap.aws.collectors;

import com.awsmap.aws.AwsClientFactory;
import com.awsmap.inventory.catalog.ServiceCatalog;
import com.awsmap.inventory.collector.RunScope;
import com.awsmap.inventory.model.ResourceRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.Bucket;
import software.amazon.awssdk.services.s3.model.GetBucketEncryptionRequest;
import software.amazon.awssdk.services.s3.model.GetBucketEncryptionResponse;
import software.amazon.awssdk.services.s3.model.GetBucketLocationRequest;
import software.amazon.awssdk.services.s3.model.GetBucketTaggingRequest;
import software.amazon.awssdk.services.s3.model.GetBucketVersioningRequest;
import software.amazon.awssdk.services.s3.model.GetPublicAccessBlockRequest;
import software.amazon.awssdk.services.s3.model.ListBucketsRequest;
import software.amazon.awssdk.services.s3.model.PublicAccessBlockConfiguration;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.ServerSideEncryptionRule;
import software.amazon.awssdk.services.s3.model.Tag;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Buckets. The bucket listing is account wide, so each regional unit keeps only the buckets whose own
 * location is that region. The listing with its locations is loaded once per run and shared by the
 * regional units through the run scope.
 */
@Component
@Slf4j
public class S3Collector extends AbstractAwsCollector {

    static final String BUCKET_LOCATIONS = "s3.bucket-locations";

    public S3Collector(AwsClientFactory clients) {
        super(clients, "s3");
    }

    @Override
    protected List<ResourceRecord> collectRecords(String region) {
        return collectRecords(region, RunScope.NONE);
    }

    @Override
    protected List<ResourceRecord> collectRecords(String region, RunScope scope) {
        S3Client s3 = clients.s3(region);
        BucketLocations listing = scope.shared(BUCKET_LOCATIONS, BucketLocations.class, () -> locateBuckets(s3));
        List<ResourceRecord> records = new ArrayList<>();
        for (Map.Entry<Bucket, String> located : listing.byBucket().entrySet()) {
            if (region.equals(located.getValue())) {
                records.add(describe(s3, located.getKey(), located.getValue()));
            }
        }
        return records;
    }

    private BucketLocations locateBuckets(S3Client s3) {
        Map<Bucket, String> locations = new LinkedHashMap<>();
        for (Bucket bucket : s3.listBuckets(ListBucketsRequest.builder().build()).buckets()) {
            String location = optional("location of " + bucket.name(),
                    () -> s3.getBucketLocation(GetBucketLocationRequest.builder().bucket(bucket.name()).build()).locationConstraintAsString());
            locations.put(bucket, normalizeLocation(location));
        }
        log.debug("Located {} buckets.", locations.size());
        return new BucketLocations(Collections.unmodifiableMap(locations));
    }

    /**
     * An empty location constraint means us-east-1; {@code EU} is the legacy name of eu-west-1.
     */
    static String normalizeLocation(String locationConstraint) {
        if (!StringUtils.hasText(locationConstraint) || "null".equals(locationConstraint)) {
            return ServiceCatalog.US_EAST_1;
        }
        if ("EU".equals(locationConstraint)) {
            return "eu-west-1";
        }
        return locationConstraint;
    }

    private ResourceRecord describe(S3Client s3, Bucket bucket, String bucketRegion) {
        String name = bucket.name();
        String versioning = optional("versioning of " + name,
                () -> s3.getBucketVersioning(GetBucketVersioningRequest.builder().bucket(name).build()).statusAsString());
        GetBucketEncryptionResponse encryption = optional("encryption of " + name,
                () -> s3.getBucketEncryption(GetBucketEncryptionRequest.builder().bucket(name).build()));
        PublicAccessBlockConfiguration publicAccess = optional("public access block of " + name,
                () -> s3.getPublicAccessBlock(GetPublicAccessBlockRequest.builder().bucket(name).build()).publicAccessBlockConfiguration());

        return record("bucket", name, "arn:aws:s3:::" + name, name, bucketRegion,
                details(
                        "creation_date", bucket.creationDate(),
                        "versioning", versioning,
                        "encryption", encryptionAlgorithm(encryption),
                        "public_access_blocked", publicAccess == null ? null : fullyBlocked(publicAccess)),
                bucketTags(s3, name));
    }

    private Map<String, String> bucketTags(S3Client s3, String bucket) {
        try {
            List<Tag> tagSet = s3.getBucketTagging(GetBucketTaggingRequest.builder().bucket(bucket).build()).tagSet();
            return tagMap(tagSet, Tag::key, Tag::value);
        } catch (S3Exception ex) {
            if (ex.awsErrorDetails() == null || !"NoSuchTagSet".equals(ex.awsErrorDetails().errorCode())) {
                log.debug("s3: could not read tags of {}: {}", bucket, ex.getMessage());
            }
            return Map.of();
        }
    }

    private static String encryptionAlgorithm(GetBucketEncryptionResponse encryption) {
        if (encryption == null || encryption.serverSideEncryptionConfiguration() == null) {
            return null;
        }
        List<ServerSideEncryptionRule> rules = encryption.serverSideEncryptionConfiguration().rules();
        if (rules.isEmpty() || rules.get(0).applyServerSideEncryptionByDefault() == null) {
            return null;
        }
        return rules.get(0).applyServerSideEncryptionByDefault().sseAlgorithmAsString();
    }

    private static boolean fullyBlocked(PublicAccessBlockConfiguration config) {
        return Boolean.TRUE.equals(config.blockPublicAcls())
                && Boolean.TRUE.equals(config.ignorePublicAcls())
                && Boolean.TRUE.equals(config.blockPublicPolicy())
                && Boolean.TRUE.equals(config.restrictPublicBuckets());
    }

    private record BucketLocations(Map<Bucket, String> byBucket) {
    }
}
