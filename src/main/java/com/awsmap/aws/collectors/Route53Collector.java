package com.awsmap.aws.collectors;

import com.awsmap.aws.AwsClientFactory;
import com.awsmap.inventory.model.ResourceRecord;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.route53.Route53Client;
import software.amazon.awssdk.services.route53.model.HealthCheck;
import software.amazon.awssdk.services.route53.model.HealthCheckConfig;
import software.amazon.awssdk.services.route53.model.HostedZone;
import software.amazon.awssdk.services.route53.model.ListHealthChecksRequest;
import software.amazon.awssdk.services.route53.model.ListHostedZonesRequest;
import software.amazon.awssdk.services.route53.model.ListTagsForResourceRequest;
import software.amazon.awssdk.services.route53.model.Tag;
import software.amazon.awssdk.services.route53.model.TagResourceType;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Hosted zones and health checks. Global: runs once, in us-east-1.
 */
@Component
public class Route53Collector extends AbstractAwsCollector {

    public Route53Collector(AwsClientFactory clients) {
        super(clients, "route53");
    }

    @Override
    protected List<ResourceRecord> collectRecords(String region) {
        Route53Client route53 = clients.route53();
        List<ResourceRecord> records = new ArrayList<>();

        for (HostedZone zone : route53.listHostedZonesPaginator(ListHostedZonesRequest.builder().build()).hostedZones()) {
            String zoneId = lastSegment(zone.id());
            String zoneName = zone.name().endsWith(".") ? zone.name().substring(0, zone.name().length() - 1) : zone.name();
            records.add(record("hosted-zone", zoneId, "arn:aws:route53:::hostedzone/" + zoneId, zoneName, region,
                    details(
                            "zone_name", zone.name(),
                            "private_zone", zone.config() != null && Boolean.TRUE.equals(zone.config().privateZone()),
                            "record_count", zone.resourceRecordSetCount(),
                            "comment", zone.config() != null ? zone.config().comment() : null,
                            "caller_reference", zone.callerReference()),
                    tags(route53, TagResourceType.HOSTEDZONE, zoneId)));
        }

        for (HealthCheck check : route53.listHealthChecksPaginator(ListHealthChecksRequest.builder().build()).healthChecks()) {
            Map<String, String> tags = tags(route53, TagResourceType.HEALTHCHECK, check.id());
            HealthCheckConfig config = check.healthCheckConfig();
            String name = tags.getOrDefault("Name", config.fullyQualifiedDomainName() != null
                    ? config.fullyQualifiedDomainName()
                    : config.ipAddress() != null ? config.ipAddress() : check.id());
            records.add(record("health-check", check.id(), "arn:aws:route53:::healthcheck/" + check.id(), name, region,
                    details(
                            "type", config.typeAsString(),
                            "ip_address", config.ipAddress(),
                            "fqdn", config.fullyQualifiedDomainName(),
                            "port", config.port(),
                            "resource_path", config.resourcePath(),
                            "request_interval", config.requestInterval(),
                            "failure_threshold", config.failureThreshold(),
                            "measure_latency", config.measureLatency(),
                            "inverted", config.inverted(),
                            "disabled", config.disabled()),
                    tags));
        }
        return records;
    }

    private Map<String, String> tags(Route53Client route53, TagResourceType type, String id) {
        List<Tag> tags = optional("tags of " + type + " " + id, () -> route53.listTagsForResource(
                ListTagsForResourceRequest.builder().resourceType(type).resourceId(id).build()).resourceTagSet().tags());
        return tagMap(tags, Tag::key, Tag::value);
    }
}
