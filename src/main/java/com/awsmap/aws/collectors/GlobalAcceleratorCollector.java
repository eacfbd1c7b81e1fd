package com.awsmap.aws.collectors;

import com.awsmap.aws.AwsClientFactory;
import com.awsmap.inventory.model.ResourceRecord;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.globalaccelerator.GlobalAcceleratorClient;
import software.amazon.awssdk.services.globalaccelerator.model.Accelerator;
import software.amazon.awssdk.services.globalaccelerator.model.AcceleratorAttributes;
import software.amazon.awssdk.services.globalaccelerator.model.DescribeAcceleratorAttributesRequest;
import software.amazon.awssdk.services.globalaccelerator.model.EndpointGroup;
import software.amazon.awssdk.services.globalaccelerator.model.ListAcceleratorsRequest;
import software.amazon.awssdk.services.globalaccelerator.model.ListAcceleratorsResponse;
import software.amazon.awssdk.services.globalaccelerator.model.ListEndpointGroupsRequest;
import software.amazon.awssdk.services.globalaccelerator.model.ListEndpointGroupsResponse;
import software.amazon.awssdk.services.globalaccelerator.model.ListListenersRequest;
import software.amazon.awssdk.services.globalaccelerator.model.ListListenersResponse;
import software.amazon.awssdk.services.globalaccelerator.model.ListTagsForResourceRequest;
import software.amazon.awssdk.services.globalaccelerator.model.Listener;
import software.amazon.awssdk.services.globalaccelerator.model.Tag;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Standard accelerators with their listeners and endpoint groups. Global: runs once, in us-west-2.
 */
@Component
public class GlobalAcceleratorCollector extends AbstractAwsCollector {

    public GlobalAcceleratorCollector(AwsClientFactory clients) {
        super(clients, "globalaccelerator");
    }

    @Override
    protected List<ResourceRecord> collectRecords(String region) {
        GlobalAcceleratorClient ga = clients.globalAccelerator();
        List<ResourceRecord> records = new ArrayList<>();
        for (Accelerator accelerator : accelerators(ga)) {
            String arn = accelerator.acceleratorArn();
            String name = accelerator.name() != null ? accelerator.name() : lastSegment(arn);
            AcceleratorAttributes attributes = optional("attributes of " + arn, () -> ga.describeAcceleratorAttributes(
                    DescribeAcceleratorAttributesRequest.builder().acceleratorArn(arn).build()).acceleratorAttributes());
            List<Tag> tags = optional("tags of " + arn, () -> ga.listTagsForResource(
                    ListTagsForResourceRequest.builder().resourceArn(arn).build()).tags());
            records.add(record("accelerator", lastSegment(arn), arn, name, region,
                    details(
                            "status", accelerator.statusAsString(),
                            "enabled", accelerator.enabled(),
                            "ip_address_type", accelerator.ipAddressTypeAsString(),
                            "dns_name", accelerator.dnsName(),
                            "dual_stack_dns_name", accelerator.dualStackDnsName(),
                            "created_time", accelerator.createdTime(),
                            "last_modified_time", accelerator.lastModifiedTime(),
                            "flow_logs_enabled", attributes != null ? attributes.flowLogsEnabled() : null,
                            "flow_logs_s3_bucket", attributes != null ? attributes.flowLogsS3Bucket() : null),
                    tagMap(tags, Tag::key, Tag::value)));

            for (Listener listener : listeners(ga, arn)) {
                String listenerId = lastSegment(listener.listenerArn());
                records.add(record("listener", listenerId, listener.listenerArn(),
                        name + "-listener-" + listenerId.substring(0, Math.min(8, listenerId.length())), region,
                        details(
                                "accelerator_arn", arn,
                                "protocol", listener.protocolAsString(),
                                "client_affinity", listener.clientAffinityAsString(),
                                "port_ranges", listener.portRanges().size()),
                        Map.of()));
                for (EndpointGroup group : endpointGroups(ga, listener.listenerArn())) {
                    records.add(record("endpoint-group", lastSegment(group.endpointGroupArn()), group.endpointGroupArn(),
                            name + "-" + group.endpointGroupRegion(), region,
                            details(
                                    "listener_arn", listener.listenerArn(),
                                    "endpoint_group_region", group.endpointGroupRegion(),
                                    "traffic_dial_percentage", group.trafficDialPercentage(),
                                    "health_check_port", group.healthCheckPort(),
                                    "health_check_protocol", group.healthCheckProtocolAsString(),
                                    "health_check_path", group.healthCheckPath(),
                                    "threshold_count", group.thresholdCount(),
                                    "endpoints_count", group.endpointDescriptions().size()),
                            Map.of()));
                }
            }
        }
        return records;
    }

    private List<Accelerator> accelerators(GlobalAcceleratorClient ga) {
        List<Accelerator> accelerators = new ArrayList<>();
        String token = null;
        do {
            ListAcceleratorsResponse page = ga.listAccelerators(ListAcceleratorsRequest.builder().nextToken(token).build());
            accelerators.addAll(page.accelerators());
            token = page.nextToken();
        } while (token != null);
        return accelerators;
    }

    private List<Listener> listeners(GlobalAcceleratorClient ga, String acceleratorArn) {
        List<Listener> listeners = new ArrayList<>();
        String token = null;
        do {
            ListListenersResponse page = ga.listListeners(ListListenersRequest.builder()
                    .acceleratorArn(acceleratorArn)
                    .nextToken(token)
                    .build());
            listeners.addAll(page.listeners());
            token = page.nextToken();
        } while (token != null);
        return listeners;
    }

    private List<EndpointGroup> endpointGroups(GlobalAcceleratorClient ga, String listenerArn) {
        List<EndpointGroup> groups = new ArrayList<>();
        String token = null;
        do {
            ListEndpointGroupsResponse page = ga.listEndpointGroups(ListEndpointGroupsRequest.builder()
                    .listenerArn(listenerArn)
                    .nextToken(token)
                    .build());
            groups.addAll(page.endpointGroups());
            token = page.nextToken();
        } while (token != null);
        return groups;
    }
}
