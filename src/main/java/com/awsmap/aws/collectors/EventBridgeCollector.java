package com.awsmap.aws.collectors;

import com.awsmap.aws.AwsClientFactory;
import com.awsmap.inventory.model.ResourceRecord;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.eventbridge.EventBridgeClient;
import software.amazon.awssdk.services.eventbridge.model.EventBus;
import software.amazon.awssdk.services.eventbridge.model.ListEventBusesRequest;
import software.amazon.awssdk.services.eventbridge.model.ListEventBusesResponse;
import software.amazon.awssdk.services.eventbridge.model.ListRulesRequest;
import software.amazon.awssdk.services.eventbridge.model.ListRulesResponse;
import software.amazon.awssdk.services.eventbridge.model.ListTagsForResourceRequest;
import software.amazon.awssdk.services.eventbridge.model.ListTargetsByRuleRequest;
import software.amazon.awssdk.services.eventbridge.model.Rule;
import software.amazon.awssdk.services.eventbridge.model.Tag;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Event buses and the rules on each bus, including the default bus's rules.
 */
@Component
public class EventBridgeCollector extends AbstractAwsCollector {

    public EventBridgeCollector(AwsClientFactory clients) {
        super(clients, "events");
    }

    @Override
    protected List<ResourceRecord> collectRecords(String region) {
        EventBridgeClient events = clients.eventBridge(region);
        List<ResourceRecord> records = new ArrayList<>();
        for (EventBus bus : eventBuses(events)) {
            records.add(record("event-bus", bus.name(), bus.arn(), bus.name(), region,
                    details("policy", bus.policy()),
                    tags(events, bus.arn())));
            for (Rule rule : rules(events, bus.name())) {
                Integer targets = optional("targets of rule " + rule.name(), () -> events.listTargetsByRule(
                        ListTargetsByRuleRequest.builder().rule(rule.name()).eventBusName(bus.name()).build())
                        .targets().size());
                records.add(record("rule", rule.name(), rule.arn(), rule.name(), region,
                        details(
                                "event_bus_name", bus.name(),
                                "description", rule.description(),
                                "state", rule.stateAsString(),
                                "schedule_expression", rule.scheduleExpression(),
                                "event_pattern", rule.eventPattern(),
                                "managed_by", rule.managedBy(),
                                "targets_count", targets),
                        tags(events, rule.arn())));
            }
        }
        return records;
    }

    private List<EventBus> eventBuses(EventBridgeClient events) {
        List<EventBus> buses = new ArrayList<>();
        String token = null;
        do {
            ListEventBusesResponse page = events.listEventBuses(ListEventBusesRequest.builder().nextToken(token).build());
            buses.addAll(page.eventBuses());
            token = page.nextToken();
        } while (token != null);
        return buses;
    }

    private List<Rule> rules(EventBridgeClient events, String busName) {
        List<Rule> rules = new ArrayList<>();
        String token = null;
        do {
            ListRulesResponse page = events.listRules(ListRulesRequest.builder()
                    .eventBusName(busName)
                    .nextToken(token)
                    .build());
            rules.addAll(page.rules());
            token = page.nextToken();
        } while (token != null);
        return rules;
    }

    private Map<String, String> tags(EventBridgeClient events, String arn) {
        List<Tag> tags = optional("tags of " + arn, () -> events.listTagsForResource(
                ListTagsForResourceRequest.builder().resourceARN(arn).build()).tags());
        return tagMap(tags, Tag::key, Tag::value);
    }
}
