package com.awsmap.inventory.aggregate;

import com.awsmap.inventory.model.ResourceRecord;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Static per-service rules for resources AWS creates in every account or region.
 */
public final class ExclusionRules {

    private static final List<ExclusionRule> DEFAULT_RULES = List.of(
            ExclusionRule.named("events", "event-bus", "default"),
            ExclusionRule.prefixed("kms", "alias", "alias/aws/"),
            ExclusionRule.prefixed("backup", "vault", "aws/"),
            ExclusionRule.prefixed("rds", "db-parameter-group", "default."),
            ExclusionRule.prefixed("rds", "option-group", "default:"),
            ExclusionRule.prefixed("redshift", "parameter-group", "default."),
            ExclusionRule.named("dax", "parameter-group", "default.dax1.0"),
            ExclusionRule.named("memorydb", "user", "default"),
            ExclusionRule.named("memorydb", "acl", "open-access"),
            ExclusionRule.named("scheduler", "schedule-group", "default"),
            ExclusionRule.prefixed("schemas", "registry", "aws."),
            ExclusionRule.named("xray", "group", "Default"),
            ExclusionRule.named("xray", "sampling-rule", "Default"),
            ExclusionRule.named("mediaconvert", "queue", "Default"),
            ExclusionRule.named("athena", "data-catalog", "AwsDataCatalog"),
            ExclusionRule.named("ecs", "capacity-provider", "FARGATE"),
            ExclusionRule.named("ecs", "capacity-provider", "FARGATE_SPOT"),
            ExclusionRule.named("apprunner", "auto-scaling-configuration", "DefaultConfiguration"));

    private static final ExclusionRules DEFAULTS = new ExclusionRules(DEFAULT_RULES);
    private static final ExclusionRules NONE = new ExclusionRules(List.of());

    private final Map<String, List<ExclusionRule>> byService;

    private ExclusionRules(Collection<ExclusionRule> rules) {
        this.byService = rules.stream().collect(Collectors.groupingBy(ExclusionRule::service));
    }

    public static ExclusionRules defaults() {
        return DEFAULTS;
    }

    public static ExclusionRules none() {
        return NONE;
    }

    public static ExclusionRules of(Collection<ExclusionRule> rules) {
        return new ExclusionRules(rules);
    }

    public boolean excludes(ResourceRecord record) {
        List<ExclusionRule> rules = byService.get(record.service());
        if (rules == null) {
            return false;
        }
        for (ExclusionRule rule : rules) {
            if (rule.excludes(record)) {
                return true;
            }
        }
        return false;
    }

    public List<ExclusionRule> rulesFor(String service) {
        return byService.getOrDefault(service, List.of());
    }
}
