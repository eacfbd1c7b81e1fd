package com.awsmap.aws.collectors;

import com.awsmap.aws.AwsClientFactory;
import com.awsmap.inventory.model.ResourceRecord;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.kms.KmsClient;
import software.amazon.awssdk.services.kms.model.AliasListEntry;
import software.amazon.awssdk.services.kms.model.DescribeKeyRequest;
import software.amazon.awssdk.services.kms.model.KeyListEntry;
import software.amazon.awssdk.services.kms.model.KeyManagerType;
import software.amazon.awssdk.services.kms.model.KeyMetadata;
import software.amazon.awssdk.services.kms.model.ListAliasesRequest;
import software.amazon.awssdk.services.kms.model.ListKeysRequest;
import software.amazon.awssdk.services.kms.model.ListResourceTagsRequest;
import software.amazon.awssdk.services.kms.model.Tag;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Customer managed keys and aliases. AWS managed keys are skipped here; AWS managed aliases are left to the
 * exclusion rules.
 */
@Component
public class KmsCollector extends AbstractAwsCollector {

    public KmsCollector(AwsClientFactory clients) {
        super(clients, "kms");
    }

    @Override
    protected List<ResourceRecord> collectRecords(String region) {
        KmsClient kms = clients.kms(region);
        List<AliasListEntry> aliases = new ArrayList<>();
        kms.listAliasesPaginator(ListAliasesRequest.builder().build()).aliases().forEach(aliases::add);

        List<ResourceRecord> records = new ArrayList<>();
        for (KeyListEntry key : kms.listKeysPaginator(ListKeysRequest.builder().build()).keys()) {
            // A key whose policy refuses DescribeKey is skipped; the rest of the region is still reported.
            KeyMetadata metadata = optional("metadata of key " + key.keyId(), () -> kms.describeKey(
                    DescribeKeyRequest.builder().keyId(key.keyId()).build()).keyMetadata());
            if (metadata == null || metadata.keyManager() != KeyManagerType.CUSTOMER) {
                continue;
            }
            List<Tag> tagList = optional("tags of key " + key.keyId(), () -> kms.listResourceTags(
                    ListResourceTagsRequest.builder().keyId(key.keyId()).build()).tags());
            Map<String, String> tags = tagMap(tagList, Tag::tagKey, Tag::tagValue);
            List<String> keyAliases = aliases.stream()
                    .filter(alias -> key.keyId().equals(alias.targetKeyId()))
                    .map(AliasListEntry::aliasName)
                    .toList();
            String name = tags.containsKey("Name") ? tags.get("Name")
                    : keyAliases.isEmpty() ? key.keyId() : keyAliases.get(0);
            records.add(record("key", key.keyId(), metadata.arn(), name, region,
                    details(
                            "key_state", metadata.keyStateAsString(),
                            "key_usage", metadata.keyUsageAsString(),
                            "key_spec", metadata.keySpecAsString(),
                            "origin", metadata.originAsString(),
                            "creation_date", metadata.creationDate(),
                            "description", metadata.description(),
                            "enabled", metadata.enabled(),
                            "multi_region", metadata.multiRegion(),
                            "aliases", keyAliases,
                            "deletion_date", metadata.deletionDate()),
                    tags));
        }

        for (AliasListEntry alias : aliases) {
            if (alias.targetKeyId() == null) {
                continue;
            }
            records.add(record("alias", alias.aliasName(), alias.aliasArn(),
                    alias.aliasName().replace("alias/", ""), region,
                    details(
                            "target_key_id", alias.targetKeyId(),
                            "creation_date", alias.creationDate(),
                            "last_updated_date", alias.lastUpdatedDate()),
                    Map.of()));
        }
        return records;
    }
}
