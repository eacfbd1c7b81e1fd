package com.awsmap.aws.collectors;

import com.awsmap.aws.AwsClientFactory;
import com.awsmap.inventory.collector.CollectorException;
import com.awsmap.inventory.collector.CollectorFailure;
import com.awsmap.inventory.model.ResourceRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.awscore.exception.AwsErrorDetails;
import software.amazon.awssdk.services.kms.KmsClient;
import software.amazon.awssdk.services.kms.model.AliasListEntry;
import software.amazon.awssdk.services.kms.model.DescribeKeyRequest;
import software.amazon.awssdk.services.kms.model.DescribeKeyResponse;
import software.amazon.awssdk.services.kms.model.KeyListEntry;
import software.amazon.awssdk.services.kms.model.KeyManagerType;
import software.amazon.awssdk.services.kms.model.KeyMetadata;
import software.amazon.awssdk.services.kms.model.KmsException;
import software.amazon.awssdk.services.kms.model.ListAliasesRequest;
import software.amazon.awssdk.services.kms.model.ListAliasesResponse;
import software.amazon.awssdk.services.kms.model.ListKeysRequest;
import software.amazon.awssdk.services.kms.model.ListKeysResponse;
import software.amazon.awssdk.services.kms.model.ListResourceTagsRequest;
import software.amazon.awssdk.services.kms.model.ListResourceTagsResponse;
import software.amazon.awssdk.services.kms.model.Tag;
import software.amazon.awssdk.services.kms.paginators.ListAliasesIterable;
import software.amazon.awssdk.services.kms.paginators.ListKeysIterable;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class KmsCollectorTest {

    private AwsClientFactory clients;
    private KmsClient kms;

    @BeforeEach
    void setUp() {
        clients = mock(AwsClientFactory.class);
        kms = mock(KmsClient.class);
        when(clients.kms(anyString())).thenReturn(kms);

        when(kms.listKeysPaginator(any(ListKeysRequest.class)))
                .thenAnswer(invocation -> new ListKeysIterable(kms, invocation.getArgument(0)));
        when(kms.listAliasesPaginator(any(ListAliasesRequest.class)))
                .thenAnswer(invocation -> new ListAliasesIterable(kms, invocation.getArgument(0)));
        when(kms.listKeys(any(ListKeysRequest.class))).thenReturn(ListKeysResponse.builder()
                .keys(key("k-app"), key("k-foreign"), key("k-aws"))
                .truncated(false)
                .build());
        when(kms.listAliases(any(ListAliasesRequest.class))).thenReturn(ListAliasesResponse.builder()
                .aliases(alias("alias/app", "k-app"), alias("alias/aws/s3", "k-aws"), alias("alias/unused", null))
                .truncated(false)
                .build());
        when(kms.describeKey(any(DescribeKeyRequest.class))).thenAnswer(invocation -> {
            DescribeKeyRequest request = invocation.getArgument(0);
            if ("k-foreign".equals(request.keyId())) {
                throw accessDenied();
            }
            return describe(request.keyId(), "k-aws".equals(request.keyId()) ? KeyManagerType.AWS : KeyManagerType.CUSTOMER);
        });
        when(kms.listResourceTags(any(ListResourceTagsRequest.class))).thenReturn(ListResourceTagsResponse.builder()
                .tags(Tag.builder().tagKey("Env").tagValue("prod").build())
                .build());
    }

    @Test
    void testUnreadableKeySkippedRestOfRegionReported() throws CollectorException {
        List<ResourceRecord> records = new KmsCollector(clients).collect("eu-west-1");

        List<ResourceRecord> keys = records.stream().filter(r -> r.type().equals("key")).toList();
        assertEquals(List.of("k-app"), keys.stream().map(ResourceRecord::id).toList());
        assertEquals("alias/app", keys.get(0).name());
        assertEquals(Map.of("Env", "prod"), keys.get(0).tags());
        assertEquals(List.of("alias/app"), keys.get(0).details().get("aliases"));

        List<String> aliases = records.stream().filter(r -> r.type().equals("alias")).map(ResourceRecord::id).toList();
        assertEquals(List.of("alias/app", "alias/aws/s3"), aliases);
    }

    @Test
    void testKeyListingDeniedFailsUnit() {
        when(kms.listKeys(any(ListKeysRequest.class))).thenThrow(accessDenied());

        CollectorException ex = assertThrows(CollectorException.class,
                () -> new KmsCollector(clients).collect("eu-west-1"));

        assertEquals(CollectorFailure.ACCESS_DENIED, ex.failure());
    }

    private static KmsException accessDenied() {
        return (KmsException) KmsException.builder()
                .statusCode(400)
                .awsErrorDetails(AwsErrorDetails.builder().errorCode("AccessDeniedException").build())
                .build();
    }

    private static KeyListEntry key(String id) {
        return KeyListEntry.builder().keyId(id).keyArn("arn:aws:kms:eu-west-1:123456789012:key/" + id).build();
    }

    private static AliasListEntry alias(String name, String target) {
        return AliasListEntry.builder()
                .aliasName(name)
                .aliasArn("arn:aws:kms:eu-west-1:123456789012:" + name)
                .targetKeyId(target)
                .build();
    }

    private static DescribeKeyResponse describe(String id, KeyManagerType manager) {
        return DescribeKeyResponse.builder()
                .keyMetadata(KeyMetadata.builder()
                        .keyId(id)
                        .arn("arn:aws:kms:eu-west-1:123456789012:key/" + id)
                        .keyManager(manager)
                        .enabled(true)
                        .build())
                .build();
    }
}
