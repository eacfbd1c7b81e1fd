package com.awsmap.aws.collectors;

import com.awsmap.aws.AwsClientFactory;
import com.awsmap.inventory.model.ResourceRecord;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.iam.IamClient;
import software.amazon.awssdk.services.iam.model.Group;
import software.amazon.awssdk.services.iam.model.ListAccessKeysRequest;
import software.amazon.awssdk.services.iam.model.ListGroupsRequest;
import software.amazon.awssdk.services.iam.model.ListPoliciesRequest;
import software.amazon.awssdk.services.iam.model.ListRoleTagsRequest;
import software.amazon.awssdk.services.iam.model.ListRolesRequest;
import software.amazon.awssdk.services.iam.model.ListUserTagsRequest;
import software.amazon.awssdk.services.iam.model.ListUsersRequest;
import software.amazon.awssdk.services.iam.model.Policy;
import software.amazon.awssdk.services.iam.model.PolicyScopeType;
import software.amazon.awssdk.services.iam.model.Role;
import software.amazon.awssdk.services.iam.model.Tag;
import software.amazon.awssdk.services.iam.model.User;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Users, groups, roles and customer managed policies. Global: runs once, in us-east-1.
 */
@Component
public class IamCollector extends AbstractAwsCollector {

    public IamCollector(AwsClientFactory clients) {
        super(clients, "iam");
    }

    @Override
    protected List<ResourceRecord> collectRecords(String region) {
        IamClient iam = clients.iam();
        List<ResourceRecord> records = new ArrayList<>();

        for (User user : iam.listUsersPaginator(ListUsersRequest.builder().build()).users()) {
            List<Tag> tags = optional("tags of user " + user.userName(), () -> iam.listUserTags(
                    ListUserTagsRequest.builder().userName(user.userName()).build()).tags());
            Integer accessKeys = optional("access keys of " + user.userName(), () -> iam.listAccessKeys(
                    ListAccessKeysRequest.builder().userName(user.userName()).build()).accessKeyMetadata().size());
            records.add(record("user", user.userId(), user.arn(), user.userName(), region,
                    details(
                            "path", user.path(),
                            "create_date", user.createDate(),
                            "password_last_used", user.passwordLastUsed(),
                            "access_keys_count", accessKeys),
                    tagMap(tags, Tag::key, Tag::value)));
        }

        for (Group group : iam.listGroupsPaginator(ListGroupsRequest.builder().build()).groups()) {
            records.add(record("group", group.groupId(), group.arn(), group.groupName(), region,
                    details("path", group.path(), "create_date", group.createDate()),
                    Map.of()));
        }

        for (Role role : iam.listRolesPaginator(ListRolesRequest.builder().build()).roles()) {
            List<Tag> tags = optional("tags of role " + role.roleName(), () -> iam.listRoleTags(
                    ListRoleTagsRequest.builder().roleName(role.roleName()).build()).tags());
            records.add(record("role", role.roleId(), role.arn(), role.roleName(), region,
                    details(
                            "path", role.path(),
                            "create_date", role.createDate(),
                            "max_session_duration", role.maxSessionDuration(),
                            "description", role.description()),
                    tagMap(tags, Tag::key, Tag::value)));
        }

        ListPoliciesRequest customerManaged = ListPoliciesRequest.builder().scope(PolicyScopeType.LOCAL).build();
        for (Policy policy : iam.listPoliciesPaginator(customerManaged).policies()) {
            records.add(record("policy", policy.policyId(), policy.arn(), policy.policyName(), region,
                    details(
                            "path", policy.path(),
                            "default_version_id", policy.defaultVersionId(),
                            "attachment_count", policy.attachmentCount(),
                            "create_date", policy.createDate(),
                            "update_date", policy.updateDate()),
                    Map.of()));
        }
        return records;
    }
}
