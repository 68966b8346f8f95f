package com.example.gdprpdp.access;

import com.example.gdprpdp.models.Policy;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;

@Component
public class DynamoPolicyAccess implements PolicyAccess {

    public static final String TABLE_NAME = "policies";

    private final DynamoDbTable<Policy> table;

    public DynamoPolicyAccess(DynamoDbEnhancedClient enhancedClient) {
        this.table = enhancedClient.table(TABLE_NAME, TableSchema.fromBean(Policy.class));
    }

    @Override
    public Optional<Policy> findById(String policyId) {
        return Optional.ofNullable(table.getItem(r -> r.key(buildKey(policyId)).consistentRead(true)));
    }

    @Override
    public List<Policy> findAll() {
        // policy sets are small; a full scan is fine
        return table.scan(r -> r.consistentRead(true))
                .items()
                .stream()
                .sorted(Comparator.comparing(Policy::getPolicyId))
                .collect(Collectors.toList());
    }

    @Override
    public Policy save(Policy policy) {
        table.putItem(policy);
        return policy;
    }

    @Override
    public void delete(String policyId) {
        table.deleteItem(buildKey(policyId));
    }

    private Key buildKey(String policyId) {
        return Key.builder().partitionValue(policyId).build();
    }
}
