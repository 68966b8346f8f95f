package com.example.gdprpdp.config;

import com.example.gdprpdp.access.DynamoAuditEntryAccess;
import com.example.gdprpdp.access.DynamoDutyAccess;
import com.example.gdprpdp.access.DynamoPolicyAccess;
import com.example.gdprpdp.models.Duty;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeDefinition;
import software.amazon.awssdk.services.dynamodb.model.BillingMode;
import software.amazon.awssdk.services.dynamodb.model.CreateTableRequest;
import software.amazon.awssdk.services.dynamodb.model.GlobalSecondaryIndex;
import software.amazon.awssdk.services.dynamodb.model.KeySchemaElement;
import software.amazon.awssdk.services.dynamodb.model.KeyType;
import software.amazon.awssdk.services.dynamodb.model.ProjectionType;
import software.amazon.awssdk.services.dynamodb.model.ResourceNotFoundException;
import software.amazon.awssdk.services.dynamodb.model.ScalarAttributeType;

/**
 * Creates the service's tables when they are missing. Used at startup against LocalStack and by the
 * DynamoDB-backed tests; production tables are expected to be provisioned separately.
 */
@Slf4j
public final class DynamoTables {

    private DynamoTables() {
    }

    public static void ensureAll(DynamoDbClient dynamo) {
        ensurePoliciesTable(dynamo);
        ensureAuditEntriesTable(dynamo);
        ensureDutiesTable(dynamo);
    }

    public static void ensurePoliciesTable(DynamoDbClient dynamo) {
        ensure(dynamo, CreateTableRequest.builder()
                .tableName(DynamoPolicyAccess.TABLE_NAME)
                .attributeDefinitions(attribute("policy_id", ScalarAttributeType.S))
                .keySchema(key("policy_id", KeyType.HASH))
                .billingMode(BillingMode.PAY_PER_REQUEST)
                .build());
    }

    public static void ensureAuditEntriesTable(DynamoDbClient dynamo) {
        ensure(dynamo, CreateTableRequest.builder()
                .tableName(DynamoAuditEntryAccess.TABLE_NAME)
                .attributeDefinitions(
                        attribute("log_id", ScalarAttributeType.S),
                        attribute("sequence", ScalarAttributeType.N))
                .keySchema(
                        key("log_id", KeyType.HASH),
                        key("sequence", KeyType.RANGE))
                .billingMode(BillingMode.PAY_PER_REQUEST)
                .build());
    }

    public static void ensureDutiesTable(DynamoDbClient dynamo) {
        ensure(dynamo, CreateTableRequest.builder()
                .tableName(DynamoDutyAccess.TABLE_NAME)
                .attributeDefinitions(
                        attribute("duty_id", ScalarAttributeType.S),
                        attribute("status", ScalarAttributeType.S),
                        attribute("expires_at", ScalarAttributeType.N))
                .keySchema(key("duty_id", KeyType.HASH))
                .globalSecondaryIndexes(GlobalSecondaryIndex.builder()
                        .indexName(Duty.STATUS_INDEX)
                        .keySchema(
                                key("status", KeyType.HASH),
                                key("expires_at", KeyType.RANGE))
                        // full items: the scheduler reads duties straight off the index
                        .projection(b -> b.projectionType(ProjectionType.ALL))
                        .build())
                .billingMode(BillingMode.PAY_PER_REQUEST)
                .build());
    }

    private static void ensure(DynamoDbClient dynamo, CreateTableRequest request) {
        try {
            dynamo.describeTable(b -> b.tableName(request.tableName()));
        } catch (ResourceNotFoundException ex) {
            log.info("creating DynamoDB table {}", request.tableName());
            dynamo.createTable(request);
            dynamo.waiter().waitUntilTableExists(b -> b.tableName(request.tableName()));
        }
    }

    private static AttributeDefinition attribute(String name, ScalarAttributeType type) {
        return AttributeDefinition.builder().attributeName(name).attributeType(type).build();
    }

    private static KeySchemaElement key(String name, KeyType type) {
        return KeySchemaElement.builder().attributeName(name).keyType(type).build();
    }
}
