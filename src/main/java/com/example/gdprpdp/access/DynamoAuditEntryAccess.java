package com.example.gdprpdp.access;

import com.example.gdprpdp.models.AuditEntry;
import com.example.gdprpdp.models.Duty;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Expression;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.QueryConditional;
import software.amazon.awssdk.enhanced.dynamodb.model.TransactPutItemEnhancedRequest;
import software.amazon.awssdk.enhanced.dynamodb.model.TransactWriteItemsEnhancedRequest;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;
import software.amazon.awssdk.services.dynamodb.model.TransactionCanceledException;

@Slf4j
@Component
public class DynamoAuditEntryAccess implements AuditEntryAccess {

    public static final String TABLE_NAME = "audit_entries";

    // DynamoDB limit on the actions in one TransactWriteItems call
    static final int MAX_TRANSACTION_ITEMS = 100;

    // an entry, once written, is never replaced
    private static final Expression NEW_SEQUENCE_ONLY = Expression.builder()
            .expression("attribute_not_exists(#seq)")
            .putExpressionName("#seq", "sequence")
            .build();

    private final DynamoDbEnhancedClient enhancedClient;
    private final DynamoDbTable<AuditEntry> table;
    private final DynamoDbTable<Duty> dutyTable;

    public DynamoAuditEntryAccess(DynamoDbEnhancedClient enhancedClient) {
        this.enhancedClient = enhancedClient;
        this.table = enhancedClient.table(TABLE_NAME, TableSchema.fromBean(AuditEntry.class));
        this.dutyTable = enhancedClient.table(DynamoDutyAccess.TABLE_NAME, DynamoDutyAccess.schema());
    }

    @Override
    public void append(AuditEntry entry) {
        table.putItem(r -> r.item(entry).conditionExpression(NEW_SEQUENCE_ONLY));
    }

    @Override
    public void appendWithDuties(AuditEntry entry, List<Duty> duties) {
        if (duties.size() + 1 > MAX_TRANSACTION_ITEMS) {
            throw new IllegalArgumentException("an audit entry can carry at most "
                    + (MAX_TRANSACTION_ITEMS - 1) + " duties, got " + duties.size());
        }
        TransactWriteItemsEnhancedRequest.Builder builder = TransactWriteItemsEnhancedRequest.builder()
                .addPutItem(table, TransactPutItemEnhancedRequest.builder(AuditEntry.class)
                        .item(entry)
                        .conditionExpression(NEW_SEQUENCE_ONLY)
                        .build());
        duties.forEach(duty -> builder.addPutItem(dutyTable, duty));
        TransactWriteItemsEnhancedRequest request = builder.build();
        try {
            enhancedClient.transactWriteItems(request);
        } catch (TransactionCanceledException e) {
            boolean conflict = e.hasCancellationReasons() && e.cancellationReasons().stream()
                    .anyMatch(reason -> "ConditionalCheckFailed".equals(reason.code()));
            if (conflict) {
                log.warn("audit append for log={} seq={} lost a conditional check", entry.getLogId(), entry.getSequence());
                throw ConditionalCheckFailedException.builder()
                        .message("audit entry " + entry.getSequence() + " already exists")
                        .cause(e)
                        .build();
            }
            throw e;
        }
    }

    @Override
    public Optional<AuditEntry> findLatest(String logId) {
        // Query the partition in descending sequence order so the first item is the head.
        return table.query(r -> r.queryConditional(QueryConditional.keyEqualTo(buildKey(logId)))
                        .limit(1)
                        .scanIndexForward(false)
                        .consistentRead(true))
                .items()
                .stream()
                .findFirst();
    }

    @Override
    public List<AuditEntry> findRange(String logId, long fromSequence, long toSequence) {
        if (toSequence < fromSequence) {
            return List.of();
        }
        return table.query(r -> r.queryConditional(QueryConditional.sortBetween(
                                Key.builder().partitionValue(logId).sortValue(fromSequence).build(),
                                Key.builder().partitionValue(logId).sortValue(toSequence).build()))
                        .scanIndexForward(true)
                        .consistentRead(true))
                .items()
                .stream()
                .collect(Collectors.toList());
    }

    private Key buildKey(String logId) {
        return Key.builder().partitionValue(logId).build();
    }
}
