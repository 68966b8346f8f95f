package com.example.gdprpdp.access;

import com.example.gdprpdp.models.Duty;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.QueryConditional;

@Component
public class DynamoDutyAccess implements DutyAccess {

    public static final String TABLE_NAME = "duties";

    private final DynamoDbTable<Duty> table;

    public DynamoDutyAccess(DynamoDbEnhancedClient enhancedClient) {
        this.table = enhancedClient.table(TABLE_NAME, TableSchema.fromBean(Duty.class));
    }

    static TableSchema<Duty> schema() {
        return TableSchema.fromBean(Duty.class);
    }

    @Override
    public Optional<Duty> findById(String dutyId) {
        return Optional.ofNullable(table.getItem(r -> r.key(Key.builder()
                        .partitionValue(dutyId)
                        .build())
                .consistentRead(true)));
    }

    @Override
    public List<Duty> findByStatusExpiringBy(Duty.Status status, long cutoffMillis) {
        return table.index(Duty.STATUS_INDEX)
                .query(r -> r.queryConditional(
                                QueryConditional.sortLessThanOrEqualTo(
                                        Key.builder()
                                                .partitionValue(status.name())
                                                .sortValue(cutoffMillis)
                                                .build()))
                        .scanIndexForward(true))
                .stream()
                .flatMap(page -> page.items().stream())
                .collect(Collectors.toList());
    }

    @Override
    public List<Duty> findByStatus(Duty.Status status) {
        return table.index(Duty.STATUS_INDEX)
                .query(r -> r.queryConditional(QueryConditional.keyEqualTo(
                                Key.builder().partitionValue(status.name()).build()))
                        .scanIndexForward(true))
                .stream()
                .flatMap(page -> page.items().stream())
                .collect(Collectors.toList());
    }

    @Override
    public List<Duty> findAll() {
        return table.scan()
                .items()
                .stream()
                .sorted(Comparator.comparing(Duty::getExpiresAt).thenComparing(Duty::getDutyId))
                .collect(Collectors.toList());
    }

    @Override
    public Duty save(Duty duty) {
        table.putItem(duty);
        return duty;
    }
}
