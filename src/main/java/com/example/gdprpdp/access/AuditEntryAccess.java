package com.example.gdprpdp.access;

import com.example.gdprpdp.models.AuditEntry;
import com.example.gdprpdp.models.Duty;
import java.util.List;
import java.util.Optional;

/**
 * Storage abstraction for the append-only {@code audit_entries} table. Implementations never
 * overwrite an entry: a put for a sequence number that already exists must fail with
 * {@link software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException} so the
 * service layer can detect a second writer.
 */
public interface AuditEntryAccess {

    void append(AuditEntry entry);

    /**
     * Appends {@code entry} and stores every duty in {@code duties} in one atomic write: either all
     * of them become visible or none does.
     */
    void appendWithDuties(AuditEntry entry, List<Duty> duties);

    default void appendWithDuty(AuditEntry entry, Duty duty) {
        appendWithDuties(entry, List.of(duty));
    }

    Optional<AuditEntry> findLatest(String logId);

    /**
     * Entries of one log with {@code fromSequence <= sequence <= toSequence}, ascending.
     */
    List<AuditEntry> findRange(String logId, long fromSequence, long toSequence);
}
