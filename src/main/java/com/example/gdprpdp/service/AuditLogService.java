package com.example.gdprpdp.service;

import com.example.gdprpdp.access.AuditEntryAccess;
import com.example.gdprpdp.config.AuditLogProperties;
import com.example.gdprpdp.models.AuditEntry;
import com.example.gdprpdp.models.CanonicalJson;
import com.example.gdprpdp.models.ChainVerification;
import com.example.gdprpdp.models.Decision;
import com.example.gdprpdp.models.Duty;
import com.example.gdprpdp.models.Obligation;
import com.example.gdprpdp.models.RequestContext;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.LongFunction;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;

/**
 * Sole writer of the hash-chained audit log.
 *
 * <p>Appends are serialized by one lock that is held only while the next sequence number and hash
 * are computed and the entry is persisted. The current head is cached after the first read. If
 * storage reports that the next sequence number is already taken, some other process is writing
 * this log: the service refuses every later append until restarted.
 */
@Slf4j
@Service
public class AuditLogService {

    private final AuditEntryAccess auditEntryAccess;
    private final AuditLogProperties properties;
    private final Clock clock;

    private final ReentrantLock writeLock = new ReentrantLock();
    private AuditEntry head;          // guarded by writeLock
    private boolean headLoaded;       // guarded by writeLock
    private volatile boolean halted;

    public AuditLogService(AuditEntryAccess auditEntryAccess, AuditLogProperties properties, Clock clock) {
        this.auditEntryAccess = auditEntryAccess;
        this.properties = properties;
        this.clock = clock;
    }

    public String logId() {
        return properties.getLogId();
    }

    public boolean isHalted() {
        return halted;
    }

    public AuditEntry recordDecision(RequestContext context, Decision decision, String requestId) {
        return recordDecision(context, decision, requestId, List.of());
    }

    /**
     * Appends the Decision entry and stores the duties its obligations created in the same write,
     * each stamped with the entry's sequence. A Permit that promises deletion is therefore never
     * in the chain without its duties.
     */
    public AuditEntry recordDecision(RequestContext context, Decision decision, String requestId, List<Duty> duties) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("policy_id", decision.policyId());
        payload.put("effect", decision.effect().label());
        payload.put("matched_rule_id", decision.matchedRuleId());
        payload.put("obligations", decision.obligations().stream()
                .map(AuditLogService::obligationPayload)
                .collect(Collectors.toList()));
        payload.put("evaluated_at", decision.evaluatedAt().toString());
        payload.put("request_id", requestId);
        payload.put("context", contextPayload(context));
        List<Duty> planned = List.copyOf(duties);
        return appendInternal(AuditEntry.Kind.DECISION, CanonicalJson.write(payload),
                sequence -> planned.stream().map(d -> d.withDecisionSequence(sequence)).collect(Collectors.toList()));
    }

    /**
     * Appends the Delete entry for a duty whose deletion succeeded and stores the duty's
     * COMPLETED state in the same write.
     */
    public AuditEntry recordDutyCompleted(Duty completed) {
        Map<String, Object> payload = dutyPayload(completed);
        payload.put("failed", false);
        return appendWithDuty(AuditEntry.Kind.DELETE, payload, completed);
    }

    /**
     * Appends the Delete entry for a duty that exhausted its attempts and stores its FAILED state in
     * the same write.
     */
    public AuditEntry recordDutyFailed(Duty failed) {
        Map<String, Object> payload = dutyPayload(failed);
        payload.put("failed", true);
        payload.put("error", failed.getLastError());
        return appendWithDuty(AuditEntry.Kind.DELETE, payload, failed);
    }

    public AuditEntry append(AuditEntry.Kind kind, Map<String, ?> payload) {
        return appendInternal(kind, CanonicalJson.write(payload), sequence -> List.of());
    }

    private AuditEntry appendWithDuty(AuditEntry.Kind kind, Map<String, ?> payload, Duty duty) {
        return appendInternal(kind, CanonicalJson.write(payload), sequence -> List.of(duty));
    }

    private AuditEntry appendInternal(AuditEntry.Kind kind, String canonicalPayload, LongFunction<List<Duty>> dutiesAt) {
        writeLock.lock();
        try {
            if (halted) {
                throw PdpException.writerHalted(logId());
            }
            AuditEntry previous = currentHead();
            long sequence = previous == null ? 0L : previous.getSequence() + 1;
            AuditEntry entry = AuditEntry.builder()
                    .logId(logId())
                    .sequence(sequence)
                    .timestamp(clock.millis())
                    .kind(kind)
                    .payload(canonicalPayload)
                    .prevHash(previous == null ? AuditEntry.GENESIS_HASH : previous.getHash())
                    .build();
            List<Duty> duties = dutiesAt.apply(sequence);
            try {
                if (duties.isEmpty()) {
                    auditEntryAccess.append(entry);
                } else {
                    auditEntryAccess.appendWithDuties(entry, duties);
                }
            } catch (ConditionalCheckFailedException e) {
                halted = true;
                log.error("audit log={} write conflict at seq={}; halting writer", logId(), sequence, e);
                throw PdpException.concurrentWriteConflict(logId(), sequence, e);
            } catch (RuntimeException e) {
                // the write may have landed anyway; the next append re-reads the stored head
                headLoaded = false;
                log.warn("audit log={} append at seq={} failed: {}", logId(), sequence, e.getMessage());
                throw e;
            }
            head = entry;
            log.debug("audit log={} appended seq={} kind={}", logId(), sequence, kind.label());
            return entry;
        } finally {
            writeLock.unlock();
        }
    }

    private AuditEntry currentHead() {
        if (!headLoaded) {
            head = auditEntryAccess.findLatest(logId()).orElse(null);
            headLoaded = true;
        }
        return head;
    }

    /**
     * Latest persisted entry, read from storage.
     */
    public Optional<AuditEntry> head() {
        return auditEntryAccess.findLatest(logId());
    }

    /**
     * Entries with {@code from <= sequence <= to}, ascending. At most the configured page size is
     * returned; callers page by advancing {@code from}.
     */
    public List<AuditEntry> read(long from, long to) {
        if (from < 0 || to < from) {
            throw PdpException.invalidRequest("invalid range from=" + from + " to=" + to);
        }
        return auditEntryAccess.findRange(logId(), from, pageEnd(from, to));
    }

    /**
     * Walks every entry up to the head at call time, one page at a time.
     */
    public void forEachEntry(Consumer<AuditEntry> consumer) {
        Optional<AuditEntry> snapshotHead = head();
        if (snapshotHead.isEmpty()) {
            return;
        }
        long last = snapshotHead.get().getSequence();
        long from = 0;
        while (from <= last) {
            long to = pageEnd(from, last);
            auditEntryAccess.findRange(logId(), from, to).forEach(consumer);
            from = to + 1;
        }
    }

    /**
     * Re-walks the chain from genesis up to the head observed at call time. Appends running
     * concurrently are not blocked; entries added after the snapshot are not checked.
     */
    public ChainVerification verify() {
        Optional<AuditEntry> snapshotHead = head();
        if (snapshotHead.isEmpty()) {
            return ChainVerification.intact(0);
        }
        long last = snapshotHead.get().getSequence();
        long expected = 0;
        String prevHash = AuditEntry.GENESIS_HASH;

        while (expected <= last) {
            long to = pageEnd(expected, last);
            List<AuditEntry> page = auditEntryAccess.findRange(logId(), expected, to);
            if (page.isEmpty()) {
                return broken(expected);
            }
            for (AuditEntry entry : page) {
                if (entry.getSequence() != expected
                        || !prevHash.equals(entry.getPrevHash())
                        || !entry.hashMatches()) {
                    return broken(expected);
                }
                prevHash = entry.getHash();
                expected++;
            }
        }
        return ChainVerification.intact(expected);
    }

    public ChainVerification verifyOrThrow() {
        ChainVerification result = verify();
        if (!result.valid()) {
            throw PdpException.chainVerificationFailed(result.firstBadIndex());
        }
        return result;
    }

    private ChainVerification broken(long index) {
        log.error("audit log={} chain broken at seq={}", logId(), index);
        return ChainVerification.brokenAt(index, index);
    }

    private int pageSize() {
        return Math.max(1, properties.getMaxReadPageSize());
    }

    // last sequence of the page starting at from; never past limit, never overflowing
    private long pageEnd(long from, long limit) {
        return limit - from < pageSize() ? limit : from + pageSize() - 1;
    }

    private static Map<String, Object> obligationPayload(Obligation obligation) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("data_target", obligation.dataTarget());
        map.put("retention_period", obligation.retentionPeriod().toString());
        map.put("rule_id", obligation.ruleId());
        return map;
    }

    private static Map<String, Object> contextPayload(RequestContext context) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("role", context.role());
        map.put("purpose", context.purpose());
        map.put("data_target", context.dataTarget());
        map.put("location", context.location());
        map.put("timestamp", context.timestamp().toString());
        return map;
    }

    private static Map<String, Object> dutyPayload(Duty duty) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("duty_id", duty.getDutyId());
        map.put("policy_id", duty.getPolicyId());
        map.put("rule_id", duty.getRuleId());
        map.put("data_target", duty.getDataTarget());
        map.put("decision_sequence", duty.getDecisionSequence());
        map.put("expires_at", Instant.ofEpochMilli(duty.getExpiresAt()).toString());
        map.put("executed_at", duty.getUpdatedAt() == null ? null : Instant.ofEpochMilli(duty.getUpdatedAt()).toString());
        map.put("attempt_count", duty.getAttemptCount());
        return map;
    }
}
