package com.example.gdprpdp.service;

import com.example.gdprpdp.access.DutyAccess;
import com.example.gdprpdp.config.DutySchedulerProperties;
import com.example.gdprpdp.models.Decision;
import com.example.gdprpdp.models.Duty;
import com.example.gdprpdp.models.Obligation;
import com.example.gdprpdp.models.RequestContext;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Owns the retention-duty lifecycle: creates PENDING duties from Permit decisions and, on each
 * pass, executes the overdue ones through the {@link DeletionHook}.
 *
 * <p>A duty reaches COMPLETED or FAILED only in the same atomic write that appends its Delete audit
 * entry. When that write fails the duty stays IN_PROGRESS and the next pass runs the hook again,
 * which is why the hook has to be idempotent.
 */
@Slf4j
@Service
public class DutyScheduler {

    private static final Comparator<Duty> BY_EXPIRY = Comparator
            .comparing(Duty::getExpiresAt)
            .thenComparing(Duty::getDutyId);

    private final DutyAccess dutyAccess;
    private final AuditLogService auditLogService;
    private final DeletionHook deletionHook;
    private final DutySchedulerProperties properties;
    private final Clock clock;

    private final ReentrantLock passLock = new ReentrantLock();

    public DutyScheduler(DutyAccess dutyAccess,
                         AuditLogService auditLogService,
                         DeletionHook deletionHook,
                         DutySchedulerProperties properties,
                         Clock clock) {
        this.dutyAccess = dutyAccess;
        this.auditLogService = auditLogService;
        this.deletionHook = deletionHook;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Builds, without storing, one PENDING duty per obligation of a Permit decision. Deny decisions
     * and permits without obligations yield nothing. The duties are not yet tied to an audit entry;
     * {@link AuditLogService#recordDecision(RequestContext, Decision, String, List)} stamps and
     * stores them together with the decision.
     */
    public List<Duty> plan(Decision decision) {
        Objects.requireNonNull(decision, "decision");
        if (!decision.isPermit() || decision.obligations().isEmpty()) {
            return List.of();
        }
        long createdAt = decision.evaluatedAt().toEpochMilli();
        List<Duty> planned = new ArrayList<>();
        for (Obligation obligation : decision.obligations()) {
            planned.add(Duty.builder()
                    .dutyId(UUID.randomUUID().toString())
                    .policyId(decision.policyId())
                    .ruleId(obligation.ruleId())
                    .dataTarget(obligation.dataTarget())
                    .createdAt(createdAt)
                    .expiresAt(decision.evaluatedAt().plus(obligation.retentionPeriod()).toEpochMilli())
                    .status(Duty.Status.PENDING)
                    .attemptCount(0)
                    .updatedAt(createdAt)
                    .build());
        }
        return planned;
    }

    /**
     * Stores the duties of a decision already recorded at {@code decisionSequence}.
     *
     * @param decision         the decision just recorded
     * @param decisionSequence audit sequence of the decision's entry
     * @return the duties created, in obligation order
     */
    public List<Duty> onDecision(Decision decision, long decisionSequence) {
        List<Duty> created = new ArrayList<>();
        for (Duty duty : plan(decision)) {
            created.add(dutyAccess.save(duty.withDecisionSequence(decisionSequence)));
            logCreated(duty);
        }
        return created;
    }

    void logCreated(Duty duty) {
        log.info("created duty={} target={} expires_at={}",
                duty.getDutyId(), duty.getDataTarget(), Instant.ofEpochMilli(duty.getExpiresAt()));
    }

    public TickSummary tick() {
        return tick(clock.instant());
    }

    /**
     * Runs one pass over the duties due at {@code now}. Returns a skipped summary without waiting
     * when another pass holds the scheduler.
     */
    public TickSummary tick(Instant now) {
        Objects.requireNonNull(now, "now");
        if (!passLock.tryLock()) {
            log.info("duty pass already running; skipping tick at {}", now);
            return TickSummary.skippedPass();
        }
        try {
            return runPass(now);
        } finally {
            passLock.unlock();
        }
    }

    public List<Duty> list(Optional<Duty.Status> status) {
        return status.map(dutyAccess::findByStatus).orElseGet(dutyAccess::findAll);
    }

    private TickSummary runPass(Instant now) {
        String passId = "duty-pass-" + UUID.randomUUID();
        long cutoff = now.toEpochMilli();

        // IN_PROGRESS duties here were left behind by a pass that never recorded their outcome
        List<Duty> snapshot = Stream.concat(
                        dutyAccess.findByStatusExpiringBy(Duty.Status.PENDING, cutoff).stream(),
                        dutyAccess.findByStatus(Duty.Status.IN_PROGRESS).stream())
                .sorted(BY_EXPIRY)
                .limit(Math.max(1, properties.getBatchSize()))
                .collect(Collectors.toList());

        log.info("[{}] {} duty(ies) due at {}", passId, snapshot.size(), now);

        int due = 0;
        int completed = 0;
        int failed = 0;
        int stillPending = 0;
        int visited = 0;

        for (Duty candidate : snapshot) {
            if (Thread.currentThread().isInterrupted()) {
                log.warn("[{}] interrupted; leaving {} duty(ies) for the next pass",
                        passId, snapshot.size() - visited);
                break;
            }
            visited++;
            Outcome outcome = process(candidate, cutoff, passId);
            if (outcome == Outcome.SKIPPED) {
                continue;
            }
            due++;
            switch (outcome) {
                case COMPLETED -> completed++;
                case FAILED -> failed++;
                default -> stillPending++;
            }
        }

        log.info("[{}] pass finished: due={} completed={} failed={} still_pending={}",
                passId, due, completed, failed, stillPending);
        return new TickSummary(due, completed, failed, stillPending, false);
    }

    private Outcome process(Duty candidate, long cutoff, String passId) {
        Optional<Duty> current = dutyAccess.findById(candidate.getDutyId());
        if (current.isEmpty() || current.get().isTerminal()
                || (current.get().getStatus() == Duty.Status.PENDING && !current.get().isDueAt(cutoff))) {
            log.debug("[{}] duty={} no longer due; skipping", passId, candidate.getDutyId());
            return Outcome.SKIPPED;
        }

        Duty inProgress = dutyAccess.save(current.get().toBuilder()
                .status(Duty.Status.IN_PROGRESS)
                .updatedAt(cutoff)
                .build());

        try {
            deletionHook.delete(inProgress.getDataTarget());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[{}] duty={} interrupted inside deletion hook", passId, inProgress.getDutyId());
            return Outcome.DEFERRED;
        } catch (Exception e) {
            return onHookFailure(inProgress, e, cutoff, passId);
        }

        Duty done = inProgress.toBuilder()
                .status(Duty.Status.COMPLETED)
                .completedAt(cutoff)
                .updatedAt(cutoff)
                .build();
        return recordOutcome(() -> auditLogService.recordDutyCompleted(done), Outcome.COMPLETED, done, passId);
    }

    private Outcome onHookFailure(Duty inProgress, Exception cause, long now, String passId) {
        int attempts = inProgress.getAttemptCount() + 1;
        String error = PdpException.dutyExecutionFailed(inProgress.getDutyId(), cause).getMessage();

        if (attempts < properties.getMaxAttempts()) {
            log.warn("[{}] {} (attempt {}/{}); will retry",
                    passId, error, attempts, properties.getMaxAttempts());
            try {
                dutyAccess.save(inProgress.toBuilder()
                        .status(Duty.Status.PENDING)
                        .attemptCount(attempts)
                        .lastError(error)
                        .updatedAt(now)
                        .build());
            } catch (RuntimeException e) {
                log.error("[{}] could not return duty={} to PENDING: {}",
                        passId, inProgress.getDutyId(), e.getMessage(), e);
            }
            return Outcome.DEFERRED;
        }

        log.error("[{}] {} (attempt {}/{}); giving up", passId, error, attempts, properties.getMaxAttempts());
        Duty failed = inProgress.toBuilder()
                .status(Duty.Status.FAILED)
                .attemptCount(attempts)
                .lastError(error)
                .completedAt(now)
                .updatedAt(now)
                .build();
        return recordOutcome(() -> auditLogService.recordDutyFailed(failed), Outcome.FAILED, failed, passId);
    }

    private Outcome recordOutcome(Supplier<?> write, Outcome success, Duty duty, String passId) {
        try {
            write.get();
            log.info("[{}] duty={} {}", passId, duty.getDutyId(), duty.getStatus());
            return success;
        } catch (PdpException e) {
            if (e.getCode() == PdpException.Code.CONCURRENT_WRITE_CONFLICT) {
                throw e;
            }
            log.error("[{}] could not record outcome for duty={}: {}", passId, duty.getDutyId(), e.getMessage(), e);
            return Outcome.DEFERRED;
        } catch (RuntimeException e) {
            log.error("[{}] could not record outcome for duty={}: {}", passId, duty.getDutyId(), e.getMessage(), e);
            return Outcome.DEFERRED;
        }
    }

    private enum Outcome { COMPLETED, FAILED, DEFERRED, SKIPPED }
}
