package com.example.gdprpdp.service;

import java.time.Clock;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Scheduled trigger for {@link DutyScheduler#tick}. Runs only when
 * pdp.duties.scheduler.enabled=true; the scheduler itself guards against overlapping passes.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(value = "pdp.duties.scheduler.enabled", havingValue = "true")
public class DutySweepJob {

    private final Clock clock;
    private final DutyScheduler dutyScheduler;

    @Scheduled(cron = "${pdp.duties.scheduler.schedule:0 * * * * *}")
    public void sweep() {
        long startTime = clock.millis();
        String jobRequestId = "duty-sweep-" + UUID.randomUUID();
        try {
            TickSummary summary = dutyScheduler.tick(clock.instant());
            long duration = clock.millis() - startTime;
            log.info("[{}] Completed duty sweep in {}ms: {}", jobRequestId, duration, summary);
        } catch (Exception ex) {
            log.error("[{}] Duty sweep aborted: {}", jobRequestId, ex.getMessage(), ex);
        }
    }
}
