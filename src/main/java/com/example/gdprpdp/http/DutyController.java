package com.example.gdprpdp.http;

import com.example.gdprpdp.models.Duty;
import com.example.gdprpdp.service.DutyScheduler;
import com.example.gdprpdp.service.TickSummary;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class DutyController {

    private final DutyScheduler dutyScheduler;
    private final Clock clock;

    public DutyController(DutyScheduler dutyScheduler, Clock clock) {
        this.dutyScheduler = dutyScheduler;
        this.clock = clock;
    }

    @GetMapping("/duties")
    public ResponseEntity<List<Duty>> list(@RequestParam(name = "status", required = false) String status) {
        Optional<Duty.Status> filter = Optional.ofNullable(status)
                .filter(s -> !s.isBlank())
                .map(Duty.Status::fromString);
        return ResponseEntity.ok(dutyScheduler.list(filter));
    }

    /**
     * Runs a scheduler pass immediately. {@code now} (ISO-8601) overrides the server clock, which
     * lets operators flush duties that expire later.
     */
    @PostMapping("/duties/flush")
    public ResponseEntity<TickSummary> flush(@RequestParam(name = "now", required = false) String now) {
        Instant at;
        if (now == null || now.isBlank()) {
            at = clock.instant();
        } else {
            try {
                at = Instant.parse(now);
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("now must be an ISO-8601 instant: " + now, e);
            }
        }
        return ResponseEntity.ok(dutyScheduler.tick(at));
    }
}
