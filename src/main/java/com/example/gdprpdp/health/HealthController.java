package com.example.gdprpdp.health;

import com.example.gdprpdp.models.AuditEntry;
import com.example.gdprpdp.service.AuditLogService;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.info.BuildProperties;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
public class HealthController {

    private final BuildProperties buildProperties;
    private final AuditLogService auditLogService;
    private final Clock clock;
    private final String env;

    public HealthController(@Value("${app.env:local}") String env,
                            ObjectProvider<BuildProperties> buildProperties,
                            AuditLogService auditLogService,
                            Clock clock) {
        this.env = env;
        this.buildProperties = buildProperties.getIfAvailable();
        this.auditLogService = auditLogService;
        this.clock = clock;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", auditLogService.isHalted() ? "degraded" : "ok");
        body.put("ts", clock.instant().toString());
        body.put("env", env);
        body.put("app", buildProperties != null ? buildProperties.getName() : "gdpr-pdp");
        body.put("version", buildProperties != null ? buildProperties.getVersion() : "dev");
        body.put("audit_log_id", auditLogService.logId());
        try {
            body.put("audit_head_sequence", auditLogService.head().map(AuditEntry::getSequence).orElse(null));
        } catch (RuntimeException e) {
            log.warn("could not read audit head: {}", e.getMessage());
            body.put("status", "degraded");
        }
        return ResponseEntity.ok(body);
    }
}
