package com.example.gdprpdp.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for the audit chain, bound from application.yml (pdp.audit.*).
 * One running instance is the only writer of the log named by {@code logId}.
 */
@Component
@ConfigurationProperties(prefix = "pdp.audit")
@Data
public class AuditLogProperties {

    private String logId = "main";
    private int maxReadPageSize = 500;
    private boolean verifyOnStartup = false;
}
