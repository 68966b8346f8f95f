package com.example.gdprpdp.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for the retention-duty sweep, bound from application.yml
 * (pdp.duties.scheduler.*). To run the sweep on a schedule set pdp.duties.scheduler.enabled=true;
 * {@code POST /duties/flush} works either way.
 */
@Component
@ConfigurationProperties(prefix = "pdp.duties.scheduler")
@Data
public class DutySchedulerProperties {

    private boolean enabled = false;
    private String schedule = "0 * * * * *";  // every minute
    private int maxAttempts = 3;
    private int batchSize = 100;
}
