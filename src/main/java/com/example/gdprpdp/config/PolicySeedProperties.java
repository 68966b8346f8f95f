package com.example.gdprpdp.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "pdp.policies.seed")
@Data
public class PolicySeedProperties {

    private boolean enabled = false;
    private String location = "classpath:policies/seed-policies.json";
}
