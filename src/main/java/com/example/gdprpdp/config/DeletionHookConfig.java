package com.example.gdprpdp.config;

import com.example.gdprpdp.service.DeletionHook;
import com.example.gdprpdp.service.LoggingDeletionHook;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class DeletionHookConfig {

    // deployments replace this with a bean that erases the data
    @Bean
    @ConditionalOnMissingBean(DeletionHook.class)
    public DeletionHook deletionHook() {
        return new LoggingDeletionHook();
    }
}
