package com.example.gdprpdp.service;

import lombok.extern.slf4j.Slf4j;

/**
 * Default hook used when no deployment-specific bean is registered. It only records the request.
 */
@Slf4j
public class LoggingDeletionHook implements DeletionHook {

    @Override
    public void delete(String dataTarget) {
        log.info("deletion requested for data_target={}", dataTarget);
    }
}
