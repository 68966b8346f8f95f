package com.example.gdprpdp.service;

/**
 * Performs the actual erasure a retention duty calls for. The scheduler may call it more than once
 * for the same duty (a pass can die after the hook returned but before the outcome was recorded),
 * so implementations must treat a repeated call for an already-deleted target as success.
 */
@FunctionalInterface
public interface DeletionHook {

    /**
     * @param dataTarget the data category to erase
     * @throws Exception when the deletion could not be carried out; the duty is retried
     */
    void delete(String dataTarget) throws Exception;
}
