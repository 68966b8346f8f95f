package com.example.gdprpdp.models;

/**
 * Result of re-walking the audit chain. {@code firstBadIndex} is the sequence number of the first
 * entry whose linkage or recomputed hash does not match, or null when the chain is intact.
 */
public record ChainVerification(boolean valid, Long firstBadIndex, long entriesChecked) {

    public static ChainVerification intact(long entriesChecked) {
        return new ChainVerification(true, null, entriesChecked);
    }

    public static ChainVerification brokenAt(long index, long entriesChecked) {
        return new ChainVerification(false, index, entriesChecked);
    }
}
