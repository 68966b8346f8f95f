package com.example.gdprpdp.models;

import java.time.Duration;
import java.util.Objects;

/**
 * A retention duty attached to a Permit decision: delete {@code dataTarget} once
 * {@code retentionPeriod} has elapsed.
 */
public record Obligation(String dataTarget, Duration retentionPeriod, String ruleId) {

    public Obligation {
        Objects.requireNonNull(dataTarget, "dataTarget");
        Objects.requireNonNull(retentionPeriod, "retentionPeriod");
    }
}
