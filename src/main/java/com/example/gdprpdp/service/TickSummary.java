package com.example.gdprpdp.service;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Counts from one scheduler pass. {@code due} is the number of duties the pass picked up;
 * {@code stillPending} are those returned to PENDING for a retry or left IN_PROGRESS because the
 * outcome could not be recorded. A skipped pass did nothing because another pass was running.
 */
public record TickSummary(
        @JsonProperty("due") int due,
        @JsonProperty("completed") int completed,
        @JsonProperty("failed") int failed,
        @JsonProperty("still_pending") int stillPending,
        @JsonProperty("skipped") boolean skipped
) {

    public static TickSummary skippedPass() {
        return new TickSummary(0, 0, 0, 0, true);
    }
}
