package com.example.gdprpdp.models;

import java.time.Instant;
import java.util.Objects;

/**
 * The attributes of one data-processing request. Built once per request at the caller-facing
 * boundary, which is where malformed input is rejected.
 */
public record RequestContext(
        String role,
        String purpose,
        String dataTarget,
        String location,
        Instant timestamp
) {

    public RequestContext {
        requireText(role, "role");
        requireText(purpose, "purpose");
        requireText(dataTarget, "dataTarget");
        requireText(location, "location");
        Objects.requireNonNull(timestamp, "timestamp");
    }

    private static void requireText(String value, String name) {
        Objects.requireNonNull(value, name);
        if (value.isBlank()) {
            throw new IllegalArgumentException(name + " must be non-blank");
        }
        if (Rule.isWildcard(value)) {
            throw new IllegalArgumentException(name + " must be a concrete value, not a wildcard");
        }
    }
}
