package com.example.gdprpdp.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * One access/retention rule inside a {@link Policy}. Each of the four matching fields is either a
 * literal or {@link #WILDCARD}. Rules are stored inside their policy as JSON, so this class carries
 * no DynamoDB mapping of its own.
 */
@JsonInclude(Include.NON_NULL)
@NoArgsConstructor
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder(toBuilder = true)
@Getter @Setter
public class Rule {

    public static final String WILDCARD = "*";

    // Specificity tie-break weights: location > dataTarget > purpose > role.
    static final int LOCATION_WEIGHT = 8;
    static final int DATA_TARGET_WEIGHT = 4;
    static final int PURPOSE_WEIGHT = 2;
    static final int ROLE_WEIGHT = 1;

    /**
     * Highest specificity first; equal ranks fall back to rule id so ordering never depends on
     * the order rules were declared in.
     */
    public static final Comparator<Rule> BY_SPECIFICITY = Comparator
            .comparingInt(Rule::specificityRank).reversed()
            .thenComparing(Rule::getRuleId, Comparator.nullsLast(Comparator.naturalOrder()));

    @NotBlank
    @JsonProperty("rule_id")
    private String ruleId;

    @NotBlank
    @JsonProperty("role")
    private String role;

    @NotBlank
    @JsonProperty("purpose")
    private String purpose;

    @NotBlank
    @JsonProperty("data_target")
    private String dataTarget;

    @NotBlank
    @JsonProperty("location")
    private String location;

    @NotNull
    @JsonProperty("effect")
    private Effect effect;

    // ISO-8601 duration, e.g. "P30D"
    @JsonProperty("retention_period")
    private String retentionPeriod;

    @JsonProperty("retention_bearing")
    private Boolean retentionBearing;

    // ISO-8601 instants bounding when the rule applies
    @JsonProperty("valid_from")
    private String validFrom;

    @JsonProperty("valid_until")
    private String validUntil;

    @JsonProperty("description")
    private String description;

    /**
     * A rule imposes a retention duty when flagged explicitly, or, without a flag, when it declares a
     * retention period.
     */
    @JsonIgnore
    public boolean isRetentionImposing() {
        if (retentionBearing != null) {
            return retentionBearing;
        }
        return retentionPeriod != null && !retentionPeriod.isBlank();
    }

    public Duration retentionDuration() {
        return retentionPeriod == null ? null : Duration.parse(retentionPeriod);
    }

    public boolean matches(RequestContext ctx) {
        return fieldMatches(role, ctx.role())
                && fieldMatches(purpose, ctx.purpose())
                && fieldMatches(dataTarget, ctx.dataTarget())
                && fieldMatches(location, ctx.location())
                && isValidAt(ctx.timestamp());
    }

    public boolean isValidAt(Instant instant) {
        if (validFrom != null && instant.isBefore(Instant.parse(validFrom))) {
            return false;
        }
        return validUntil == null || !instant.isAfter(Instant.parse(validUntil));
    }

    /**
     * Literal-field count in the high bits, tie-break mask in the low four bits. Two rules share a
     * specificity tier exactly when their ranks are equal.
     */
    public int specificityRank() {
        int mask = 0;
        if (isLiteral(location)) {
            mask |= LOCATION_WEIGHT;
        }
        if (isLiteral(dataTarget)) {
            mask |= DATA_TARGET_WEIGHT;
        }
        if (isLiteral(purpose)) {
            mask |= PURPOSE_WEIGHT;
        }
        if (isLiteral(role)) {
            mask |= ROLE_WEIGHT;
        }
        return (Integer.bitCount(mask) << 4) | mask;
    }

    /**
     * The target an obligation from this rule applies to: the rule's own literal target, or the
     * requested target when the rule covers every target.
     */
    public String resolveDataTarget(RequestContext ctx) {
        return isLiteral(dataTarget) ? dataTarget : ctx.dataTarget();
    }

    public static boolean isWildcard(String value) {
        return WILDCARD.equals(value);
    }

    private static boolean isLiteral(String value) {
        return !isWildcard(value);
    }

    private static boolean fieldMatches(String pattern, String value) {
        return isWildcard(pattern) || (pattern != null && pattern.equals(value));
    }
}
