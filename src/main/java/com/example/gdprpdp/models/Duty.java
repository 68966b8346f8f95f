package com.example.gdprpdp.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Builder.Default;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.NonNull;
import lombok.Setter;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbAttribute;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbIgnore;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbSecondaryPartitionKey;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbSecondarySortKey;

/**
 * A time-bound deletion obligation derived from a Permit decision. Duties are kept after they
 * reach a terminal state; they are the accountability record for the data they governed.
 */
@JsonInclude(Include.NON_NULL)
@DynamoDbBean
@NoArgsConstructor                     // needed for DynamoDB Enhanced Client reflection
@AllArgsConstructor(access = AccessLevel.PRIVATE) // used by Lombok @Builder
@Builder(toBuilder = true)
@Getter @Setter
public class Duty {

    public static final String STATUS_INDEX = "duties_by_status";

    // Required fields: Lombok @NonNull enforces runtime null checks in builder
    @NonNull
    @JsonProperty("duty_id")
    private String dutyId;

    @NonNull
    @JsonProperty("policy_id")
    private String policyId;

    @NonNull
    @JsonProperty("data_target")
    private String dataTarget;

    @NonNull
    @JsonProperty("created_at")
    private Long createdAt;

    @NonNull
    @JsonProperty("expires_at")
    private Long expiresAt;

    @NonNull
    @Default
    @JsonProperty("status")
    private Status status = Status.PENDING;

    @NonNull
    @Default
    @JsonProperty("attempt_count")
    private Integer attemptCount = 0;

    // Optional fields
    @JsonProperty("rule_id")
    private String ruleId;

    @JsonProperty("decision_sequence")
    private Long decisionSequence;

    @JsonProperty("last_error")
    private String lastError;

    @JsonProperty("updated_at")
    private Long updatedAt;

    @JsonProperty("completed_at")
    private Long completedAt;

    // ----- DynamoDB Enhanced annotations on getters -----

    @DynamoDbPartitionKey
    @DynamoDbAttribute("duty_id")
    public String getDutyId() { return dutyId; }

    @DynamoDbAttribute("policy_id")
    public String getPolicyId() { return policyId; }

    @DynamoDbAttribute("data_target")
    public String getDataTarget() { return dataTarget; }

    @DynamoDbAttribute("created_at")
    public Long getCreatedAt() { return createdAt; }

    @DynamoDbAttribute("expires_at")
    @DynamoDbSecondarySortKey(indexNames = STATUS_INDEX)
    public Long getExpiresAt() { return expiresAt; }

    @DynamoDbAttribute("status")
    @DynamoDbSecondaryPartitionKey(indexNames = STATUS_INDEX)
    public Status getStatus() { return status; }

    @DynamoDbAttribute("attempt_count")
    public Integer getAttemptCount() { return attemptCount; }

    @DynamoDbAttribute("rule_id")
    public String getRuleId() { return ruleId; }

    @DynamoDbAttribute("decision_sequence")
    public Long getDecisionSequence() { return decisionSequence; }

    @DynamoDbAttribute("last_error")
    public String getLastError() { return lastError; }

    @DynamoDbAttribute("updated_at")
    public Long getUpdatedAt() { return updatedAt; }

    @DynamoDbAttribute("completed_at")
    public Long getCompletedAt() { return completedAt; }

    @JsonIgnore
    @DynamoDbIgnore
    public boolean isTerminal() {
        return status == Status.COMPLETED || status == Status.FAILED;
    }

    /**
     * Copy of this duty tied to the audit entry of the decision that created it.
     */
    public Duty withDecisionSequence(long sequence) {
        return toBuilder().decisionSequence(sequence).build();
    }

    public boolean isDueAt(long cutoffMillis) {
        return status == Status.PENDING && expiresAt <= cutoffMillis;
    }

    public enum Status {
        PENDING,
        IN_PROGRESS,
        COMPLETED,
        FAILED;

        @JsonCreator
        public static Status fromString(String v) {
            for (Status s : values()) {
                if (s.name().equalsIgnoreCase(v)) {
                    return s;
                }
            }
            throw new IllegalArgumentException("Unknown Duty.Status: " + v);
        }
    }
}
