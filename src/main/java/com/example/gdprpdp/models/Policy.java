package com.example.gdprpdp.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.ArrayList;
import java.util.List;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbAttribute;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbConvertedBy;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;

@JsonInclude(Include.NON_NULL)
@DynamoDbBean
@NoArgsConstructor                     // required by DynamoDB Enhanced Client
@AllArgsConstructor(access = AccessLevel.PRIVATE) // used by Lombok @Builder
@Builder(toBuilder = true)
@Getter @Setter
public class Policy {

    @NotBlank
    @JsonProperty("policy_id")
    private String policyId;

    @JsonProperty("description")
    private String description;

    @NotNull
    @Valid
    @JsonProperty("rules")
    private List<Rule> rules;

    // null means UNION
    @JsonProperty("obligation_combining")
    private ObligationCombining obligationCombining;

    @JsonProperty("version")
    private Long version;

    @JsonProperty("created_at")
    private Long createdAt;

    @JsonProperty("updated_at")
    private Long updatedAt;

    @DynamoDbPartitionKey
    @DynamoDbAttribute("policy_id")
    public String getPolicyId() {
        return policyId;
    }

    @DynamoDbAttribute("description")
    public String getDescription() {
        return description;
    }

    @DynamoDbConvertedBy(RuleListAttributeConverter.class)
    @DynamoDbAttribute("rules")
    public List<Rule> getRules() {
        return rules;
    }

    @DynamoDbAttribute("obligation_combining")
    public ObligationCombining getObligationCombining() {
        return obligationCombining;
    }

    @DynamoDbAttribute("version")
    public Long getVersion() {
        return version;
    }

    @DynamoDbAttribute("created_at")
    public Long getCreatedAt() {
        return createdAt;
    }

    @DynamoDbAttribute("updated_at")
    public Long getUpdatedAt() {
        return updatedAt;
    }

    public ObligationCombining effectiveCombining() {
        return obligationCombining == null ? ObligationCombining.UNION : obligationCombining;
    }

    public List<Rule> rulesOrEmpty() {
        return rules == null ? List.of() : rules;
    }

    public static class PolicyBuilder {
        public PolicyBuilder rule(Rule rule) {
            List<Rule> next = this.rules == null ? new ArrayList<>() : new ArrayList<>(this.rules);
            next.add(rule);
            this.rules = next;
            return this;
        }
    }
}
