package com.example.gdprpdp.service;

import com.example.gdprpdp.access.PolicyAccess;
import com.example.gdprpdp.models.Policy;
import com.example.gdprpdp.models.PolicySet;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Validates policy definitions and stores them through {@link PolicyAccess}. Every write path runs
 * the full validation first; a batch load is rejected as a whole when any definition is invalid.
 */
@Slf4j
@Service
public class PolicyStoreService {

    private final PolicyAccess policyAccess;
    private final PolicyValidator validator;
    private final Clock clock;

    public PolicyStoreService(PolicyAccess policyAccess, PolicyValidator validator, Clock clock) {
        this.policyAccess = policyAccess;
        this.validator = validator;
        this.clock = clock;
    }

    /**
     * Validates every definition, then stores them all, replacing policies with the same id.
     *
     * @return the stored policies, ordered by id
     * @throws PdpException with {@code SCHEMA_INVALID} when any definition fails validation; nothing
     *                      is stored in that case
     */
    public PolicySet load(List<Policy> definitions) {
        Objects.requireNonNull(definitions, "definitions");
        validator.validateAll(definitions);

        long now = clock.millis();
        List<Policy> stored = new ArrayList<>(definitions.size());
        for (Policy definition : definitions) {
            Optional<Policy> existing = policyAccess.findById(definition.getPolicyId());
            stored.add(policyAccess.save(stamp(definition, existing, now)));
        }
        log.info("loaded {} policy definition(s)", stored.size());
        return new PolicySet(stored);
    }

    public Policy get(String policyId) {
        Objects.requireNonNull(policyId, "policyId");
        return policyAccess.findById(policyId)
                .orElseThrow(() -> PdpException.policyNotFound(policyId));
    }

    public List<Policy> list() {
        return policyAccess.findAll();
    }

    public Policy create(Policy definition) {
        Objects.requireNonNull(definition, "definition");
        validator.validate(definition);
        if (policyAccess.findById(definition.getPolicyId()).isPresent()) {
            throw PdpException.policyAlreadyExists(definition.getPolicyId());
        }
        Policy saved = policyAccess.save(stamp(definition, Optional.empty(), clock.millis()));
        log.info("created policy={} rules={}", saved.getPolicyId(), saved.rulesOrEmpty().size());
        return saved;
    }

    /**
     * Replaces an existing policy. {@code policyId} wins over any id in the body.
     */
    public Policy update(String policyId, Policy definition) {
        Objects.requireNonNull(policyId, "policyId");
        Objects.requireNonNull(definition, "definition");
        Policy candidate = definition.toBuilder().policyId(policyId).build();
        validator.validate(candidate);
        Policy existing = get(policyId);
        Policy saved = policyAccess.save(stamp(candidate, Optional.of(existing), clock.millis()));
        log.info("updated policy={} version={}", saved.getPolicyId(), saved.getVersion());
        return saved;
    }

    public void delete(String policyId) {
        get(policyId);
        policyAccess.delete(policyId);
        log.info("deleted policy={}", policyId);
    }

    private static Policy stamp(Policy definition, Optional<Policy> existing, long now) {
        return definition.toBuilder()
                .createdAt(existing.map(Policy::getCreatedAt).orElse(now))
                .updatedAt(now)
                .version(existing.map(Policy::getVersion).orElse(0L) + 1)
                .build();
    }
}
