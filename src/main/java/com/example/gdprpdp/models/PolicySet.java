package com.example.gdprpdp.models;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Immutable, id-ordered snapshot of the policies produced by one load.
 */
public record PolicySet(List<Policy> policies) {

    public PolicySet {
        policies = policies.stream()
                .sorted(Comparator.comparing(Policy::getPolicyId))
                .toList();
    }

    public Optional<Policy> get(String policyId) {
        return policies.stream()
                .filter(p -> p.getPolicyId().equals(policyId))
                .findFirst();
    }

    public int size() {
        return policies.size();
    }
}
