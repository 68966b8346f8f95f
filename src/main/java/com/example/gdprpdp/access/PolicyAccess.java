package com.example.gdprpdp.access;

import com.example.gdprpdp.models.Policy;
import java.util.List;
import java.util.Optional;

public interface PolicyAccess {
    Optional<Policy> findById(String policyId);

    List<Policy> findAll();

    Policy save(Policy policy);

    void delete(String policyId);
}
