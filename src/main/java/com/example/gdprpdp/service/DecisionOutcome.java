package com.example.gdprpdp.service;

import com.example.gdprpdp.models.AuditEntry;
import com.example.gdprpdp.models.Decision;
import com.example.gdprpdp.models.Duty;
import java.util.List;

public record DecisionOutcome(Decision decision, AuditEntry auditEntry, List<Duty> duties) {

    public DecisionOutcome {
        duties = duties == null ? List.of() : List.copyOf(duties);
    }
}
