package com.example.gdprpdp.access;

import com.example.gdprpdp.models.Duty;
import java.util.List;
import java.util.Optional;

public interface DutyAccess {
    Optional<Duty> findById(String dutyId);

    /**
     * Finds duties in {@code status} whose expires_at is at or before the cutoff, using the
     * duties_by_status GSI, ordered by expires_at ascending.
     *
     * @param status the lifecycle state to query
     * @param cutoffMillis duties with expires_at <= this value will be returned
     * @return matching duties, earliest expiry first
     */
    List<Duty> findByStatusExpiringBy(Duty.Status status, long cutoffMillis);

    List<Duty> findByStatus(Duty.Status status);

    List<Duty> findAll();

    Duty save(Duty duty);
}
