package com.geomonitor.gatewayservice.repository;

import com.geomonitor.gatewayservice.models.UsageRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.UUID;

@Repository
public interface UsageRecordRepository extends JpaRepository<UsageRecord, Long> {

    long countByCredentialIdAndCreatedAtAfter(UUID credentialId, LocalDateTime since);

    long countByCredentialId(UUID credentialId);
}
