package com.geomonitor.gatewayservice.models;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

@Entity
@Table(name = "usage_records",
        indexes = @Index(name = "idx_usage_records_credential_created", columnList = "credential_id, created_at"))
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class UsageRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long usageRecordId;

    @Column(name = "credential_id", nullable = false, updatable = false)
    private UUID credentialId;

    @Column(nullable = false, updatable = false)
    private String endpoint;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(updatable = false)
    private Long latencyMs;

    @Column(updatable = false)
    private Integer statusCode;
}
