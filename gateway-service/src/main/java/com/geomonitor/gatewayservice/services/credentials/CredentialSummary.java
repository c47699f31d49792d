package com.geomonitor.gatewayservice.services.credentials;

import com.geomonitor.gatewayservice.models.ApiCredential;
import com.geomonitor.gatewayservice.models.PlanTier;

import java.time.LocalDateTime;
import java.util.UUID;

public record CredentialSummary(UUID credentialId, String keyPrefix, PlanTier planTier,
                                LocalDateTime createdAt, boolean active) {

    static CredentialSummary of(ApiCredential credential) {
        return new CredentialSummary(credential.getCredentialId(), credential.getKeyPrefix(),
                credential.getPlanTier(), credential.getCreatedAt(), credential.isActive());
    }
}
