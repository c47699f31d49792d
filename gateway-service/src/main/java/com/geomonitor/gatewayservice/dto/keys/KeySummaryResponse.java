package com.geomonitor.gatewayservice.dto.keys;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.geomonitor.gatewayservice.models.PlanTier;
import com.geomonitor.gatewayservice.services.credentials.CredentialSummary;

import java.time.LocalDateTime;
import java.util.UUID;

public record KeySummaryResponse(
        @JsonProperty("credential_id") UUID credentialId,
        @JsonProperty("key_prefix") String keyPrefix,
        PlanTier plan,
        @JsonProperty("created_at") LocalDateTime createdAt,
        boolean active) {

    public static KeySummaryResponse from(CredentialSummary summary) {
        return new KeySummaryResponse(summary.credentialId(), summary.keyPrefix(), summary.planTier(),
                summary.createdAt(), summary.active());
    }
}
