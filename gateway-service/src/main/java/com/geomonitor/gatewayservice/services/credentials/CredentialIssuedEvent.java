package com.geomonitor.gatewayservice.services.credentials;

import com.geomonitor.gatewayservice.models.PlanTier;

import java.util.UUID;

public record CredentialIssuedEvent(UUID credentialId, UUID accountId, String keyPrefix, PlanTier planTier) {
}
