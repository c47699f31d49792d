package com.geomonitor.gatewayservice.services.credentials;

import com.geomonitor.gatewayservice.models.PlanTier;

import java.util.UUID;

/**
 * What a resolved API key grants: the credential, its owning account and plan.
 */
public record CredentialInfo(UUID credentialId, UUID accountId, String keyPrefix, PlanTier planTier) {
}
