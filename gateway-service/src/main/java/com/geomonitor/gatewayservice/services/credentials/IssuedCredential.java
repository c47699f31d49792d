package com.geomonitor.gatewayservice.services.credentials;

import com.geomonitor.gatewayservice.models.PlanTier;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Result of issuing a key. This is the only place the plain token exists.
 */
public record IssuedCredential(UUID credentialId, UUID accountId, String token, String keyPrefix,
                               PlanTier planTier, LocalDateTime createdAt) {

    @Override
    public String toString() {
        return "IssuedCredential[credentialId=" + credentialId + ", accountId=" + accountId
                + ", keyPrefix=" + keyPrefix + ", planTier=" + planTier + "]";
    }
}
