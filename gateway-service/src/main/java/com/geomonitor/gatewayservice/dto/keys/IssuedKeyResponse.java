package com.geomonitor.gatewayservice.dto.keys;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.geomonitor.gatewayservice.models.PlanTier;
import com.geomonitor.gatewayservice.services.credentials.IssuedCredential;
import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.UUID;

@Data
@Builder
public class IssuedKeyResponse {

    static final String SHOWN_ONCE = "Store this API key securely. It will not be shown again.";

    @Builder.Default
    private boolean success = true;

    @JsonProperty("credential_id")
    private UUID credentialId;

    @JsonProperty("account_id")
    private UUID accountId;

    @JsonProperty("api_key")
    private String apiKey;

    @JsonProperty("key_prefix")
    private String keyPrefix;

    private PlanTier plan;

    @JsonProperty("created_at")
    private LocalDateTime createdAt;

    private String message;

    public static IssuedKeyResponse from(IssuedCredential issued) {
        return IssuedKeyResponse.builder()
                .credentialId(issued.credentialId())
                .accountId(issued.accountId())
                .apiKey(issued.token())
                .keyPrefix(issued.keyPrefix())
                .plan(issued.planTier())
                .createdAt(issued.createdAt())
                .message(SHOWN_ONCE)
                .build();
    }
}
