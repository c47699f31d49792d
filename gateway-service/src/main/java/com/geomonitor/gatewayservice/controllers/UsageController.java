package com.geomonitor.gatewayservice.controllers;

import com.geomonitor.gatewayservice.annotations.ResolvedApiKey;
import com.geomonitor.gatewayservice.configurations.AdmissionProperties;
import com.geomonitor.gatewayservice.dto.keys.KeySummaryResponse;
import com.geomonitor.gatewayservice.dto.usage.UsageStatsResponse;
import com.geomonitor.gatewayservice.services.credentials.CredentialInfo;
import com.geomonitor.gatewayservice.services.credentials.CredentialStore;
import com.geomonitor.gatewayservice.services.quota.QuotaDecision;
import com.geomonitor.gatewayservice.services.quota.QuotaPolicy;
import com.geomonitor.gatewayservice.services.usage.UsageLedger;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Key-protected endpoints. The caller's key is resolved once by the admission
 * filter; an unresolved key is answered with 401 here.
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class UsageController {

    private final UsageLedger usageLedger;
    private final QuotaPolicy quotaPolicy;
    private final CredentialStore credentialStore;
    private final AdmissionProperties admissionProperties;

    /**
     * Usage of the calling key in the current window, not counting this call.
     */
    @GetMapping("/usage")
    public ResponseEntity<UsageStatsResponse> usage(@ResolvedApiKey CredentialInfo credential) {
        int windowHours = admissionProperties.getWindowHours();
        long used = usageLedger.countWindow(credential.credentialId(), windowHours);
        QuotaDecision decision = quotaPolicy.evaluate(credential.planTier(), used);

        UsageStatsResponse response = UsageStatsResponse.builder()
                .keyPrefix(credential.keyPrefix())
                .plan(decision.planTier())
                .limit(decision.ceiling())
                .used(decision.used())
                .remaining(decision.remaining())
                .periodHours(windowHours)
                .build();
        return ResponseEntity.ok(response);
    }

    @GetMapping("/keys")
    public ResponseEntity<List<KeySummaryResponse>> keys(@ResolvedApiKey CredentialInfo credential) {
        List<KeySummaryResponse> keys = credentialStore.listForAccount(credential.accountId()).stream()
                .map(KeySummaryResponse::from)
                .toList();
        return ResponseEntity.ok(keys);
    }
}
