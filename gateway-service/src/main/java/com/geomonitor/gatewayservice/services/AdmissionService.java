package com.geomonitor.gatewayservice.services;

import com.geomonitor.gatewayservice.configurations.AdmissionProperties;
import com.geomonitor.gatewayservice.services.credentials.CredentialInfo;
import com.geomonitor.gatewayservice.services.credentials.CredentialStore;
import com.geomonitor.gatewayservice.services.quota.QuotaDecision;
import com.geomonitor.gatewayservice.services.quota.QuotaPolicy;
import com.geomonitor.gatewayservice.services.usage.UsageLedger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Resolve, evaluate and record steps of request admission.
 * <p>
 * Evaluation reads the window count and recording inserts later, with no
 * lock in between: concurrent calls near the ceiling can all be admitted.
 * The quota is approximate by design of the count-then-insert ledger.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AdmissionService {

    private final CredentialStore credentialStore;
    private final UsageLedger usageLedger;
    private final QuotaPolicy quotaPolicy;
    private final AdmissionProperties properties;
    private final AdmissionMetrics metrics;

    public boolean isMetered(String path) {
        return properties.isMetered(path);
    }

    public Optional<CredentialInfo> resolve(String token) {
        return credentialStore.resolve(token);
    }

    public QuotaDecision evaluate(CredentialInfo credential) {
        long used = usageLedger.countWindow(credential.credentialId(), properties.getWindowHours());
        QuotaDecision decision = quotaPolicy.evaluate(credential.planTier(), used);
        metrics.decision(decision);

        log.debug("Admission for key {}: plan={} used={} limit={} admitted={}",
                credential.keyPrefix(), decision.planTier().getValue(), decision.used(),
                decision.ceiling(), decision.admitted());
        return decision;
    }

    public void recordOutcome(CredentialInfo credential, String endpoint, long latencyMs, int statusCode) {
        usageLedger.record(credential.credentialId(), endpoint, latencyMs, statusCode);
    }
}
