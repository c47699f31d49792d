package com.geomonitor.gatewayservice.services.credentials;

import com.geomonitor.gatewayservice.exceptions.ResourceNotFoundException;
import com.geomonitor.gatewayservice.models.Account;
import com.geomonitor.gatewayservice.models.ApiCredential;
import com.geomonitor.gatewayservice.models.PlanTier;
import com.geomonitor.gatewayservice.repository.AccountRepository;
import com.geomonitor.gatewayservice.repository.ApiCredentialRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class CredentialStore {

    private final ApiCredentialRepository credentials;
    private final AccountRepository accounts;
    private final CredentialIssuer issuer;
    private final TokenFingerprinter fingerprinter;
    private final ApplicationEventPublisher events;

    /**
     * Issue a new key for the account. The returned token is never stored and
     * cannot be retrieved again.
     * Not transactional: each insert attempt commits on its own so a
     * fingerprint collision can be retried with a fresh token.
     *
     * @param accountId owning account
     * @param planTier plan the key is billed under
     * @return the issued credential including the plain token
     */
    public IssuedCredential issue(UUID accountId, PlanTier planTier) {
        Account account = accounts.findById(accountId)
                .orElseThrow(() -> new ResourceNotFoundException("Account", accountId.toString()));

        IssuedCredential issued = issuer.insert(account, planTier);

        log.info("Issued {} key {} for account {}", planTier.getValue(), issued.keyPrefix(), accountId);
        events.publishEvent(new CredentialIssuedEvent(issued.credentialId(), accountId,
                issued.keyPrefix(), planTier));
        return issued;
    }

    /**
     * Resolve a presented token to an active credential of an active account.
     */
    @Transactional(readOnly = true)
    public Optional<CredentialInfo> resolve(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        return credentials.findActiveByFingerprint(fingerprinter.fingerprint(token));
    }

    @Transactional
    public void revoke(UUID credentialId) {
        ApiCredential credential = credentials.findById(credentialId)
                .orElseThrow(() -> new ResourceNotFoundException("API key", credentialId.toString()));

        if (!credential.isActive()) {
            log.debug("Key {} already revoked", credential.getKeyPrefix());
            return;
        }

        credential.setActive(false);
        log.info("Revoked key {} ({})", credential.getKeyPrefix(), credentialId);
    }

    @Transactional(readOnly = true)
    public List<CredentialSummary> listForAccount(UUID accountId) {
        return credentials.findAllByAccount_AccountIdOrderByCreatedAtDesc(accountId).stream()
                .map(CredentialSummary::of)
                .toList();
    }
}
