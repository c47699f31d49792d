package com.geomonitor.gatewayservice.services.credentials;

import com.geomonitor.gatewayservice.exceptions.CredentialIssuanceException;
import com.geomonitor.gatewayservice.models.Account;
import com.geomonitor.gatewayservice.models.ApiCredential;
import com.geomonitor.gatewayservice.models.PlanTier;
import com.geomonitor.gatewayservice.repository.ApiCredentialRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.retry.RetryContext;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.retry.support.RetrySynchronizationManager;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * One insert attempt per call. A fingerprint collision is retried with a
 * freshly generated token; each insert commits on its own.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CredentialIssuer {

    static final int MAX_ISSUE_ATTEMPTS = 3;

    private final ApiCredentialRepository credentials;
    private final TokenGenerator tokenGenerator;
    private final TokenFingerprinter fingerprinter;
    private final Clock clock;

    @Retryable(retryFor = DataIntegrityViolationException.class, maxAttempts = MAX_ISSUE_ATTEMPTS,
            backoff = @Backoff(delay = 10))
    public IssuedCredential insert(Account account, PlanTier planTier) {
        TokenGenerator.GeneratedToken generated = tokenGenerator.generate();

        ApiCredential credential = ApiCredential.builder()
                .account(account)
                .fingerprint(fingerprinter.fingerprint(generated.token()))
                .keyPrefix(generated.prefix())
                .planTier(planTier)
                .active(true)
                .createdAt(LocalDateTime.now(clock))
                .build();

        ApiCredential saved;
        try {
            saved = credentials.saveAndFlush(credential);
        } catch (DataIntegrityViolationException e) {
            log.warn("Fingerprint collision issuing key for account {} (attempt {}/{})",
                    account.getAccountId(), currentAttempt(), MAX_ISSUE_ATTEMPTS);
            throw e;
        }

        return new IssuedCredential(saved.getCredentialId(), account.getAccountId(), generated.token(),
                saved.getKeyPrefix(), planTier, saved.getCreatedAt());
    }

    @Recover
    public IssuedCredential recoverFromCollisions(RuntimeException e, Account account, PlanTier planTier) {
        if (e instanceof DataIntegrityViolationException) {
            throw new CredentialIssuanceException("Could not issue a unique API key for account "
                    + account.getAccountId() + " after " + MAX_ISSUE_ATTEMPTS + " attempts", e);
        }
        throw e;
    }

    private static int currentAttempt() {
        RetryContext context = RetrySynchronizationManager.getContext();
        return context != null ? context.getRetryCount() + 1 : 1;
    }
}
