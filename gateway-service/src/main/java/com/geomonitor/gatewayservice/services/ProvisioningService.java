package com.geomonitor.gatewayservice.services;

import com.geomonitor.gatewayservice.exceptions.ApiException;
import com.geomonitor.gatewayservice.models.Account;
import com.geomonitor.gatewayservice.models.PlanTier;
import com.geomonitor.gatewayservice.repository.AccountRepository;
import com.geomonitor.gatewayservice.services.credentials.CredentialStore;
import com.geomonitor.gatewayservice.services.credentials.IssuedCredential;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Locale;
import java.util.Map;

/**
 * Purchase-style provisioning: find or create the account for an email and
 * issue it a key on the purchased plan.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProvisioningService {

    private final AccountRepository accounts;
    private final CredentialStore credentialStore;
    private final Clock clock;

    public IssuedCredential provision(String email, PlanTier planTier) {
        Account account = findOrCreateAccount(email.trim().toLowerCase(Locale.ROOT));
        if (!account.isActive()) {
            log.warn("Refused provisioning {} key for inactive account {}", planTier.getValue(), account.getAccountId());
            throw new ApiException(HttpStatus.CONFLICT, "Account is inactive",
                    Map.of("account_id", account.getAccountId().toString()));
        }
        return credentialStore.issue(account.getAccountId(), planTier);
    }

    private Account findOrCreateAccount(String email) {
        return accounts.findByEmail(email).orElseGet(() -> createAccount(email));
    }

    private Account createAccount(String email) {
        Account account = Account.builder()
                .email(email)
                .active(true)
                .createdAt(LocalDateTime.now(clock))
                .build();
        try {
            Account saved = accounts.saveAndFlush(account);
            log.info("Created account {}", saved.getAccountId());
            return saved;
        } catch (DataIntegrityViolationException e) {
            // concurrent provisioning for the same email
            return accounts.findByEmail(email).orElseThrow(() -> e);
        }
    }
}
