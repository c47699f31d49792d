package com.geomonitor.gatewayservice.services;

import com.geomonitor.gatewayservice.configurations.DemoProperties;
import com.geomonitor.gatewayservice.models.Account;
import com.geomonitor.gatewayservice.models.ApiCredential;
import com.geomonitor.gatewayservice.models.PlanTier;
import com.geomonitor.gatewayservice.repository.AccountRepository;
import com.geomonitor.gatewayservice.repository.ApiCredentialRepository;
import com.geomonitor.gatewayservice.services.credentials.TokenFingerprinter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Inserts the well-known free-tier demo key at startup when enabled.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(value = "gateway.demo.enabled", havingValue = "true")
public class DemoCredentialSeeder implements ApplicationRunner {

    private final DemoProperties demo;
    private final AccountRepository accounts;
    private final ApiCredentialRepository credentials;
    private final TokenFingerprinter fingerprinter;
    private final Clock clock;

    @Override
    @Transactional
    public void run(ApplicationArguments args) {
        String fingerprint = fingerprinter.fingerprint(demo.getToken());
        if (credentials.existsByFingerprint(fingerprint)) {
            return;
        }

        Account account = accounts.findByEmail(demo.getEmail())
                .orElseGet(() -> accounts.save(Account.builder()
                        .email(demo.getEmail())
                        .active(true)
                        .createdAt(LocalDateTime.now(clock))
                        .build()));

        credentials.save(ApiCredential.builder()
                .account(account)
                .fingerprint(fingerprint)
                .keyPrefix(demo.getPrefix())
                .planTier(PlanTier.FREE)
                .active(true)
                .createdAt(LocalDateTime.now(clock))
                .build());

        log.info("Seeded demo key {} for {}", demo.getPrefix(), demo.getEmail());
    }
}
