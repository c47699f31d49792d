package com.geomonitor.gatewayservice.controllers;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.geomonitor.gatewayservice.models.Account;
import com.geomonitor.gatewayservice.models.PlanTier;
import com.geomonitor.gatewayservice.repository.AccountRepository;
import com.geomonitor.gatewayservice.services.credentials.CredentialStore;
import com.geomonitor.gatewayservice.services.credentials.IssuedCredential;
import com.geomonitor.gatewayservice.services.usage.UsageLedger;
import com.geomonitor.gatewayservice.support.TestAccounts;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.RequestPostProcessor;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class AdminKeyControllerTest {

    private static final String ADMIN_KEY_HEADER = "X-Admin-Key";
    private static final String ADMIN_KEY = "test-admin-key";

    @Autowired
    MockMvc mockMvc;

    @Autowired
    ObjectMapper objectMapper;

    @Autowired
    AccountRepository accounts;

    @Autowired
    CredentialStore credentialStore;

    @Autowired
    UsageLedger usageLedger;

    @Test
    void issueKey_returnsTokenOnce_andKeyResolves() throws Exception {
        Account account = TestAccounts.create(accounts);

        String body = mockMvc.perform(post("/api/v1/admin/accounts/{accountId}/keys", account.getAccountId())
                        .header(ADMIN_KEY_HEADER, ADMIN_KEY)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"planTier\":\"starter\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.plan").value("starter"))
                .andExpect(jsonPath("$.account_id").value(account.getAccountId().toString()))
                .andExpect(jsonPath("$.message").exists())
                .andReturn().getResponse().getContentAsString();

        JsonNode issued = objectMapper.readTree(body);
        String token = issued.get("api_key").asText();
        assertThat(token).startsWith(issued.get("key_prefix").asText() + "-");
        assertThat(credentialStore.resolve(token)).isPresent();

        mockMvc.perform(get("/api/v1/admin/accounts/{accountId}/keys", account.getAccountId())
                        .header(ADMIN_KEY_HEADER, ADMIN_KEY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].credential_id").value(issued.get("credential_id").asText()))
                .andExpect(jsonPath("$[0].api_key").doesNotExist());
    }

    @Test
    void issueKey_unknownAccount_returns404() throws Exception {
        mockMvc.perform(post("/api/v1/admin/accounts/{accountId}/keys", UUID.randomUUID())
                        .header(ADMIN_KEY_HEADER, ADMIN_KEY)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"planTier\":\"free\"}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    void issueKey_unknownPlanTier_returns400() throws Exception {
        Account account = TestAccounts.create(accounts);

        mockMvc.perform(post("/api/v1/admin/accounts/{accountId}/keys", account.getAccountId())
                        .header(ADMIN_KEY_HEADER, ADMIN_KEY)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"planTier\":\"platinum\"}"))
                .andExpect(status().isBadRequest());

        assertThat(credentialStore.listForAccount(account.getAccountId())).isEmpty();
    }

    @Test
    void issueKey_missingPlanTier_returnsValidationError() throws Exception {
        Account account = TestAccounts.create(accounts);

        mockMvc.perform(post("/api/v1/admin/accounts/{accountId}/keys", account.getAccountId())
                        .header(ADMIN_KEY_HEADER, ADMIN_KEY)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Validation error"))
                .andExpect(jsonPath("$.details.errors[0].field").value("planTier"));
    }

    @Test
    void adminEndpoints_rejectMissingKey() throws Exception {
        mockMvc.perform(get("/api/v1/admin/accounts/{accountId}/keys", UUID.randomUUID())
                        .with(fromIp("10.1.0.1")))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").value("Admin access denied"));
    }

    @Test
    void adminEndpoints_rejectWrongKey() throws Exception {
        mockMvc.perform(get("/api/v1/admin/accounts/{accountId}/keys", UUID.randomUUID())
                        .header(ADMIN_KEY_HEADER, "wrong-key")
                        .with(fromIp("10.1.0.2")))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("Admin access denied"));
    }

    @Test
    void repeatedWrongKeys_lockOutTheClientIp() throws Exception {
        Account account = TestAccounts.create(accounts);

        for (int attempt = 0; attempt < 3; attempt++) {
            mockMvc.perform(get("/api/v1/admin/accounts/{accountId}/keys", account.getAccountId())
                            .header(ADMIN_KEY_HEADER, "guess-" + attempt)
                            .with(fromIp("10.1.0.3")))
                    .andExpect(status().isForbidden());
        }

        mockMvc.perform(get("/api/v1/admin/accounts/{accountId}/keys", account.getAccountId())
                        .header(ADMIN_KEY_HEADER, ADMIN_KEY)
                        .with(fromIp("10.1.0.3")))
                .andExpect(status().isForbidden());

        mockMvc.perform(get("/api/v1/admin/accounts/{accountId}/keys", account.getAccountId())
                        .header(ADMIN_KEY_HEADER, ADMIN_KEY)
                        .with(fromIp("10.1.0.4")))
                .andExpect(status().isOk());
    }

    @Test
    void revokeKey_isIdempotent() throws Exception {
        Account account = TestAccounts.create(accounts);
        IssuedCredential issued = credentialStore.issue(account.getAccountId(), PlanTier.FREE);

        for (int i = 0; i < 2; i++) {
            mockMvc.perform(delete("/api/v1/admin/keys/{credentialId}", issued.credentialId())
                            .header(ADMIN_KEY_HEADER, ADMIN_KEY))
                    .andExpect(status().isNoContent());
        }

        assertThat(credentialStore.resolve(issued.token())).isEmpty();
    }

    @Test
    void revokeKey_unknownKey_returns404() throws Exception {
        mockMvc.perform(delete("/api/v1/admin/keys/{credentialId}", UUID.randomUUID())
                        .header(ADMIN_KEY_HEADER, ADMIN_KEY))
                .andExpect(status().isNotFound());
    }

    @Test
    void provision_reusesAccountForSameEmail() throws Exception {
        String email = "buyer-" + UUID.randomUUID() + "@example.com";

        String first = provision(email.toUpperCase(), "pro");
        String second = provision(email, "starter");

        String firstAccount = objectMapper.readTree(first).get("account_id").asText();
        String secondAccount = objectMapper.readTree(second).get("account_id").asText();
        assertThat(secondAccount).isEqualTo(firstAccount);
        assertThat(accounts.findByEmail(email)).isPresent();
        assertThat(credentialStore.listForAccount(UUID.fromString(firstAccount))).hasSize(2);
    }

    @Test
    void provision_invalidEmail_returns400() throws Exception {
        mockMvc.perform(post("/api/v1/admin/provision")
                        .header(ADMIN_KEY_HEADER, ADMIN_KEY)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"not-an-email\",\"planTier\":\"free\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.errors[0].field").value("email"));
    }

    @Test
    void provision_inactiveAccount_isRefused() throws Exception {
        Account account = TestAccounts.create(accounts, false);

        mockMvc.perform(post("/api/v1/admin/provision")
                        .header(ADMIN_KEY_HEADER, ADMIN_KEY)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"" + account.getEmail() + "\",\"planTier\":\"pro\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("Account is inactive"))
                .andExpect(jsonPath("$.details.account_id").value(account.getAccountId().toString()));

        assertThat(credentialStore.listForAccount(account.getAccountId())).isEmpty();
    }

    @Test
    void adminCall_withExhaustedApiKey_isNotMetered() throws Exception {
        Account account = TestAccounts.create(accounts);
        IssuedCredential issued = credentialStore.issue(account.getAccountId(), PlanTier.FREE);
        for (int i = 0; i < 10; i++) {
            usageLedger.record(issued.credentialId(), "/api/v1/usage", 1, 200);
        }

        mockMvc.perform(get("/api/v1/admin/accounts/{accountId}/keys", account.getAccountId())
                        .header(ADMIN_KEY_HEADER, ADMIN_KEY)
                        .header("X-API-Key", issued.token()))
                .andExpect(status().isOk())
                .andExpect(header().doesNotExist("X-RateLimit-Limit"));

        assertThat(usageLedger.countWindow(issued.credentialId(), 24)).isEqualTo(10);
    }

    private String provision(String email, String planTier) throws Exception {
        return mockMvc.perform(post("/api/v1/admin/provision")
                        .header(ADMIN_KEY_HEADER, ADMIN_KEY)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"" + email + "\",\"planTier\":\"" + planTier + "\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.plan").value(planTier))
                .andReturn().getResponse().getContentAsString();
    }

    private static RequestPostProcessor fromIp(String ip) {
        return request -> {
            request.setRemoteAddr(ip);
            return request;
        };
    }
}
