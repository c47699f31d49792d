package com.geomonitor.gatewayservice.configurations;

import com.geomonitor.gatewayservice.models.Account;
import com.geomonitor.gatewayservice.models.PlanTier;
import com.geomonitor.gatewayservice.repository.AccountRepository;
import com.geomonitor.gatewayservice.repository.UsageRecordRepository;
import com.geomonitor.gatewayservice.services.credentials.CredentialStore;
import com.geomonitor.gatewayservice.services.credentials.IssuedCredential;
import com.geomonitor.gatewayservice.services.usage.UsageLedger;
import com.geomonitor.gatewayservice.support.TestAccounts;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.doThrow;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class ApiKeyAdmissionFilterFailureTest {

    @Autowired
    MockMvc mockMvc;

    @Autowired
    CredentialStore credentialStore;

    @Autowired
    AccountRepository accounts;

    @Autowired
    UsageRecordRepository usageRecords;

    @SpyBean
    UsageLedger usageLedger;

    @Test
    void quotaEvaluationFailure_returnsStructuredServerError() throws Exception {
        Account account = TestAccounts.create(accounts);
        IssuedCredential issued = credentialStore.issue(account.getAccountId(), PlanTier.FREE);
        doThrow(new DataAccessResourceFailureException("database down"))
                .when(usageLedger).countWindow(any(), anyInt());

        mockMvc.perform(get("/api/v1/usage").header("X-API-Key", issued.token()))
                .andExpect(status().isInternalServerError())
                .andExpect(content().contentTypeCompatibleWith("application/json"))
                .andExpect(header().doesNotExist("X-RateLimit-Limit"))
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").value("Internal server error"))
                .andExpect(jsonPath("$.details.message").value("An unexpected error occurred"))
                .andExpect(jsonPath("$.details.support").value("Contact support@geomonitor.example.com"))
                .andExpect(jsonPath("$.path").value("/api/v1/usage"));

        assertThat(usageRecords.countByCredentialId(issued.credentialId())).isZero();
    }
}
