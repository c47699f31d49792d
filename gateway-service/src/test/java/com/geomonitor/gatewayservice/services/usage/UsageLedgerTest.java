package com.geomonitor.gatewayservice.services.usage;

import com.geomonitor.gatewayservice.configurations.LedgerProperties;
import com.geomonitor.gatewayservice.models.UsageRecord;
import com.geomonitor.gatewayservice.repository.UsageRecordRepository;
import com.geomonitor.gatewayservice.services.AdmissionMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.SimpleTransactionStatus;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class UsageLedgerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private UsageRecordRepository repository;
    private PlatformTransactionManager transactionManager;
    private SimpleMeterRegistry registry;
    private UsageLedger ledger;

    @BeforeEach
    void setUp() {
        repository = mock(UsageRecordRepository.class);
        transactionManager = mock(PlatformTransactionManager.class);
        when(transactionManager.getTransaction(any())).thenReturn(new SimpleTransactionStatus());
        registry = new SimpleMeterRegistry();

        ledger = new UsageLedger(repository, transactionManager, new LedgerProperties(),
                new AdmissionMetrics(registry), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void record_writesOneRowInItsOwnTransaction() {
        UUID credentialId = UUID.randomUUID();

        ledger.record(credentialId, "/api/v1/usage", 12, 200);

        ArgumentCaptor<UsageRecord> saved = ArgumentCaptor.forClass(UsageRecord.class);
        verify(repository, times(1)).save(saved.capture());
        assertThat(saved.getValue().getCredentialId()).isEqualTo(credentialId);
        assertThat(saved.getValue().getEndpoint()).isEqualTo("/api/v1/usage");
        assertThat(saved.getValue().getStatusCode()).isEqualTo(200);
        assertThat(saved.getValue().getCreatedAt()).isEqualTo(LocalDateTime.of(2024, 5, 1, 12, 0));

        ArgumentCaptor<TransactionDefinition> definition = ArgumentCaptor.forClass(TransactionDefinition.class);
        verify(transactionManager).getTransaction(definition.capture());
        assertThat(definition.getValue().getPropagationBehavior())
                .isEqualTo(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        assertThat(definition.getValue().getTimeout()).isEqualTo(2);
    }

    @Test
    void record_swallowsFailureAndCountsIt() {
        when(repository.save(any())).thenThrow(new DataAccessResourceFailureException("database down"));

        assertThatCode(() -> ledger.record(UUID.randomUUID(), "/api/v1/usage", 5, 200))
                .doesNotThrowAnyException();

        verify(repository, times(1)).save(any());
        assertThat(registry.get("gateway.ledger.write_failures").counter().count()).isEqualTo(1.0);
    }

    @Test
    void record_truncatesLongEndpoints() {
        ledger.record(UUID.randomUUID(), "/api/" + "x".repeat(400), 1, 200);

        ArgumentCaptor<UsageRecord> saved = ArgumentCaptor.forClass(UsageRecord.class);
        verify(repository).save(saved.capture());
        assertThat(saved.getValue().getEndpoint()).hasSize(255);
    }

    @Test
    void countWindow_countsFromCallTimeBackwards() {
        UUID credentialId = UUID.randomUUID();
        LocalDateTime expectedSince = LocalDateTime.of(2024, 4, 30, 12, 0);
        when(repository.countByCredentialIdAndCreatedAtAfter(credentialId, expectedSince)).thenReturn(7L);

        assertThat(ledger.countWindow(credentialId, 24)).isEqualTo(7L);
    }
}
