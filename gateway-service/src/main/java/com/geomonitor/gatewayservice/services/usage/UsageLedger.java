package com.geomonitor.gatewayservice.services.usage;

import com.geomonitor.gatewayservice.configurations.LedgerProperties;
import com.geomonitor.gatewayservice.models.UsageRecord;
import com.geomonitor.gatewayservice.repository.UsageRecordRepository;
import com.geomonitor.gatewayservice.services.AdmissionMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Append-only log of metered calls, also the source of the quota window count.
 */
@Slf4j
@Service
public class UsageLedger {

    private static final int MAX_ENDPOINT_LENGTH = 255;

    private final UsageRecordRepository usageRecords;
    private final TransactionTemplate writeTransaction;
    private final AdmissionMetrics metrics;
    private final Clock clock;

    public UsageLedger(UsageRecordRepository usageRecords, PlatformTransactionManager transactionManager,
                       LedgerProperties ledgerProperties, AdmissionMetrics metrics, Clock clock) {
        this.usageRecords = usageRecords;
        this.metrics = metrics;
        this.clock = clock;
        this.writeTransaction = new TransactionTemplate(transactionManager);
        this.writeTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.writeTransaction.setTimeout(ledgerProperties.getWriteTimeoutSeconds());
    }

    /**
     * Appends one record. At most once: a failed write is logged and dropped,
     * never retried and never propagated to the request.
     */
    public void record(UUID credentialId, String endpoint, long latencyMs, int statusCode) {
        UsageRecord usageRecord = UsageRecord.builder()
                .credentialId(credentialId)
                .endpoint(truncate(endpoint))
                .createdAt(LocalDateTime.now(clock))
                .latencyMs(latencyMs)
                .statusCode(statusCode)
                .build();

        try {
            writeTransaction.executeWithoutResult(status -> usageRecords.save(usageRecord));
        } catch (RuntimeException e) {
            metrics.ledgerWriteFailed();
            log.warn("Dropped usage record for credential {} on {} (status {}): {}",
                    credentialId, usageRecord.getEndpoint(), statusCode, e.getMessage());
        }
    }

    /**
     * Calls recorded for the credential in the trailing window, measured from now.
     */
    @Transactional(readOnly = true)
    public long countWindow(UUID credentialId, int windowHours) {
        LocalDateTime since = LocalDateTime.now(clock).minusHours(windowHours);
        return usageRecords.countByCredentialIdAndCreatedAtAfter(credentialId, since);
    }

    private static String truncate(String endpoint) {
        if (endpoint == null) {
            return "";
        }
        return endpoint.length() > MAX_ENDPOINT_LENGTH ? endpoint.substring(0, MAX_ENDPOINT_LENGTH) : endpoint;
    }
}
