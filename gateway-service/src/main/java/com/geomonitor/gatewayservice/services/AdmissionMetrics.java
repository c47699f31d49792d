package com.geomonitor.gatewayservice.services;

import com.geomonitor.gatewayservice.services.quota.QuotaDecision;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

@Component
public class AdmissionMetrics {

    private final MeterRegistry registry;
    private final Counter ledgerWriteFailures;

    public AdmissionMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.ledgerWriteFailures = Counter.builder("gateway.ledger.write_failures")
                .description("Usage records dropped because the ledger write failed")
                .register(registry);
    }

    public void decision(QuotaDecision decision) {
        Counter.builder("gateway.admission.decisions")
                .description("Quota admission decisions (admitted/rejected)")
                .tag("plan", decision.planTier().getValue())
                .tag("admitted", String.valueOf(decision.admitted()))
                .register(registry)
                .increment();
    }

    public void ledgerWriteFailed() {
        ledgerWriteFailures.increment();
    }
}
