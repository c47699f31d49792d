package com.geomonitor.gatewayservice.services.quota;

import com.geomonitor.gatewayservice.configurations.QuotaProperties;
import com.geomonitor.gatewayservice.models.PlanTier;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class QuotaPolicy {

    private final QuotaProperties quota;

    public int ceilingFor(PlanTier planTier) {
        if (planTier == null) {
            return quota.getFree();
        }
        return switch (planTier) {
            case FREE -> quota.getFree();
            case STARTER -> quota.getStarter();
            case PRO -> quota.getPro();
            case ENTERPRISE -> quota.getEnterprise();
        };
    }

    /**
     * The call that brings the window count up to the ceiling is the last one
     * admitted; {@code usedInWindow} must not include the current call.
     */
    public QuotaDecision evaluate(PlanTier planTier, long usedInWindow) {
        PlanTier tier = planTier != null ? planTier : PlanTier.FREE;
        int ceiling = ceilingFor(tier);
        long remaining = Math.max(0, ceiling - usedInWindow);
        return new QuotaDecision(tier, ceiling, usedInWindow, remaining, remaining > 0);
    }
}
