package com.geomonitor.gatewayservice.services.quota;

import com.geomonitor.gatewayservice.models.PlanTier;

/**
 * Admission outcome for one request, computed against the calls already in
 * the window. Never cached across requests.
 */
public record QuotaDecision(PlanTier planTier, int ceiling, long used, long remaining, boolean admitted) {

    /**
     * Allowance left once the current call is counted, floored at zero.
     */
    public long remainingAfterCall() {
        return Math.max(0, remaining - 1);
    }
}
