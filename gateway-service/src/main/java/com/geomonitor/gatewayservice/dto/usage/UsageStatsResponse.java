package com.geomonitor.gatewayservice.dto.usage;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.geomonitor.gatewayservice.models.PlanTier;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class UsageStatsResponse {

    @Builder.Default
    private boolean success = true;

    @JsonProperty("key_prefix")
    private String keyPrefix;

    private PlanTier plan;

    private int limit;

    private long used;

    private long remaining;

    @JsonProperty("period_hours")
    private int periodHours;
}
