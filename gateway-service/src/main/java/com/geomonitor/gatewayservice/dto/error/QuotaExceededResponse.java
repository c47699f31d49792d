package com.geomonitor.gatewayservice.dto.error;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.geomonitor.gatewayservice.models.PlanTier;
import lombok.Builder;
import lombok.Data;

import java.util.Map;

/**
 * Body of a 429 reply. Field names are part of the public API.
 */
@Data
@Builder
public class QuotaExceededResponse {

    @Builder.Default
    private boolean success = false;
    private String error;
    private PlanTier plan;
    private int limit;
    private long used;
    @JsonProperty("resets_in")
    private String resetsIn;
    private Map<String, Object> details;
    private String path;
}
