package com.geomonitor.gatewayservice.dto.keys;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.geomonitor.gatewayservice.models.PlanTier;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class IssueKeyRequest {

    @NotNull(message = "planTier is required")
    @JsonAlias("plan_tier")
    private PlanTier planTier;
}
