package com.geomonitor.gatewayservice.dto.keys;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.geomonitor.gatewayservice.models.PlanTier;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Purchase-style provisioning: the buyer's email and the plan they bought.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ProvisionRequest {

    @NotBlank(message = "email is required")
    @Email(message = "Invalid email format")
    @Size(max = 100, message = "email must be at most 100 characters")
    private String email;

    @NotNull(message = "planTier is required")
    @JsonAlias("plan_tier")
    private PlanTier planTier;
}
