package com.geomonitor.gatewayservice.configurations;

import jakarta.validation.constraints.Positive;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Daily call ceilings per plan tier.
 */
@Configuration
@ConfigurationProperties(prefix = "gateway.quota")
@Validated
@Getter
@Setter
public class QuotaProperties {

    @Positive
    private int free = 10;

    @Positive
    private int starter = 500;

    @Positive
    private int pro = 5000;

    @Positive
    private int enterprise = 999999;

    private String upgradeUrl = "https://geomonitor.example.com/pricing";
}
