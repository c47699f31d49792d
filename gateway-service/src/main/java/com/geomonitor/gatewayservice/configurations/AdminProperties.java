package com.geomonitor.gatewayservice.configurations;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "gateway.admin")
@Getter
@Setter
public class AdminProperties {

    private String headerName = "X-Admin-Key";

    // blank disables the admin API
    private String apiKey = "";

    private String pathPrefix = "/api/v1/admin/";
    private int maxFailedAttempts = 5;
    private int lockoutMinutes = 15;
}
