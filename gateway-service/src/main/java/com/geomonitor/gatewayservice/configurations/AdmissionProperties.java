package com.geomonitor.gatewayservice.configurations;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "gateway.admission")
@Getter
@Setter
public class AdmissionProperties {

    private String headerName = "X-API-Key";
    private String meteredPathPrefix = "/api/";
    private List<String> exemptPaths = new ArrayList<>(List.of("/health", "/actuator", "/api/v1/admin"));
    private int windowHours = 24;
    private long resetHintSeconds = 86400;
    private String resetHintText = "24 hours";

    /**
     * Metered paths sit under the API prefix and match no exempt path.
     */
    public boolean isMetered(String path) {
        if (path == null || !path.startsWith(meteredPathPrefix)) {
            return false;
        }
        return exemptPaths.stream()
                .noneMatch(exempt -> path.equals(exempt) || path.startsWith(exempt + "/"));
    }
}
