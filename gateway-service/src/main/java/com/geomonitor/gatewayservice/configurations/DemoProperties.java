package com.geomonitor.gatewayservice.configurations;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "gateway.demo")
@Getter
@Setter
public class DemoProperties {

    private boolean enabled = false;
    private String email = "demo@example.com";
    private String token = "demo-key-2024";
    private String prefix = "demo-";
}
