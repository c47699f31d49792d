package com.geomonitor.gatewayservice.configurations;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "gateway.ledger")
@Getter
@Setter
public class LedgerProperties {

    private int writeTimeoutSeconds = 2;
}
