package com.geomonitor.gatewayservice.configurations;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;

import java.util.Arrays;
import java.util.List;

/**
 * CORS for browser clients of the public API. Picked up by the security chain.
 */
@Slf4j
@Configuration
public class CorsConfig {

    @Value("${cors.allowed-origins:*}")
    private String allowedOrigins;

    @Value("${cors.allowed-methods:GET,POST,PUT,DELETE,OPTIONS}")
    private String allowedMethods;

    @Value("${cors.allowed-headers:Content-Type,Accept,Origin,X-API-Key,X-Admin-Key}")
    private String allowedHeaders;

    @Value("${cors.exposed-headers:X-RateLimit-Limit,X-RateLimit-Remaining,X-RateLimit-Reset}")
    private String exposedHeaders;

    @Value("${cors.max-age:600}")
    private long maxAge;

    @PostConstruct
    public void logCorsConfiguration() {
        log.info("CORS allowed origins: {}", allowedOrigins);
        if (allowedOrigins.contains("*")) {
            log.warn("CORS allows any origin; set cors.allowed-origins to restrict browser access");
        }
    }

    @Bean
    public CorsConfigurationSource corsConfigurationSource() {
        CorsConfiguration corsConfig = new CorsConfiguration();
        corsConfig.setAllowedOriginPatterns(parseCommaSeparated(allowedOrigins));
        corsConfig.setAllowedMethods(parseCommaSeparated(allowedMethods));
        corsConfig.setAllowedHeaders(parseCommaSeparated(allowedHeaders));
        corsConfig.setExposedHeaders(parseCommaSeparated(exposedHeaders));
        corsConfig.setMaxAge(maxAge);

        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration("/**", corsConfig);
        return source;
    }

    private List<String> parseCommaSeparated(String value) {
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }
}
