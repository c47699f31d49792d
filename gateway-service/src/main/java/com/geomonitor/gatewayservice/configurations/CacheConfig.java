package com.geomonitor.gatewayservice.configurations;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

@Configuration
public class CacheConfig {

    /**
     * Failed admin key attempts per client IP. An entry lives for the lockout
     * duration after its last failure.
     */
    @Bean
    public Cache<String, Integer> adminFailedAttemptsCache(AdminProperties adminProperties) {
        return Caffeine.newBuilder()
                .expireAfterWrite(adminProperties.getLockoutMinutes(), TimeUnit.MINUTES)
                .maximumSize(50000)
                .recordStats()
                .build();
    }
}
