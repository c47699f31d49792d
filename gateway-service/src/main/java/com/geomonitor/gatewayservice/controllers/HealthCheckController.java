package com.geomonitor.gatewayservice.controllers;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/health")
public class HealthCheckController {

    @Autowired
    private DataSource dataSource;

    @Autowired
    private Clock clock;

    @GetMapping
    public ResponseEntity<Map<String, Object>> healthCheck() {
        boolean databaseUp = isDatabaseUp();

        Map<String, Object> health = new LinkedHashMap<>();
        health.put("status", databaseUp ? "healthy" : "degraded");
        health.put("timestamp", Instant.now(clock).toString());
        health.put("service", "gateway-service");
        health.put("database", databaseUp ? "connected" : "disconnected");

        HttpStatus status = databaseUp ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(status).body(health);
    }

    private boolean isDatabaseUp() {
        try (Connection connection = dataSource.getConnection();
             Statement statement = connection.createStatement()) {
            statement.executeQuery("SELECT 1");
            return true;
        } catch (SQLException e) {
            log.warn("Database health probe failed: {}", e.getMessage());
            return false;
        }
    }
}
