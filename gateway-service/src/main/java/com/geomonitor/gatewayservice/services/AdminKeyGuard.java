package com.geomonitor.gatewayservice.services;

import com.geomonitor.gatewayservice.configurations.AdminProperties;
import com.github.benmanes.caffeine.cache.Cache;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Checks the admin key and locks a client IP out after repeated wrong keys.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AdminKeyGuard {

    private final AdminProperties properties;
    private final Cache<String, Integer> adminFailedAttemptsCache;

    public boolean matches(String presented) {
        String expected = properties.getApiKey();
        if (expected == null || expected.isBlank() || presented == null) {
            return false;
        }
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                presented.getBytes(StandardCharsets.UTF_8));
    }

    public boolean isLockedOut(String clientIp) {
        Integer attempts = adminFailedAttemptsCache.getIfPresent(clientIp);
        return attempts != null && attempts >= properties.getMaxFailedAttempts();
    }

    public void recordFailure(String clientIp) {
        int attempts = adminFailedAttemptsCache.asMap().merge(clientIp, 1, Integer::sum);
        if (attempts >= properties.getMaxFailedAttempts()) {
            log.warn("Admin API locked for {} after {} failed attempts", clientIp, attempts);
        } else {
            log.debug("Failed admin key attempt {} from {}", attempts, clientIp);
        }
    }

    public void reset(String clientIp) {
        adminFailedAttemptsCache.invalidate(clientIp);
    }

    public static String clientIp(HttpServletRequest request) {
        String ip = request.getHeader("X-Forwarded-For");
        if (ip == null || ip.isEmpty() || "unknown".equalsIgnoreCase(ip)) {
            ip = request.getHeader("X-Real-IP");
        }
        if (ip == null || ip.isEmpty() || "unknown".equalsIgnoreCase(ip)) {
            ip = request.getRemoteAddr();
        }
        return ip != null ? ip.split(",")[0].trim() : "unknown";
    }
}
