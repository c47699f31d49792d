package com.geomonitor.gatewayservice.configurations;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.geomonitor.gatewayservice.dto.error.ErrorResponse;
import com.geomonitor.gatewayservice.dto.error.QuotaExceededResponse;
import com.geomonitor.gatewayservice.services.AdmissionService;
import com.geomonitor.gatewayservice.services.credentials.CredentialInfo;
import com.geomonitor.gatewayservice.services.quota.QuotaDecision;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;

/**
 * Meters API calls by key: resolve the key, check the daily quota, forward or
 * reject with 429, then write exactly one usage record.
 * <p>
 * Requests without a key or with a key that does not resolve pass through
 * unmetered; the handlers reject them with 401.
 */
@Slf4j
@RequiredArgsConstructor
public class ApiKeyAdmissionFilter extends OncePerRequestFilter {

    public static final String RESOLVED_CREDENTIAL_ATTRIBUTE = ApiKeyAdmissionFilter.class.getName() + ".CREDENTIAL";
    static final Object UNRESOLVED = new Object();

    static final String LIMIT_HEADER = "X-RateLimit-Limit";
    static final String REMAINING_HEADER = "X-RateLimit-Remaining";
    static final String RESET_HEADER = "X-RateLimit-Reset";

    private final AdmissionService admissionService;
    private final AdmissionProperties admissionProperties;
    private final QuotaProperties quotaProperties;
    private final ObjectMapper objectMapper;
    private final String supportContact;

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !admissionService.isMetered(request.getRequestURI());
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        long started = System.nanoTime();
        String path = request.getRequestURI();

        String token = request.getHeader(admissionProperties.getHeaderName());
        if (token == null || token.isBlank()) {
            request.setAttribute(RESOLVED_CREDENTIAL_ATTRIBUTE, UNRESOLVED);
            filterChain.doFilter(request, response);
            return;
        }

        Optional<CredentialInfo> resolved;
        try {
            resolved = admissionService.resolve(token);
        } catch (RuntimeException e) {
            log.error("Key resolution failed on {}", path, e);
            writeInternalError(request, response);
            return;
        }
        if (resolved.isEmpty()) {
            log.debug("Unresolved API key on {}, forwarding unmetered", path);
            request.setAttribute(RESOLVED_CREDENTIAL_ATTRIBUTE, UNRESOLVED);
            filterChain.doFilter(request, response);
            return;
        }

        CredentialInfo credential = resolved.get();
        request.setAttribute(RESOLVED_CREDENTIAL_ATTRIBUTE, credential);

        QuotaDecision decision;
        try {
            decision = admissionService.evaluate(credential);
        } catch (RuntimeException e) {
            // no decision was made, so there is no call to record
            log.error("Quota evaluation failed for key {} on {}", credential.keyPrefix(), path, e);
            writeInternalError(request, response);
            return;
        }

        int status = HttpStatus.INTERNAL_SERVER_ERROR.value();
        try {
            if (decision.admitted()) {
                writeQuotaHeaders(response, decision.ceiling(), decision.remainingAfterCall());
                filterChain.doFilter(request, response);
                status = response.getStatus();
            } else {
                log.info("Quota exceeded for key {} ({} plan, {}/{})", credential.keyPrefix(),
                        decision.planTier().getValue(), decision.used(), decision.ceiling());
                writeQuotaHeaders(response, decision.ceiling(), 0);
                writeRejection(request, response, decision);
                status = HttpStatus.TOO_MANY_REQUESTS.value();
            }
        } catch (IOException | ServletException | RuntimeException e) {
            status = response.getStatus() >= 400 ? response.getStatus() : HttpStatus.INTERNAL_SERVER_ERROR.value();
            throw e;
        } finally {
            long latencyMs = (System.nanoTime() - started) / 1_000_000;
            admissionService.recordOutcome(credential, path, latencyMs, status);
        }
    }

    private void writeQuotaHeaders(HttpServletResponse response, int ceiling, long remaining) {
        response.setHeader(LIMIT_HEADER, String.valueOf(ceiling));
        response.setHeader(REMAINING_HEADER, String.valueOf(remaining));
        response.setHeader(RESET_HEADER, String.valueOf(admissionProperties.getResetHintSeconds()));
    }

    private void writeInternalError(HttpServletRequest request, HttpServletResponse response) throws IOException {
        writeJson(response, HttpStatus.INTERNAL_SERVER_ERROR,
                ErrorResponse.internalError(supportContact, request.getRequestURI()));
    }

    private void writeJson(HttpServletResponse response, HttpStatus status, Object body) throws IOException {
        response.setStatus(status.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        objectMapper.writeValue(response.getWriter(), body);
    }

    private void writeRejection(HttpServletRequest request, HttpServletResponse response, QuotaDecision decision)
            throws IOException {
        QuotaExceededResponse body = QuotaExceededResponse.builder()
                .error("Rate limit exceeded")
                .plan(decision.planTier())
                .limit(decision.ceiling())
                .used(decision.used())
                .resetsIn(admissionProperties.getResetHintText())
                .details(Map.of(
                        "limit", decision.ceiling(),
                        "reset_time", admissionProperties.getResetHintText(),
                        "upgrade_url", quotaProperties.getUpgradeUrl()))
                .path(request.getRequestURI())
                .build();

        writeJson(response, HttpStatus.TOO_MANY_REQUESTS, body);
    }
}
