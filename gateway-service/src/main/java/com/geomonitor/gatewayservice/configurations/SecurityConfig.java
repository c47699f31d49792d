package com.geomonitor.gatewayservice.configurations;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.geomonitor.gatewayservice.dto.error.ErrorResponse;
import com.geomonitor.gatewayservice.services.AdminKeyGuard;
import com.geomonitor.gatewayservice.services.AdmissionService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.access.intercept.AuthorizationFilter;
import org.springframework.security.web.authentication.AnonymousAuthenticationFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;

@Configuration
@EnableWebSecurity
@RequiredArgsConstructor
public class SecurityConfig {

    private final AdminProperties adminProperties;
    private final AdminKeyGuard adminKeyGuard;
    private final AdmissionService admissionService;
    private final AdmissionProperties admissionProperties;
    private final QuotaProperties quotaProperties;
    private final ObjectMapper objectMapper;

    @Value("${gateway.support-contact:support@geomonitor.example.com}")
    private String supportContact;

    /**
     * Admin endpoints require the admin key; everything else is open at this
     * layer and metered by {@link ApiKeyAdmissionFilter}.
     */
    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        http
                .csrf(AbstractHttpConfigurer::disable)
                .httpBasic(AbstractHttpConfigurer::disable)
                .formLogin(AbstractHttpConfigurer::disable)
                .logout(AbstractHttpConfigurer::disable)
                .cors(Customizer.withDefaults())
                .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .authorizeHttpRequests(auth -> auth
                        .requestMatchers(adminProperties.getPathPrefix() + "**").hasRole(AdminKeyAuthenticationFilter.ADMIN_ROLE)
                        .anyRequest().permitAll()
                )
                .exceptionHandling(exceptions -> exceptions
                        .authenticationEntryPoint((request, response, e) -> writeAdminDenied(request, response))
                        .accessDeniedHandler((request, response, e) -> writeAdminDenied(request, response))
                )
                .addFilterBefore(new AdminKeyAuthenticationFilter(adminProperties, adminKeyGuard),
                        AnonymousAuthenticationFilter.class)
                .addFilterAfter(new ApiKeyAdmissionFilter(admissionService, admissionProperties, quotaProperties,
                                objectMapper, supportContact),
                        AuthorizationFilter.class);

        return http.build();
    }

    private void writeAdminDenied(HttpServletRequest request, HttpServletResponse response) throws IOException {
        ErrorResponse body = ErrorResponse.builder()
                .error("Admin access denied")
                .details(Map.of("header_format", adminProperties.getHeaderName() + ": your_admin_key"))
                .path(request.getRequestURI())
                .build();

        response.setStatus(HttpStatus.FORBIDDEN.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        objectMapper.writeValue(response.getWriter(), body);
    }
}
