package com.geomonitor.gatewayservice.configurations;

import com.geomonitor.gatewayservice.services.AdminKeyGuard;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;

@Slf4j
@RequiredArgsConstructor
public class AdminKeyAuthenticationFilter extends OncePerRequestFilter {

    static final String ADMIN_ROLE = "ADMIN";

    private final AdminProperties adminProperties;
    private final AdminKeyGuard adminKeyGuard;

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !request.getRequestURI().startsWith(adminProperties.getPathPrefix());
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        String presented = request.getHeader(adminProperties.getHeaderName());

        if (presented != null) {
            String clientIp = AdminKeyGuard.clientIp(request);

            if (adminKeyGuard.isLockedOut(clientIp)) {
                log.warn("Admin request from locked out client {} on {}", clientIp, request.getRequestURI());
            } else if (adminKeyGuard.matches(presented)) {
                UsernamePasswordAuthenticationToken authentication = UsernamePasswordAuthenticationToken.authenticated(
                        "admin", null, List.of(new SimpleGrantedAuthority("ROLE_" + ADMIN_ROLE)));
                authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
                SecurityContextHolder.getContext().setAuthentication(authentication);
                adminKeyGuard.reset(clientIp);
            } else {
                adminKeyGuard.recordFailure(clientIp);
            }
        }

        filterChain.doFilter(request, response);
    }
}
