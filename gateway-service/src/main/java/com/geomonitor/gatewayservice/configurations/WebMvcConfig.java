package com.geomonitor.gatewayservice.configurations;

import com.geomonitor.gatewayservice.services.credentials.CredentialStore;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.util.List;

@Configuration
@RequiredArgsConstructor
public class WebMvcConfig implements WebMvcConfigurer {

    private final CredentialStore credentialStore;
    private final AdmissionProperties admissionProperties;

    @Override
    public void addArgumentResolvers(List<HandlerMethodArgumentResolver> resolvers) {
        resolvers.add(new ResolvedApiKeyArgumentResolver(credentialStore, admissionProperties));
    }
}
