package com.geomonitor.gatewayservice.configurations;

import com.geomonitor.gatewayservice.annotations.ResolvedApiKey;
import com.geomonitor.gatewayservice.exceptions.InvalidApiKeyException;
import com.geomonitor.gatewayservice.services.credentials.CredentialInfo;
import com.geomonitor.gatewayservice.services.credentials.CredentialStore;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.core.MethodParameter;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

import java.util.Optional;

/**
 * Reuses the resolution made by {@link ApiKeyAdmissionFilter} so a key is
 * looked up once per request. Falls back to a lookup of its own on paths the
 * filter does not meter.
 */
@RequiredArgsConstructor
public class ResolvedApiKeyArgumentResolver implements HandlerMethodArgumentResolver {

    private final CredentialStore credentialStore;
    private final AdmissionProperties admissionProperties;

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return parameter.hasParameterAnnotation(ResolvedApiKey.class)
                && CredentialInfo.class.equals(parameter.getParameterType());
    }

    @Override
    public Object resolveArgument(MethodParameter parameter, ModelAndViewContainer mavContainer,
                                  NativeWebRequest webRequest, WebDataBinderFactory binderFactory) {
        HttpServletRequest request = webRequest.getNativeRequest(HttpServletRequest.class);
        if (request == null) {
            throw new InvalidApiKeyException(admissionProperties.getHeaderName());
        }

        Optional<CredentialInfo> resolved;
        Object cached = request.getAttribute(ApiKeyAdmissionFilter.RESOLVED_CREDENTIAL_ATTRIBUTE);
        if (cached instanceof CredentialInfo credential) {
            resolved = Optional.of(credential);
        } else if (cached == ApiKeyAdmissionFilter.UNRESOLVED) {
            resolved = Optional.empty();
        } else {
            resolved = credentialStore.resolve(request.getHeader(admissionProperties.getHeaderName()));
        }

        return resolved.orElseThrow(() -> new InvalidApiKeyException(admissionProperties.getHeaderName()));
    }
}
