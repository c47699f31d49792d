package com.geomonitor.gatewayservice.exceptions;

import org.springframework.http.HttpStatus;

import java.util.Map;

public class ResourceNotFoundException extends ApiException {

    public ResourceNotFoundException(String resourceType, String identifier) {
        super(HttpStatus.NOT_FOUND, resourceType + " not found", Map.of("identifier", identifier));
    }
}
