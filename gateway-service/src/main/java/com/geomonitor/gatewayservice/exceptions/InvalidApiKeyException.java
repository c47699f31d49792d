package com.geomonitor.gatewayservice.exceptions;

import org.springframework.http.HttpStatus;

import java.util.Map;

public class InvalidApiKeyException extends ApiException {

    public InvalidApiKeyException(String headerName) {
        super(HttpStatus.UNAUTHORIZED, "Invalid or missing API key", Map.of(
                "help", "Get your API key from your account dashboard",
                "header_format", headerName + ": your_api_key_here"));
    }
}
