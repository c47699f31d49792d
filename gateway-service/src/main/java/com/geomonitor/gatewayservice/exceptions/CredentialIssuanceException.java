package com.geomonitor.gatewayservice.exceptions;

/**
 * Issuance gave up after repeated fingerprint collisions. Surfaces as a
 * generic internal error.
 */
public class CredentialIssuanceException extends RuntimeException {

    public CredentialIssuanceException(String message) {
        super(message);
    }

    public CredentialIssuanceException(String message, Throwable cause) {
        super(message, cause);
    }
}
