package com.geomonitor.gatewayservice.controllers;

import com.geomonitor.gatewayservice.dto.keys.IssueKeyRequest;
import com.geomonitor.gatewayservice.dto.keys.IssuedKeyResponse;
import com.geomonitor.gatewayservice.dto.keys.KeySummaryResponse;
import com.geomonitor.gatewayservice.dto.keys.ProvisionRequest;
import com.geomonitor.gatewayservice.services.ProvisioningService;
import com.geomonitor.gatewayservice.services.credentials.CredentialStore;
import com.geomonitor.gatewayservice.services.credentials.IssuedCredential;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/admin")
@RequiredArgsConstructor
public class AdminKeyController {

    private final CredentialStore credentialStore;
    private final ProvisioningService provisioningService;

    /**
     * Issue a new key for an existing account.
     *
     * @param accountId the owning account
     * @param request the plan to bill the key under
     * @return the issued key; the token is only ever returned here
     */
    @PostMapping("/accounts/{accountId}/keys")
    public ResponseEntity<IssuedKeyResponse> issueKey(@PathVariable UUID accountId,
            @Valid @RequestBody IssueKeyRequest request) {
        IssuedCredential issued = credentialStore.issue(accountId, request.getPlanTier());
        return ResponseEntity.status(HttpStatus.CREATED).body(IssuedKeyResponse.from(issued));
    }

    @GetMapping("/accounts/{accountId}/keys")
    public ResponseEntity<List<KeySummaryResponse>> listKeys(@PathVariable UUID accountId) {
        List<KeySummaryResponse> keys = credentialStore.listForAccount(accountId).stream()
                .map(KeySummaryResponse::from)
                .toList();
        return ResponseEntity.ok(keys);
    }

    /**
     * Revoke a key. Revoking an already revoked key is a no-op.
     */
    @DeleteMapping("/keys/{credentialId}")
    public ResponseEntity<Void> revokeKey(@PathVariable UUID credentialId) {
        credentialStore.revoke(credentialId);
        return ResponseEntity.noContent().build();
    }

    /**
     * Find or create the account for the buyer's email and issue it a key.
     */
    @PostMapping("/provision")
    public ResponseEntity<IssuedKeyResponse> provision(@Valid @RequestBody ProvisionRequest request) {
        IssuedCredential issued = provisioningService.provision(request.getEmail(), request.getPlanTier());
        return ResponseEntity.status(HttpStatus.CREATED).body(IssuedKeyResponse.from(issued));
    }
}
