package com.geomonitor.gatewayservice.repository;

import com.geomonitor.gatewayservice.models.ApiCredential;
import com.geomonitor.gatewayservice.services.credentials.CredentialInfo;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ApiCredentialRepository extends JpaRepository<ApiCredential, UUID> {

    /**
     * Single lookup for every outcome: unknown fingerprint, revoked key and
     * inactive account all run the same query and return empty.
     */
    @Query("SELECT new com.geomonitor.gatewayservice.services.credentials.CredentialInfo(" +
            "c.credentialId, a.accountId, c.keyPrefix, c.planTier) " +
            "FROM ApiCredential c JOIN c.account a " +
            "WHERE c.fingerprint = :fingerprint AND c.active = true AND a.active = true")
    Optional<CredentialInfo> findActiveByFingerprint(@Param("fingerprint") String fingerprint);

    List<ApiCredential> findAllByAccount_AccountIdOrderByCreatedAtDesc(UUID accountId);

    boolean existsByFingerprint(String fingerprint);
}
