package com.kaimu.backend.modules.oidc.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.kaimu.backend.modules.oidc.domain.OidcIdentity;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface OidcIdentityRepository extends JpaRepository<OidcIdentity, UUID> {

    Optional<OidcIdentity> findByIssuerAndSubject(String issuer, String subject);

    List<OidcIdentity> findByUserIdOrderByCreatedAtAsc(UUID userId);

    @Modifying
    @Query("delete from OidcIdentity oi where oi.userId = :userId and oi.issuer = :issuer")
    int deleteByUserIdAndIssuer(@Param("userId") UUID userId, @Param("issuer") String issuer);
}
