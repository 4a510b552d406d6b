package com.kaimu.backend.modules.rbac.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.kaimu.backend.modules.rbac.domain.OrganizationMember;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface OrganizationMemberRepository extends JpaRepository<OrganizationMember, UUID> {

    Optional<OrganizationMember> findByOrganizationIdAndUserId(UUID organizationId, UUID userId);

    List<OrganizationMember> findByOrganizationIdOrderByCreatedAtAsc(UUID organizationId);

    /**
     * Owners by explicit role reference, plus legacy rows whose role string still says owner.
     */
    @Query("""
            select count(m) from OrganizationMember m
             where m.organizationId = :organizationId
               and (m.roleId = :ownerRoleId
                    or (m.roleId is null and m.legacyRole = :legacyOwner))
            """)
    long countOwners(
            @Param("organizationId") UUID organizationId,
            @Param("ownerRoleId") UUID ownerRoleId,
            @Param("legacyOwner") String legacyOwner
    );

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update OrganizationMember m
               set m.roleId = :fallbackRoleId,
                   m.legacyRole = null
             where m.roleId = :roleId
            """)
    int reassignRole(@Param("roleId") UUID roleId, @Param("fallbackRoleId") UUID fallbackRoleId);
}
