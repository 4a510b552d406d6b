package com.kaimu.backend.modules.rbac.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import com.kaimu.backend.modules.rbac.domain.Role;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface RoleRepository extends JpaRepository<Role, UUID> {

    @EntityGraph(attributePaths = "permissions")
    @Query("select r from Role r where r.id = :id")
    Optional<Role> findWithPermissionsById(@Param("id") UUID id);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select r from Role r where r.id = :id")
    Optional<Role> findByIdForUpdate(@Param("id") UUID id);

    @EntityGraph(attributePaths = "permissions")
    @Query("""
            select distinct r from Role r
             where r.organizationId is null
                or r.organizationId = :organizationId
             order by r.system desc, r.name asc
            """)
    List<Role> findAvailableForOrganization(@Param("organizationId") UUID organizationId);

    @Query("select p.code from Role r join r.permissions p where r.id = :roleId")
    Set<String> findPermissionCodesByRoleId(@Param("roleId") UUID roleId);

    boolean existsByOrganizationIdAndNameIgnoreCase(UUID organizationId, String name);

    boolean existsByOrganizationIdAndNameIgnoreCaseAndIdNot(UUID organizationId, String name, UUID id);
}
