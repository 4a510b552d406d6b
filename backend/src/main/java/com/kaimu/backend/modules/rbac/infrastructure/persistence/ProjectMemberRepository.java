package com.kaimu.backend.modules.rbac.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.kaimu.backend.modules.rbac.domain.ProjectMember;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ProjectMemberRepository extends JpaRepository<ProjectMember, UUID> {

    Optional<ProjectMember> findByProjectIdAndUserId(UUID projectId, UUID userId);

    List<ProjectMember> findByProjectIdOrderByCreatedAtAsc(UUID projectId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update ProjectMember pm set pm.roleId = null where pm.roleId = :roleId")
    int clearRole(@Param("roleId") UUID roleId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            delete from ProjectMember pm
             where pm.userId = :userId
               and pm.projectId in (select p.id from Project p where p.organizationId = :organizationId)
            """)
    int deleteByUserIdWithinOrganization(@Param("userId") UUID userId, @Param("organizationId") UUID organizationId);
}
