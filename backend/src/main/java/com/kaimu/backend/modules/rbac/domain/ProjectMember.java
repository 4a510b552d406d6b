package com.kaimu.backend.modules.rbac.domain;

import java.util.UUID;

import com.kaimu.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import org.hibernate.annotations.UuidGenerator;

@Entity
@Table(
        name = "project_members",
        uniqueConstraints = @UniqueConstraint(name = "unique_project_member", columnNames = {"project_id", "user_id"})
)
public class ProjectMember extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "project_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID projectId;

    @Column(name = "user_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID userId;

    // null means the organization role applies
    @Column(name = "role_id", columnDefinition = "uuid")
    private UUID roleId;

    public static ProjectMember of(UUID projectId, UUID userId, UUID roleId) {
        ProjectMember member = new ProjectMember();
        member.projectId = projectId;
        member.userId = userId;
        member.roleId = roleId;
        return member;
    }

    public UUID getId() {
        return id;
    }

    public UUID getProjectId() {
        return projectId;
    }

    public UUID getUserId() {
        return userId;
    }

    public UUID getRoleId() {
        return roleId;
    }

    public void setRoleId(UUID roleId) {
        this.roleId = roleId;
    }

    public boolean inheritsOrganizationRole() {
        return roleId == null;
    }
}
