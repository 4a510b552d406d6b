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
        name = "organization_members",
        uniqueConstraints = @UniqueConstraint(name = "unique_org_member", columnNames = {"organization_id", "user_id"})
)
public class OrganizationMember extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "organization_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID organizationId;

    @Column(name = "user_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID userId;

    // Role string written before explicit role references existed. Only read when roleId is null.
    @Column(name = "role", length = 50)
    private String legacyRole;

    @Column(name = "role_id", columnDefinition = "uuid")
    private UUID roleId;

    public static OrganizationMember of(UUID organizationId, UUID userId, UUID roleId) {
        OrganizationMember member = new OrganizationMember();
        member.organizationId = organizationId;
        member.userId = userId;
        member.roleId = roleId;
        return member;
    }

    public UUID getId() {
        return id;
    }

    public UUID getOrganizationId() {
        return organizationId;
    }

    public UUID getUserId() {
        return userId;
    }

    public String getLegacyRole() {
        return legacyRole;
    }

    public void setLegacyRole(String legacyRole) {
        this.legacyRole = legacyRole;
    }

    public UUID getRoleId() {
        return roleId;
    }

    public UUID effectiveRoleId() {
        return roleId != null ? roleId : SystemRoles.fromLegacy(legacyRole);
    }

    public boolean isOwner() {
        return SystemRoles.OWNER_ID.equals(effectiveRoleId());
    }

    public void assignRole(UUID roleId) {
        this.roleId = roleId;
        this.legacyRole = null;
    }
}
