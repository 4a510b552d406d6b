package com.kaimu.backend.modules.rbac.domain;

import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import com.kaimu.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.JoinTable;
import jakarta.persistence.ManyToMany;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

@Entity
@Table(name = "roles")
public class Role extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    // null for system roles
    @Column(name = "organization_id", updatable = false, columnDefinition = "uuid")
    private UUID organizationId;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Column(name = "description", columnDefinition = "text")
    private String description;

    @Column(name = "is_system", nullable = false, updatable = false)
    private boolean system;

    @Enumerated(EnumType.STRING)
    @Column(name = "scope", nullable = false, length = 32)
    private RoleScope scope = RoleScope.ORGANIZATION;

    @ManyToMany(fetch = FetchType.LAZY)
    @JoinTable(
            name = "role_permissions",
            joinColumns = @JoinColumn(name = "role_id"),
            inverseJoinColumns = @JoinColumn(name = "permission_id")
    )
    private Set<Permission> permissions = new HashSet<>();

    public static Role custom(UUID organizationId, String name, String description) {
        Role role = new Role();
        role.organizationId = organizationId;
        role.name = name;
        role.description = description;
        role.system = false;
        return role;
    }

    public UUID getId() {
        return id;
    }

    public UUID getOrganizationId() {
        return organizationId;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public boolean isSystem() {
        return system;
    }

    public RoleScope getScope() {
        return scope;
    }

    public Set<Permission> getPermissions() {
        return permissions;
    }

    public void replacePermissions(Collection<Permission> replacement) {
        permissions.clear();
        permissions.addAll(replacement);
    }

    public List<String> permissionCodes() {
        return permissions.stream()
                .map(Permission::getCode)
                .sorted()
                .toList();
    }

    /**
     * Whether members of the given organization may be assigned this role.
     */
    public boolean isAssignableIn(UUID organizationId) {
        return system || (this.organizationId != null && this.organizationId.equals(organizationId));
    }

    public boolean isOwner() {
        return SystemRoles.OWNER_ID.equals(id);
    }
}
