package com.kaimu.backend.modules.rbac.application;

import java.util.List;
import java.util.UUID;

import com.kaimu.backend.modules.rbac.domain.Role;
import com.kaimu.backend.modules.rbac.domain.RoleScope;

public record RoleView(
        UUID id,
        UUID organizationId,
        String name,
        String description,
        boolean system,
        RoleScope scope,
        List<String> permissions
) {
    public static RoleView from(Role role) {
        return new RoleView(
                role.getId(),
                role.getOrganizationId(),
                role.getName(),
                role.getDescription(),
                role.isSystem(),
                role.getScope(),
                role.permissionCodes()
        );
    }
}
