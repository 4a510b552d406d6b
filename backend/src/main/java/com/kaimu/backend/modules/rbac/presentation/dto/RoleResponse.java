package com.kaimu.backend.modules.rbac.presentation.dto;

import java.util.List;
import java.util.Locale;
import java.util.UUID;

import com.kaimu.backend.modules.rbac.application.RoleView;

public record RoleResponse(
        UUID id,
        UUID organizationId,
        String name,
        String description,
        boolean system,
        String scope,
        List<String> permissions
) {
    public static RoleResponse from(RoleView view) {
        return new RoleResponse(
                view.id(),
                view.organizationId(),
                view.name(),
                view.description(),
                view.system(),
                view.scope().name().toLowerCase(Locale.ROOT),
                view.permissions()
        );
    }
}
