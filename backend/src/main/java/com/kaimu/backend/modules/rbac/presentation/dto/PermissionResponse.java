package com.kaimu.backend.modules.rbac.presentation.dto;

import com.kaimu.backend.modules.rbac.domain.Permission;

public record PermissionResponse(String code, String name, String description, String resourceType) {
    public static PermissionResponse from(Permission permission) {
        return new PermissionResponse(
                permission.getCode(),
                permission.getName(),
                permission.getDescription(),
                permission.getResourceType()
        );
    }
}
