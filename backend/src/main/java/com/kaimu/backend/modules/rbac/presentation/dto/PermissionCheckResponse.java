package com.kaimu.backend.modules.rbac.presentation.dto;

import java.util.UUID;

public record PermissionCheckResponse(String code, String resourceType, UUID resourceId, boolean allowed) {
}
