package com.kaimu.backend.modules.rbac.presentation.dto;

import java.util.List;
import java.util.UUID;

public record MyPermissionsResponse(String resourceType, UUID resourceId, List<String> permissions) {
}
