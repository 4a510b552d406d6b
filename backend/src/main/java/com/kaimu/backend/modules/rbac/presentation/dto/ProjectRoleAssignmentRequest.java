package com.kaimu.backend.modules.rbac.presentation.dto;

import java.util.UUID;

/**
 * A null role removes the project override.
 */
public record ProjectRoleAssignmentRequest(UUID roleId) {
}
