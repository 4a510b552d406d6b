package com.kaimu.backend.modules.rbac.presentation.dto;

import java.util.UUID;

import jakarta.validation.constraints.NotNull;

public record OrganizationRoleAssignmentRequest(@NotNull UUID roleId) {
}
