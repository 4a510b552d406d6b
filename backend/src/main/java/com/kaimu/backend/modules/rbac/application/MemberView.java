package com.kaimu.backend.modules.rbac.application;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * {@code inherited} is only ever true for project members without a project role.
 */
public record MemberView(
        UUID userId,
        String username,
        String displayName,
        UUID roleId,
        String roleName,
        boolean inherited,
        OffsetDateTime joinedAt
) {
}
