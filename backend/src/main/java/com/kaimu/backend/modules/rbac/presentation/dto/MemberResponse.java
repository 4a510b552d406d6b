package com.kaimu.backend.modules.rbac.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.kaimu.backend.modules.rbac.application.MemberView;

public record MemberResponse(
        UUID userId,
        String username,
        String displayName,
        UUID roleId,
        String roleName,
        boolean inheritsOrganizationRole,
        OffsetDateTime joinedAt
) {
    public static MemberResponse from(MemberView view) {
        return new MemberResponse(
                view.userId(),
                view.username(),
                view.displayName(),
                view.roleId(),
                view.roleName(),
                view.inherited(),
                view.joinedAt()
        );
    }
}
