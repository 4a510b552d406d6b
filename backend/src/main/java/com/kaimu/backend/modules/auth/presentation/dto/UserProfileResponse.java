package com.kaimu.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.kaimu.backend.modules.auth.domain.User;

public record UserProfileResponse(
        UUID userId,
        String username,
        String email,
        boolean emailVerified,
        String displayName,
        String avatarUrl,
        boolean passwordLoginEnabled,
        OffsetDateTime createdAt
) {
    public static UserProfileResponse from(User user) {
        return new UserProfileResponse(
                user.getId(),
                user.getUsername(),
                user.getEmail(),
                user.isEmailVerified(),
                user.getDisplayName(),
                user.getAvatarUrl(),
                user.hasPassword(),
                user.getCreatedAt()
        );
    }
}
