package com.kaimu.backend.modules.auth.presentation.dto;

import com.kaimu.backend.modules.auth.application.TokenPair;

public record TokenPairResponse(
        String accessToken,
        String tokenType,
        long expiresInSeconds,
        String refreshToken
) {
    public static final String DEFAULT_TOKEN_TYPE = "Bearer";

    public static TokenPairResponse from(TokenPair pair) {
        return new TokenPairResponse(pair.accessToken(), DEFAULT_TOKEN_TYPE, pair.expiresInSeconds(), pair.refreshToken());
    }
}
