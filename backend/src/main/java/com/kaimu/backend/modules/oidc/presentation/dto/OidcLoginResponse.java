package com.kaimu.backend.modules.oidc.presentation.dto;

import com.kaimu.backend.modules.auth.presentation.dto.TokenPairResponse;
import com.kaimu.backend.modules.auth.presentation.dto.UserProfileResponse;
import com.kaimu.backend.modules.oidc.application.OidcService.CallbackResult;

public record OidcLoginResponse(
        TokenPairResponse tokens,
        UserProfileResponse user,
        boolean newPrincipal,
        boolean linkedToExisting,
        String redirectUri
) {
    public static OidcLoginResponse from(CallbackResult result) {
        return new OidcLoginResponse(
                TokenPairResponse.from(result.tokens()),
                UserProfileResponse.from(result.user()),
                result.newPrincipal(),
                result.linkedToExisting(),
                result.redirectUri()
        );
    }
}
