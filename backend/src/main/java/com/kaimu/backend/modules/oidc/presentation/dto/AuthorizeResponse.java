package com.kaimu.backend.modules.oidc.presentation.dto;

import com.kaimu.backend.modules.oidc.application.OidcService.AuthorizationStart;

public record AuthorizeResponse(String authUrl, String state) {
    public static AuthorizeResponse from(AuthorizationStart start) {
        return new AuthorizeResponse(start.authUrl(), start.state());
    }
}
