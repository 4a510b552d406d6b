package com.kaimu.backend.modules.oidc.presentation.dto;

import java.time.OffsetDateTime;

import com.kaimu.backend.modules.oidc.application.OidcService.LinkedIdentity;

public record LinkedIdentityResponse(String provider, String providerName, String email, OffsetDateTime linkedAt) {
    public static LinkedIdentityResponse from(LinkedIdentity identity) {
        return new LinkedIdentityResponse(identity.providerSlug(), identity.providerName(), identity.email(), identity.linkedAt());
    }
}
