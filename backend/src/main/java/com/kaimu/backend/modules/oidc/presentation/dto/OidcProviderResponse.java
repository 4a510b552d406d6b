package com.kaimu.backend.modules.oidc.presentation.dto;

import com.kaimu.backend.modules.oidc.application.OidcService.ProviderSummary;

public record OidcProviderResponse(String slug, String name) {
    public static OidcProviderResponse from(ProviderSummary summary) {
        return new OidcProviderResponse(summary.slug(), summary.name());
    }
}
