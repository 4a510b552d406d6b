package com.kaimu.backend.modules.oidc.infrastructure.client;

import com.kaimu.backend.modules.oidc.domain.IdentityClaims;
import com.kaimu.backend.modules.oidc.infrastructure.config.OidcProperties.Provider;

/**
 * Protocol calls against an external OIDC provider. Every call is bounded by the configured HTTP timeout.
 */
public interface OidcProviderClient {

    /**
     * Fetches (or returns cached) discovery metadata with deployment rewrites applied.
     */
    ProviderMetadata metadata(Provider provider);

    /**
     * Exchanges an authorization code for tokens, proving possession of the PKCE verifier.
     */
    TokenResponse exchangeCode(Provider provider, String code, String codeVerifier, String redirectUri);

    /**
     * Verifies signature, issuer, audience and lifetime of an ID token and extracts its claims.
     * The nonce is returned as-is; comparing it is the caller's job.
     */
    IdentityClaims verifyIdToken(Provider provider, String idToken);

    record ProviderMetadata(String issuer, String authorizationEndpoint, String tokenEndpoint, String jwksUri) {
    }

    record TokenResponse(String idToken, String accessToken, String refreshToken, long expiresIn) {
    }
}
