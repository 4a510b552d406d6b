package com.kaimu.backend.modules.oidc.domain;

/**
 * Claims taken from a verified ID token. Optional values are null when the provider omits them.
 */
public record IdentityClaims(
        String issuer,
        String subject,
        String email,
        boolean emailVerified,
        String name,
        String picture,
        String nonce
) {

    public boolean hasVerifiedEmail() {
        return emailVerified && email != null && !email.isBlank();
    }
}
