package com.kaimu.backend.modules.oidc.domain;

import java.time.Duration;
import java.time.Instant;

/**
 * Pending login attempt keyed by its state token. Lives only in memory.
 */
public record AuthorizationAttempt(
        String state,
        String providerSlug,
        String codeVerifier,
        String nonce,
        String redirectUri,
        Instant createdAt
) {

    public boolean isExpired(Instant now, Duration ttl) {
        return createdAt.plus(ttl).isBefore(now);
    }
}
