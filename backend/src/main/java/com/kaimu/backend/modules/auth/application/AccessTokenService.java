package com.kaimu.backend.modules.auth.application;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Date;
import java.util.UUID;

import com.kaimu.backend.global.error.ProblemException;
import com.kaimu.backend.modules.auth.domain.CredentialError;
import com.kaimu.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.Jwts.SIG;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Issues and validates the short-lived HS256 access token. Validation never touches storage.
 */
@Service
public class AccessTokenService {

    static final String ISSUER = "kaimu";

    private final JwtTokenProvider tokenProvider;
    private final long accessTokenTtlMillis;
    private final Clock clock;

    public AccessTokenService(
            JwtTokenProvider tokenProvider,
            @Value("${jwt.expiration:900000}") long accessTokenTtlMillis,
            Clock clock
    ) {
        this.tokenProvider = tokenProvider;
        this.accessTokenTtlMillis = accessTokenTtlMillis;
        this.clock = clock;
    }

    public String issue(UUID userId) {
        Instant now = clock.instant();
        return Jwts.builder()
                .subject(userId.toString())
                .issuer(ISSUER)
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plusMillis(accessTokenTtlMillis)))
                .signWith(tokenProvider.getSecretKey(), SIG.HS256)
                .compact();
    }

    public AccessClaims validate(String token) {
        if (token == null || token.isBlank()) {
            throw new ProblemException(CredentialError.INVALID_ACCESS_TOKEN);
        }
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(tokenProvider.getSecretKey())
                    .requireIssuer(ISSUER)
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();

            if (claims.getSubject() == null || claims.getExpiration() == null) {
                throw new ProblemException(CredentialError.INVALID_ACCESS_TOKEN, "Access token is missing subject or expiry");
            }
            UUID userId = UUID.fromString(claims.getSubject());
            Instant issuedAt = claims.getIssuedAt() != null ? claims.getIssuedAt().toInstant() : clock.instant();
            return new AccessClaims(
                    userId,
                    OffsetDateTime.ofInstant(issuedAt, clock.getZone()),
                    OffsetDateTime.ofInstant(claims.getExpiration().toInstant(), clock.getZone())
            );
        } catch (JwtException | IllegalArgumentException e) {
            throw new ProblemException(CredentialError.INVALID_ACCESS_TOKEN, null, e);
        }
    }

    public long getAccessTokenTtlSeconds() {
        return accessTokenTtlMillis / 1000L;
    }

    public record AccessClaims(UUID userId, OffsetDateTime issuedAt, OffsetDateTime expiresAt) {
    }
}
