package com.kaimu.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.kaimu.backend.global.error.ProblemException;
import com.kaimu.backend.modules.audit.application.AuditLogService;
import com.kaimu.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.kaimu.backend.modules.audit.domain.AuditAction;
import com.kaimu.backend.modules.auth.domain.ClientMetadata;
import com.kaimu.backend.modules.auth.domain.CredentialError;
import com.kaimu.backend.modules.auth.domain.RefreshToken;
import com.kaimu.backend.modules.auth.infrastructure.persistence.RefreshTokenRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

/**
 * Issues, rotates and revokes credential pairs for a principal id.
 * Knows nothing about roles or federation.
 */
@Service
@Transactional(noRollbackFor = ResponseStatusException.class)
public class TokenService {

    private static final Logger log = LoggerFactory.getLogger(TokenService.class);

    private final RefreshTokenRepository refreshTokenRepository;
    private final AccessTokenService accessTokenService;
    private final OpaqueTokenGenerator tokenGenerator;
    private final AuditLogService auditLogService;
    private final long refreshTokenTtlMillis;
    private final Clock clock;

    public TokenService(
            RefreshTokenRepository refreshTokenRepository,
            AccessTokenService accessTokenService,
            OpaqueTokenGenerator tokenGenerator,
            AuditLogService auditLogService,
            @Value("${jwt.refresh-expiration:604800000}") long refreshTokenTtlMillis,
            Clock clock
    ) {
        this.refreshTokenRepository = refreshTokenRepository;
        this.accessTokenService = accessTokenService;
        this.tokenGenerator = tokenGenerator;
        this.auditLogService = auditLogService;
        this.refreshTokenTtlMillis = refreshTokenTtlMillis;
        this.clock = clock;
    }

    public TokenPair issuePair(UUID userId, ClientMetadata clientMetadata) {
        return issue(userId, clientMetadata).pair();
    }

    /**
     * Exchanges a refresh token for a new pair. A presented token that is already revoked or expired
     * is treated as stolen: every active token of the owner is revoked before the call fails.
     */
    public TokenPair rotate(String refreshToken, ClientMetadata clientMetadata) {
        if (refreshToken == null || refreshToken.isBlank()) {
            throw new ProblemException(CredentialError.INVALID_REFRESH_TOKEN);
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        // Row lock serializes concurrent rotations of the same secret; the loser sees it revoked.
        RefreshToken stored = refreshTokenRepository.findByTokenHashForUpdate(tokenGenerator.hash(refreshToken))
                .orElseThrow(() -> new ProblemException(CredentialError.INVALID_REFRESH_TOKEN));

        if (!stored.isUsable(now)) {
            containReuse(stored, now);
            throw new ProblemException(CredentialError.REFRESH_TOKEN_REVOKED);
        }

        IssuedPair issued = issue(stored.getUserId(), clientMetadata);
        stored.revoke(now, issued.recordId());
        refreshTokenRepository.save(stored);
        return issued.pair();
    }

    public void revoke(String refreshToken) {
        if (refreshToken == null || refreshToken.isBlank()) {
            return;
        }
        Optional<RefreshToken> stored = refreshTokenRepository.findByTokenHash(tokenGenerator.hash(refreshToken));
        if (stored.isEmpty() || stored.get().isRevoked()) {
            return;
        }
        RefreshToken token = stored.get();
        token.revoke(OffsetDateTime.now(clock), null);
        refreshTokenRepository.save(token);
    }

    public int revokeAllForPrincipal(UUID userId) {
        int revoked = refreshTokenRepository.revokeAllActiveForUser(userId, OffsetDateTime.now(clock));
        log.debug("Revoked {} refresh tokens for user {}", revoked, userId);
        return revoked;
    }

    public long getAccessTokenTtlSeconds() {
        return accessTokenService.getAccessTokenTtlSeconds();
    }

    private void containReuse(RefreshToken stored, OffsetDateTime now) {
        int revoked = refreshTokenRepository.revokeAllActiveForUser(stored.getUserId(), now);
        log.warn("Refresh token reuse detected for user {} (token {}); revoked {} active tokens",
                stored.getUserId(), stored.getId(), revoked);
        auditLogService.record(AuditLogCommand.of(
                AuditAction.REFRESH_TOKEN_REUSE,
                "refresh_token",
                stored.getId(),
                stored.getUserId(),
                Map.of(
                        "revokedCount", revoked,
                        "expired", stored.isExpired(now),
                        "previouslyRevoked", stored.isRevoked()
                )
        ));
    }

    private IssuedPair issue(UUID userId, ClientMetadata clientMetadata) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        String rawRefreshToken = tokenGenerator.generate();

        RefreshToken record = new RefreshToken();
        record.setUserId(userId);
        record.setTokenHash(tokenGenerator.hash(rawRefreshToken));
        record.setCreatedAt(now);
        record.setExpiresAt(now.plus(Duration.ofMillis(refreshTokenTtlMillis)));
        record.applyClientMetadata(clientMetadata != null ? clientMetadata : ClientMetadata.UNKNOWN);
        RefreshToken saved = refreshTokenRepository.save(record);

        String accessToken = accessTokenService.issue(userId);
        log.debug("Issued credential pair for user {}", userId);
        TokenPair pair = new TokenPair(accessToken, rawRefreshToken, accessTokenService.getAccessTokenTtlSeconds());
        return new IssuedPair(pair, saved.getId());
    }

    private record IssuedPair(TokenPair pair, UUID recordId) {
    }
}
