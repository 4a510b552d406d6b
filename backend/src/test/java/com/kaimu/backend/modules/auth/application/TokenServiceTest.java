package com.kaimu.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import com.kaimu.backend.global.error.ProblemException;
import com.kaimu.backend.modules.audit.application.AuditLogService;
import com.kaimu.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.kaimu.backend.modules.audit.domain.AuditAction;
import com.kaimu.backend.modules.auth.domain.ClientMetadata;
import com.kaimu.backend.modules.auth.domain.CredentialError;
import com.kaimu.backend.modules.auth.domain.RefreshToken;
import com.kaimu.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;
import com.kaimu.backend.modules.auth.infrastructure.persistence.RefreshTokenRepository;
import com.kaimu.backend.support.TestEntities;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TokenServiceTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");
    private static final long REFRESH_TTL_MILLIS = Duration.ofDays(7).toMillis();

    @Mock
    private RefreshTokenRepository refreshTokenRepository;

    @Mock
    private AuditLogService auditLogService;

    private final OpaqueTokenGenerator tokenGenerator = new OpaqueTokenGenerator();
    private final UUID userId = UUID.fromString("00000000-0000-0000-0000-000000000101");
    private final ClientMetadata client = ClientMetadata.of("JUnit", "127.0.0.1");

    private TokenService tokenService;
    private OffsetDateTime now;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        now = OffsetDateTime.now(clock);
        AccessTokenService accessTokenService = new AccessTokenService(
                new JwtTokenProvider("unit-test-secret-key-with-at-least-32-bytes"), 900_000L, clock);
        tokenService = new TokenService(
                refreshTokenRepository,
                accessTokenService,
                tokenGenerator,
                auditLogService,
                REFRESH_TTL_MILLIS,
                clock
        );
        lenient().when(refreshTokenRepository.save(any(RefreshToken.class))).thenAnswer(invocation -> {
            RefreshToken token = invocation.getArgument(0);
            if (token.getId() == null) {
                TestEntities.withId(token, UUID.randomUUID());
            }
            return token;
        });
    }

    @Test
    @DisplayName("issuing stores only the hash of the refresh secret")
    void issuePairPersistsHashOnly() {
        TokenPair pair = tokenService.issuePair(userId, client);

        ArgumentCaptor<RefreshToken> captor = ArgumentCaptor.forClass(RefreshToken.class);
        verify(refreshTokenRepository).save(captor.capture());
        RefreshToken stored = captor.getValue();

        assertThat(stored.getTokenHash()).isEqualTo(tokenGenerator.hash(pair.refreshToken()));
        assertThat(stored.getTokenHash()).isNotEqualTo(pair.refreshToken());
        assertThat(stored.getExpiresAt()).isEqualTo(now.plusDays(7));
        assertThat(stored.getUserAgent()).isEqualTo("JUnit");
        assertThat(pair.expiresInSeconds()).isEqualTo(900L);
        assertThat(pair.accessToken()).isNotBlank();
    }

    @Test
    void rotateRevokesPresentedTokenAndLinksReplacement() {
        String presented = tokenGenerator.generate();
        RefreshToken stored = activeToken(presented);

        TokenPair rotated = tokenService.rotate(presented, client);

        assertThat(rotated.refreshToken()).isNotEqualTo(presented);
        assertThat(stored.isRevoked()).isTrue();
        assertThat(stored.getRevokedAt()).isEqualTo(now);
        assertThat(stored.getReplacedBy()).isNotNull();
        verify(refreshTokenRepository, never()).revokeAllActiveForUser(any(), any());
    }

    @Test
    @DisplayName("a second rotation of the same secret is treated as reuse")
    void rotatingSameSecretTwiceTriggersContainment() {
        String presented = tokenGenerator.generate();
        activeToken(presented);
        tokenService.rotate(presented, client);

        when(refreshTokenRepository.revokeAllActiveForUser(userId, now)).thenReturn(1);

        assertThatThrownBy(() -> tokenService.rotate(presented, client))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getErrorCode()).isEqualTo(CredentialError.REFRESH_TOKEN_REVOKED));
        verify(refreshTokenRepository).revokeAllActiveForUser(userId, now);
    }

    @Test
    void revokedTokenRevokesEverySessionAndIsAudited() {
        String presented = tokenGenerator.generate();
        RefreshToken stored = activeToken(presented);
        stored.revoke(now.minusMinutes(5), null);
        when(refreshTokenRepository.revokeAllActiveForUser(userId, now)).thenReturn(3);

        assertThatThrownBy(() -> tokenService.rotate(presented, client))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getErrorCode()).isEqualTo(CredentialError.REFRESH_TOKEN_REVOKED));

        ArgumentCaptor<AuditLogCommand> audit = ArgumentCaptor.forClass(AuditLogCommand.class);
        verify(auditLogService).record(audit.capture());
        assertThat(audit.getValue().action()).isEqualTo(AuditAction.REFRESH_TOKEN_REUSE);
        assertThat(audit.getValue().actorUserId()).isEqualTo(userId);
        assertThat(audit.getValue().detail()).containsEntry("revokedCount", 3);
    }

    @Test
    void expiredTokenAlsoTriggersContainment() {
        String presented = tokenGenerator.generate();
        RefreshToken stored = activeToken(presented);
        stored.setExpiresAt(now.minusSeconds(1));
        when(refreshTokenRepository.revokeAllActiveForUser(userId, now)).thenReturn(0);

        assertThatThrownBy(() -> tokenService.rotate(presented, client))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getErrorCode()).isEqualTo(CredentialError.REFRESH_TOKEN_REVOKED));
        verify(refreshTokenRepository).revokeAllActiveForUser(userId, now);
        verify(refreshTokenRepository, never()).save(any());
    }

    @Test
    void unknownTokenFailsWithoutSideEffects() {
        when(refreshTokenRepository.findByTokenHashForUpdate(anyString())).thenReturn(Optional.empty());

        assertThatThrownBy(() -> tokenService.rotate("unknown", client))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getErrorCode()).isEqualTo(CredentialError.INVALID_REFRESH_TOKEN));
        verify(refreshTokenRepository, never()).revokeAllActiveForUser(any(), any());
        verify(auditLogService, never()).record(any());
    }

    @Test
    void revokeIsIdempotent() {
        when(refreshTokenRepository.findByTokenHash(anyString())).thenReturn(Optional.empty());
        tokenService.revoke("unknown");
        tokenService.revoke("  ");

        String presented = tokenGenerator.generate();
        RefreshToken stored = newToken(presented);
        stored.revoke(now.minusHours(1), null);
        when(refreshTokenRepository.findByTokenHash(tokenGenerator.hash(presented))).thenReturn(Optional.of(stored));

        tokenService.revoke(presented);

        assertThat(stored.getRevokedAt()).isEqualTo(now.minusHours(1));
        verify(refreshTokenRepository, never()).save(any());
    }

    @Test
    void revokeAllDelegatesToBulkUpdate() {
        when(refreshTokenRepository.revokeAllActiveForUser(eq(userId), eq(now))).thenReturn(2);

        assertThat(tokenService.revokeAllForPrincipal(userId)).isEqualTo(2);
    }

    private RefreshToken activeToken(String rawSecret) {
        RefreshToken token = newToken(rawSecret);
        when(refreshTokenRepository.findByTokenHashForUpdate(tokenGenerator.hash(rawSecret))).thenReturn(Optional.of(token));
        return token;
    }

    private RefreshToken newToken(String rawSecret) {
        RefreshToken token = new RefreshToken();
        TestEntities.withId(token, UUID.randomUUID());
        token.setUserId(userId);
        token.setTokenHash(tokenGenerator.hash(rawSecret));
        token.setCreatedAt(now.minusDays(1));
        token.setExpiresAt(now.plusDays(6));
        token.applyClientMetadata(client);
        return token;
    }
}
