package com.kaimu.backend.modules.oidc.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import com.kaimu.backend.global.error.ProblemException;
import com.kaimu.backend.modules.audit.application.AuditLogService;
import com.kaimu.backend.modules.auth.application.TokenPair;
import com.kaimu.backend.modules.auth.application.TokenService;
import com.kaimu.backend.modules.auth.domain.ClientMetadata;
import com.kaimu.backend.modules.auth.domain.User;
import com.kaimu.backend.modules.oidc.application.OidcAccountResolver.ResolvedAccount;
import com.kaimu.backend.modules.oidc.application.OidcService.AuthorizationStart;
import com.kaimu.backend.modules.oidc.application.OidcService.CallbackResult;
import com.kaimu.backend.modules.oidc.application.OidcService.LinkedIdentity;
import com.kaimu.backend.modules.oidc.domain.AuthorizationAttempt;
import com.kaimu.backend.modules.oidc.domain.FederationError;
import com.kaimu.backend.modules.oidc.domain.IdentityClaims;
import com.kaimu.backend.modules.oidc.domain.OidcIdentity;
import com.kaimu.backend.modules.oidc.infrastructure.client.OidcProviderClient;
import com.kaimu.backend.modules.oidc.infrastructure.client.OidcProviderClient.ProviderMetadata;
import com.kaimu.backend.modules.oidc.infrastructure.client.OidcProviderClient.TokenResponse;
import com.kaimu.backend.modules.oidc.infrastructure.config.OidcProperties;
import com.kaimu.backend.modules.oidc.infrastructure.config.OidcProperties.Provider;
import com.kaimu.backend.modules.oidc.infrastructure.persistence.OidcIdentityRepository;
import com.kaimu.backend.support.TestEntities;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.util.MultiValueMap;
import org.springframework.web.util.UriComponentsBuilder;

@ExtendWith(MockitoExtension.class)
class OidcServiceTest {

    private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");
    private static final ClientMetadata CLIENT = ClientMetadata.of("JUnit", "10.0.0.1");
    private static final String CALLBACK_URL = "http://localhost:8080/auth/oidc/acme/callback";

    private static final Provider ACME = new Provider(
            "acme", "Acme ID", "https://id.acme.test", null, "kaimu-client", "client-secret", "openid email profile");

    @Mock
    private OidcProviderClient providerClient;

    @Mock
    private OidcAccountResolver accountResolver;

    @Mock
    private OidcIdentityRepository identityRepository;

    @Mock
    private TokenService tokenService;

    @Mock
    private AuditLogService auditLogService;

    private final AuthorizationAttemptStore attemptStore = new AuthorizationAttemptStore();
    private final PkceGenerator pkceGenerator = new PkceGenerator();

    private OidcService oidcService;

    @BeforeEach
    void setUp() {
        OidcProperties properties = new OidcProperties(
                "http://localhost:8080/",
                Duration.ofMinutes(10),
                Duration.ofMinutes(5),
                Duration.ofSeconds(10),
                List.of(ACME)
        );
        oidcService = new OidcService(properties, providerClient, attemptStore, pkceGenerator, accountResolver,
                identityRepository, tokenService, auditLogService, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("authorize URL carries the S256 challenge of the stored verifier")
    void beginAuthorizationBuildsPkceUrl() {
        when(providerClient.metadata(ACME)).thenReturn(new ProviderMetadata(
                "https://id.acme.test", "https://id.acme.test/authorize", "https://id.acme.test/token", "https://id.acme.test/jwks"));

        AuthorizationStart start = oidcService.beginAuthorization("acme", "/dashboard");

        assertThat(start.authUrl()).startsWith("https://id.acme.test/authorize?");
        MultiValueMap<String, String> query = UriComponentsBuilder.fromUriString(start.authUrl()).build().getQueryParams();
        assertThat(query.getFirst("response_type")).isEqualTo("code");
        assertThat(query.getFirst("client_id")).isEqualTo("kaimu-client");
        assertThat(query.getFirst("state")).isEqualTo(start.state());
        assertThat(query.getFirst("code_challenge_method")).isEqualTo("S256");

        AuthorizationAttempt attempt = attemptStore.consume(start.state()).orElseThrow();
        assertThat(attempt.providerSlug()).isEqualTo("acme");
        assertThat(attempt.redirectUri()).isEqualTo("/dashboard");
        assertThat(attempt.createdAt()).isEqualTo(NOW);
        assertThat(query.getFirst("code_challenge")).isEqualTo(pkceGenerator.codeChallenge(attempt.codeVerifier()));
        assertThat(query.getFirst("nonce")).isEqualTo(attempt.nonce());
    }

    @Test
    void beginAuthorizationRejectsUnknownProvider() {
        assertThatThrownBy(() -> oidcService.beginAuthorization("nope", null))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getErrorCode()).isEqualTo(FederationError.PROVIDER_NOT_FOUND));
        assertThat(attemptStore.size()).isZero();
    }

    @Test
    void callbackIssuesTokensAndStateCannotBeReplayed() {
        attemptStore.save(new AuthorizationAttempt("state-1", "acme", "verifier-1", "nonce-1", "/dashboard", NOW.minusSeconds(30)));
        User user = TestEntities.withId(new User(), UUID.randomUUID());
        IdentityClaims claims = new IdentityClaims("https://id.acme.test", "sub-1", "dana@acme.test", true, "Dana", null, "nonce-1");
        TokenPair pair = new TokenPair("access", "refresh", 900L);

        when(providerClient.exchangeCode(ACME, "code-1", "verifier-1", CALLBACK_URL))
                .thenReturn(new TokenResponse("id-token", "provider-access", null, 300L));
        when(providerClient.verifyIdToken(ACME, "id-token")).thenReturn(claims);
        when(accountResolver.resolve(ACME, claims)).thenReturn(new ResolvedAccount(user, true, false));
        when(tokenService.issuePair(user.getId(), CLIENT)).thenReturn(pair);

        CallbackResult result = oidcService.handleCallback("acme", "code-1", "state-1", CLIENT);

        assertThat(result.user()).isSameAs(user);
        assertThat(result.newPrincipal()).isTrue();
        assertThat(result.linkedToExisting()).isFalse();
        assertThat(result.tokens()).isEqualTo(pair);
        assertThat(result.redirectUri()).isEqualTo("/dashboard");

        assertThatThrownBy(() -> oidcService.handleCallback("acme", "code-1", "state-1", CLIENT))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getErrorCode()).isEqualTo(FederationError.INVALID_STATE));
        verify(providerClient, times(1)).exchangeCode(any(), any(), any(), any());
    }

    @Test
    void expiredStateFailsWithoutContactingProvider() {
        attemptStore.save(new AuthorizationAttempt("state-1", "acme", "verifier-1", "nonce-1", null, NOW.minus(Duration.ofMinutes(11))));

        assertThatThrownBy(() -> oidcService.handleCallback("acme", "code-1", "state-1", CLIENT))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getErrorCode()).isEqualTo(FederationError.STATE_EXPIRED));
        verifyNoInteractions(providerClient);
        assertThat(attemptStore.size()).isZero();
    }

    @Test
    void stateIssuedForAnotherProviderIsRejectedAndBurned() {
        attemptStore.save(new AuthorizationAttempt("state-1", "other", "verifier-1", "nonce-1", null, NOW));

        assertThatThrownBy(() -> oidcService.handleCallback("acme", "code-1", "state-1", CLIENT))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getErrorCode()).isEqualTo(FederationError.INVALID_STATE));
        verifyNoInteractions(providerClient);
        assertThat(attemptStore.size()).isZero();
    }

    @Test
    void missingCodeIsTokenExchangeFailure() {
        attemptStore.save(new AuthorizationAttempt("state-1", "acme", "verifier-1", "nonce-1", null, NOW));

        assertThatThrownBy(() -> oidcService.handleCallback("acme", " ", "state-1", CLIENT))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getErrorCode()).isEqualTo(FederationError.TOKEN_EXCHANGE_FAILED));
        verifyNoInteractions(providerClient);
    }

    @Test
    void nonceMismatchStopsBeforeAccountResolution() {
        attemptStore.save(new AuthorizationAttempt("state-1", "acme", "verifier-1", "nonce-1", null, NOW));
        when(providerClient.exchangeCode(ACME, "code-1", "verifier-1", CALLBACK_URL))
                .thenReturn(new TokenResponse("id-token", null, null, 0L));
        when(providerClient.verifyIdToken(ACME, "id-token")).thenReturn(
                new IdentityClaims("https://id.acme.test", "sub-1", null, false, null, null, "forged-nonce"));

        assertThatThrownBy(() -> oidcService.handleCallback("acme", "code-1", "state-1", CLIENT))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getErrorCode()).isEqualTo(FederationError.NONCE_MISMATCH));
        verifyNoInteractions(accountResolver, tokenService);
    }

    @Test
    void missingNonceClaimIsMismatch() {
        attemptStore.save(new AuthorizationAttempt("state-1", "acme", "verifier-1", "nonce-1", null, NOW));
        when(providerClient.exchangeCode(ACME, "code-1", "verifier-1", CALLBACK_URL))
                .thenReturn(new TokenResponse("id-token", null, null, 0L));
        when(providerClient.verifyIdToken(ACME, "id-token")).thenReturn(
                new IdentityClaims("https://id.acme.test", "sub-1", null, false, null, null, null));

        assertThatThrownBy(() -> oidcService.handleCallback("acme", "code-1", "state-1", CLIENT))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getErrorCode()).isEqualTo(FederationError.NONCE_MISMATCH));
    }

    @Test
    void providerErrorBurnsStateAndReportsDescription() {
        attemptStore.save(new AuthorizationAttempt("state-1", "acme", "verifier-1", "nonce-1", null, NOW));

        assertThatThrownBy(() -> oidcService.rejectCallback("acme", "state-1", "access_denied", "User cancelled"))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getErrorCode()).isEqualTo(FederationError.TOKEN_EXCHANGE_FAILED);
                    assertThat(ex.getDetailMessage()).isEqualTo("access_denied: User cancelled");
                });
        assertThat(attemptStore.size()).isZero();
    }

    @Test
    void listIdentitiesSkipsProvidersNoLongerConfigured() {
        UUID userId = UUID.randomUUID();
        OffsetDateTime linkedAt = OffsetDateTime.of(2025, 1, 10, 9, 0, 0, 0, ZoneOffset.UTC);
        when(identityRepository.findByUserIdOrderByCreatedAtAsc(userId)).thenReturn(List.of(
                identity(userId, "https://id.acme.test", "dana@acme.test", linkedAt),
                identity(userId, "https://retired.example", "dana@retired.example", linkedAt)
        ));

        List<LinkedIdentity> identities = oidcService.listIdentities(userId);

        assertThat(identities).containsExactly(new LinkedIdentity("acme", "Acme ID", "dana@acme.test", linkedAt));
    }

    @Test
    void unlinkWithoutIdentityIsNotFound() {
        UUID userId = UUID.randomUUID();
        when(identityRepository.deleteByUserIdAndIssuer(userId, "https://id.acme.test")).thenReturn(0);

        assertThatThrownBy(() -> oidcService.unlink(userId, "acme"))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getErrorCode()).isEqualTo(FederationError.IDENTITY_NOT_FOUND));
        verify(auditLogService, never()).record(any());
    }

    @Test
    void unlinkRecordsAudit() {
        UUID userId = UUID.randomUUID();
        when(identityRepository.deleteByUserIdAndIssuer(userId, "https://id.acme.test")).thenReturn(1);

        oidcService.unlink(userId, "acme");

        verify(auditLogService).record(any());
    }

    private static OidcIdentity identity(UUID userId, String issuer, String email, OffsetDateTime createdAt) {
        OidcIdentity identity = new OidcIdentity();
        identity.setUserId(userId);
        identity.setIssuer(issuer);
        identity.setSubject("sub-" + email);
        identity.setEmail(email);
        return TestEntities.withCreatedAt(identity, createdAt);
    }
}
