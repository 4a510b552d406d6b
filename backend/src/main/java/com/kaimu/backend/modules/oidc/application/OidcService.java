package com.kaimu.backend.modules.oidc.application;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.kaimu.backend.global.error.ProblemException;
import com.kaimu.backend.modules.audit.application.AuditLogService;
import com.kaimu.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.kaimu.backend.modules.audit.domain.AuditAction;
import com.kaimu.backend.modules.auth.application.TokenPair;
import com.kaimu.backend.modules.auth.application.TokenService;
import com.kaimu.backend.modules.auth.domain.ClientMetadata;
import com.kaimu.backend.modules.auth.domain.User;
import com.kaimu.backend.modules.oidc.application.OidcAccountResolver.ResolvedAccount;
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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Authorization Code + PKCE login against configured OIDC providers.
 * Attempt lifecycle: pending after {@link #beginAuthorization}, then consumed by exactly one callback or swept on expiry.
 */
@Service
public class OidcService {

    private static final Logger log = LoggerFactory.getLogger(OidcService.class);

    private final OidcProperties properties;
    private final OidcProviderClient providerClient;
    private final AuthorizationAttemptStore attemptStore;
    private final PkceGenerator pkceGenerator;
    private final OidcAccountResolver accountResolver;
    private final OidcIdentityRepository identityRepository;
    private final TokenService tokenService;
    private final AuditLogService auditLogService;
    private final Clock clock;

    public OidcService(
            OidcProperties properties,
            OidcProviderClient providerClient,
            AuthorizationAttemptStore attemptStore,
            PkceGenerator pkceGenerator,
            OidcAccountResolver accountResolver,
            OidcIdentityRepository identityRepository,
            TokenService tokenService,
            AuditLogService auditLogService,
            Clock clock
    ) {
        this.properties = properties;
        this.providerClient = providerClient;
        this.attemptStore = attemptStore;
        this.pkceGenerator = pkceGenerator;
        this.accountResolver = accountResolver;
        this.identityRepository = identityRepository;
        this.tokenService = tokenService;
        this.auditLogService = auditLogService;
        this.clock = clock;
    }

    public List<ProviderSummary> listProviders() {
        return properties.providers().stream()
                .map(provider -> new ProviderSummary(provider.slug(), provider.name()))
                .toList();
    }

    public AuthorizationStart beginAuthorization(String providerSlug, String redirectUri) {
        Provider provider = requireProvider(providerSlug);
        ProviderMetadata metadata = providerClient.metadata(provider);

        String state = pkceGenerator.randomToken();
        String codeVerifier = pkceGenerator.randomToken();
        String nonce = pkceGenerator.randomToken();
        attemptStore.save(new AuthorizationAttempt(state, provider.slug(), codeVerifier, nonce, redirectUri, clock.instant()));

        String authUrl = UriComponentsBuilder.fromUriString(metadata.authorizationEndpoint())
                .queryParam("response_type", "code")
                .queryParam("client_id", provider.clientId())
                .queryParam("redirect_uri", properties.callbackUrl(provider))
                .queryParam("scope", String.join(" ", provider.scopeList()))
                .queryParam("state", state)
                .queryParam("code_challenge", pkceGenerator.codeChallenge(codeVerifier))
                .queryParam("code_challenge_method", "S256")
                .queryParam("nonce", nonce)
                .encode()
                .build()
                .toUriString();
        return new AuthorizationStart(authUrl, state);
    }

    /**
     * Completes a login. The attempt is removed before any network call, so a state token can never be replayed,
     * even when this call fails or is abandoned midway.
     */
    public CallbackResult handleCallback(String providerSlug, String code, String state, ClientMetadata clientMetadata) {
        AuthorizationAttempt attempt = consumeAttempt(providerSlug, state);
        Provider provider = requireProvider(providerSlug);

        if (code == null || code.isBlank()) {
            throw new ProblemException(FederationError.TOKEN_EXCHANGE_FAILED, "Authorization code is missing");
        }

        TokenResponse tokens = providerClient.exchangeCode(provider, code, attempt.codeVerifier(), properties.callbackUrl(provider));
        IdentityClaims claims = providerClient.verifyIdToken(provider, tokens.idToken());

        if (claims.nonce() == null || !MessageDigest.isEqual(
                claims.nonce().getBytes(StandardCharsets.UTF_8), attempt.nonce().getBytes(StandardCharsets.UTF_8))) {
            log.warn("Nonce mismatch on {} callback for subject {}", provider.slug(), claims.subject());
            throw new ProblemException(FederationError.NONCE_MISMATCH);
        }

        ResolvedAccount account = accountResolver.resolve(provider, claims);
        TokenPair pair = tokenService.issuePair(account.user().getId(), clientMetadata);
        return new CallbackResult(account.user(), account.newPrincipal(), account.linkedToExisting(), pair, attempt.redirectUri());
    }

    /**
     * Provider redirected back with an error instead of a code. The attempt is burned either way.
     */
    public void rejectCallback(String providerSlug, String state, String error, String errorDescription) {
        attemptStore.consume(state);
        requireProvider(providerSlug);
        log.warn("Provider {} returned error {} on callback", providerSlug, error);
        String detail = errorDescription != null && !errorDescription.isBlank() ? error + ": " + errorDescription : error;
        throw new ProblemException(FederationError.TOKEN_EXCHANGE_FAILED, detail);
    }

    @Transactional(readOnly = true)
    public List<LinkedIdentity> listIdentities(UUID userId) {
        List<LinkedIdentity> result = new ArrayList<>();
        for (OidcIdentity identity : identityRepository.findByUserIdOrderByCreatedAtAsc(userId)) {
            Optional<Provider> provider = properties.findProviderByIssuer(identity.getIssuer());
            if (provider.isEmpty()) {
                continue;
            }
            result.add(new LinkedIdentity(provider.get().slug(), provider.get().name(), identity.getEmail(), identity.getCreatedAt()));
        }
        return result;
    }

    @Transactional
    public void unlink(UUID userId, String providerSlug) {
        Provider provider = requireProvider(providerSlug);
        int removed = identityRepository.deleteByUserIdAndIssuer(userId, provider.issuerUrl());
        if (removed == 0) {
            throw new ProblemException(FederationError.IDENTITY_NOT_FOUND);
        }
        Map<String, Object> detail = new HashMap<>();
        detail.put("provider", provider.slug());
        auditLogService.record(AuditLogCommand.of(AuditAction.OIDC_IDENTITY_UNLINKED, "user", userId, userId, detail));
    }

    private AuthorizationAttempt consumeAttempt(String providerSlug, String state) {
        AuthorizationAttempt attempt = attemptStore.consume(state)
                .orElseThrow(() -> new ProblemException(FederationError.INVALID_STATE));
        Instant now = clock.instant();
        if (attempt.isExpired(now, properties.stateTtl())) {
            throw new ProblemException(FederationError.STATE_EXPIRED);
        }
        if (!attempt.providerSlug().equals(providerSlug)) {
            log.warn("State issued for {} presented on {} callback", attempt.providerSlug(), providerSlug);
            throw new ProblemException(FederationError.INVALID_STATE);
        }
        return attempt;
    }

    private Provider requireProvider(String providerSlug) {
        return properties.findProvider(providerSlug)
                .orElseThrow(() -> new ProblemException(FederationError.PROVIDER_NOT_FOUND));
    }

    public record ProviderSummary(String slug, String name) {
    }

    public record AuthorizationStart(String authUrl, String state) {
    }

    public record CallbackResult(User user, boolean newPrincipal, boolean linkedToExisting, TokenPair tokens, String redirectUri) {
    }

    public record LinkedIdentity(String providerSlug, String providerName, String email, OffsetDateTime linkedAt) {
    }
}
