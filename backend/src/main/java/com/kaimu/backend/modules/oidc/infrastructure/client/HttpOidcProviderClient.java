package com.kaimu.backend.modules.oidc.infrastructure.client;

import java.text.ParseException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import com.kaimu.backend.global.error.ProblemException;
import com.kaimu.backend.modules.oidc.domain.FederationError;
import com.kaimu.backend.modules.oidc.domain.IdentityClaims;
import com.kaimu.backend.modules.oidc.infrastructure.config.OidcProperties;
import com.kaimu.backend.modules.oidc.infrastructure.config.OidcProperties.Provider;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.jwk.JWKSet;
import com.nimbusds.jose.jwk.source.ImmutableJWKSet;
import com.nimbusds.jose.proc.JWSVerificationKeySelector;
import com.nimbusds.jose.proc.SecurityContext;
import com.nimbusds.jwt.proc.DefaultJWTProcessor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.security.oauth2.core.DelegatingOAuth2TokenValidator;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtClaimNames;
import org.springframework.security.oauth2.jwt.JwtClaimValidator;
import org.springframework.security.oauth2.jwt.JwtException;
import org.springframework.security.oauth2.jwt.JwtValidators;
import org.springframework.security.oauth2.jwt.NimbusJwtDecoder;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

@Component
public class HttpOidcProviderClient implements OidcProviderClient {

    private static final Logger log = LoggerFactory.getLogger(HttpOidcProviderClient.class);

    private static final String DISCOVERY_PATH = "/.well-known/openid-configuration";

    private final RestClient restClient;
    private final Map<String, ProviderMetadata> metadataCache = new ConcurrentHashMap<>();
    private final Map<String, NimbusJwtDecoder> decoderCache = new ConcurrentHashMap<>();

    @Autowired
    public HttpOidcProviderClient(RestClient.Builder restClientBuilder, OidcProperties properties) {
        this(restClientBuilder.requestFactory(timeoutRequestFactory(properties.httpTimeout())).build());
    }

    HttpOidcProviderClient(RestClient restClient) {
        this.restClient = restClient;
    }

    private static SimpleClientHttpRequestFactory timeoutRequestFactory(Duration timeout) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout((int) timeout.toMillis());
        factory.setReadTimeout((int) timeout.toMillis());
        return factory;
    }

    @Override
    public ProviderMetadata metadata(Provider provider) {
        ProviderMetadata cached = metadataCache.get(provider.slug());
        if (cached != null) {
            return cached;
        }
        ProviderMetadata fetched = fetchMetadata(provider);
        metadataCache.put(provider.slug(), fetched);
        return fetched;
    }

    @Override
    public TokenResponse exchangeCode(Provider provider, String code, String codeVerifier, String redirectUri) {
        ProviderMetadata metadata = metadata(provider);

        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("grant_type", "authorization_code");
        form.add("code", code);
        form.add("redirect_uri", redirectUri);
        form.add("client_id", provider.clientId());
        form.add("code_verifier", codeVerifier);
        if (provider.clientSecret() != null && !provider.clientSecret().isBlank()) {
            form.add("client_secret", provider.clientSecret());
        }

        TokenEndpointResponse response;
        try {
            response = restClient.post()
                    .uri(metadata.tokenEndpoint())
                    .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                    .accept(MediaType.APPLICATION_JSON)
                    .body(form)
                    .retrieve()
                    .body(TokenEndpointResponse.class);
        } catch (ResourceAccessException ex) {
            throw new ProblemException(FederationError.PROVIDER_UNAVAILABLE,
                    "Token endpoint of " + provider.slug() + " did not respond", ex);
        } catch (RestClientResponseException ex) {
            log.warn("Token exchange with {} rejected: status={}", provider.slug(), ex.getStatusCode().value());
            throw new ProblemException(FederationError.TOKEN_EXCHANGE_FAILED, null, ex);
        } catch (RestClientException ex) {
            throw new ProblemException(FederationError.TOKEN_EXCHANGE_FAILED, null, ex);
        }

        if (response == null || response.idToken() == null || response.idToken().isBlank()) {
            throw new ProblemException(FederationError.INVALID_ID_TOKEN, "Token response carried no id_token");
        }
        long expiresIn = response.expiresIn() != null ? response.expiresIn() : 0L;
        return new TokenResponse(response.idToken(), response.accessToken(), response.refreshToken(), expiresIn);
    }

    @Override
    public IdentityClaims verifyIdToken(Provider provider, String idToken) {
        NimbusJwtDecoder decoder = decoderCache.computeIfAbsent(provider.slug(), slug -> buildDecoder(provider));
        Jwt jwt;
        try {
            jwt = decoder.decode(idToken);
        } catch (JwtException ex) {
            // Next login refetches the key set in case the provider rotated its keys.
            decoderCache.remove(provider.slug());
            throw new ProblemException(FederationError.INVALID_ID_TOKEN, ex.getMessage(), ex);
        }

        if (jwt.getSubject() == null || jwt.getSubject().isBlank()) {
            throw new ProblemException(FederationError.INVALID_ID_TOKEN, "ID token has no subject");
        }
        Boolean emailVerified = jwt.getClaimAsBoolean("email_verified");
        return new IdentityClaims(
                provider.issuerUrl(),
                jwt.getSubject(),
                blankToNull(jwt.getClaimAsString("email")),
                Boolean.TRUE.equals(emailVerified),
                blankToNull(jwt.getClaimAsString("name")),
                blankToNull(jwt.getClaimAsString("picture")),
                jwt.getClaimAsString("nonce")
        );
    }

    private ProviderMetadata fetchMetadata(Provider provider) {
        DiscoveryDocument document;
        try {
            document = restClient.get()
                    .uri(provider.discoveryBaseUrl() + DISCOVERY_PATH)
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .body(DiscoveryDocument.class);
        } catch (RestClientException ex) {
            throw new ProblemException(FederationError.PROVIDER_UNAVAILABLE,
                    "Discovery failed for " + provider.slug(), ex);
        }
        if (document == null || document.authorizationEndpoint() == null || document.tokenEndpoint() == null
                || document.jwksUri() == null) {
            throw new ProblemException(FederationError.PROVIDER_UNAVAILABLE,
                    "Discovery document of " + provider.slug() + " is incomplete");
        }
        if (document.issuer() != null && !OidcProperties.stripTrailingSlash(document.issuer())
                .equals(OidcProperties.stripTrailingSlash(provider.issuerUrl()))) {
            throw new ProblemException(FederationError.PROVIDER_UNAVAILABLE,
                    "Discovery issuer " + document.issuer() + " does not match " + provider.issuerUrl());
        }

        String tokenEndpoint = document.tokenEndpoint();
        String jwksUri = document.jwksUri();
        if (provider.hasDiscoveryOverride()) {
            // Back-channel calls go through the discovery host; the browser keeps the public authorization URL.
            tokenEndpoint = rewriteHost(tokenEndpoint, provider);
            jwksUri = rewriteHost(jwksUri, provider);
        }
        log.info("Loaded OIDC metadata for provider {}", provider.slug());
        return new ProviderMetadata(provider.issuerUrl(), document.authorizationEndpoint(), tokenEndpoint, jwksUri);
    }

    static String rewriteHost(String endpoint, Provider provider) {
        String issuer = OidcProperties.stripTrailingSlash(provider.issuerUrl());
        if (endpoint.startsWith(issuer)) {
            return provider.discoveryBaseUrl() + endpoint.substring(issuer.length());
        }
        return endpoint;
    }

    private NimbusJwtDecoder buildDecoder(Provider provider) {
        ProviderMetadata metadata = metadata(provider);
        JWKSet jwkSet;
        try {
            String body = restClient.get()
                    .uri(metadata.jwksUri())
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .body(String.class);
            if (body == null) {
                throw new ProblemException(FederationError.PROVIDER_UNAVAILABLE,
                        "Key set of " + provider.slug() + " is empty");
            }
            jwkSet = JWKSet.parse(body);
        } catch (RestClientException ex) {
            throw new ProblemException(FederationError.PROVIDER_UNAVAILABLE,
                    "Key set of " + provider.slug() + " could not be fetched", ex);
        } catch (ParseException ex) {
            throw new ProblemException(FederationError.PROVIDER_UNAVAILABLE,
                    "Key set of " + provider.slug() + " is malformed", ex);
        }

        DefaultJWTProcessor<SecurityContext> processor = new DefaultJWTProcessor<>();
        processor.setJWSKeySelector(new JWSVerificationKeySelector<>(
                Set.of(JWSAlgorithm.RS256, JWSAlgorithm.RS384, JWSAlgorithm.RS512,
                        JWSAlgorithm.ES256, JWSAlgorithm.ES384, JWSAlgorithm.ES512),
                new ImmutableJWKSet<>(jwkSet)));
        // Claim checks are done by the Spring validators below.
        processor.setJWTClaimsSetVerifier((claims, context) -> {
        });

        NimbusJwtDecoder decoder = new NimbusJwtDecoder(processor);
        JwtClaimValidator<List<String>> audienceValidator = new JwtClaimValidator<>(
                JwtClaimNames.AUD, audience -> audience != null && audience.contains(provider.clientId()));
        decoder.setJwtValidator(new DelegatingOAuth2TokenValidator<>(
                JwtValidators.createDefaultWithIssuer(provider.issuerUrl()),
                audienceValidator));
        return decoder;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record DiscoveryDocument(
            @JsonProperty("issuer") String issuer,
            @JsonProperty("authorization_endpoint") String authorizationEndpoint,
            @JsonProperty("token_endpoint") String tokenEndpoint,
            @JsonProperty("jwks_uri") String jwksUri
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record TokenEndpointResponse(
            @JsonProperty("id_token") String idToken,
            @JsonProperty("access_token") String accessToken,
            @JsonProperty("refresh_token") String refreshToken,
            @JsonProperty("expires_in") Long expiresIn
    ) {
    }
}
