package com.kaimu.backend.modules.oidc.infrastructure.config;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.oidc")
public record OidcProperties(
        @NotBlank String callbackBaseUrl,
        @NotNull @DefaultValue("PT10M") Duration stateTtl,
        @NotNull @DefaultValue("PT5M") Duration stateSweepInterval,
        @NotNull @DefaultValue("PT10S") Duration httpTimeout,
        @Valid List<Provider> providers
) {

    public OidcProperties {
        providers = providers == null ? List.of() : List.copyOf(providers);
    }

    public Optional<Provider> findProvider(String slug) {
        return providers.stream().filter(provider -> provider.slug().equals(slug)).findFirst();
    }

    public Optional<Provider> findProviderByIssuer(String issuer) {
        return providers.stream().filter(provider -> provider.issuerUrl().equals(issuer)).findFirst();
    }

    public String callbackUrl(Provider provider) {
        return stripTrailingSlash(callbackBaseUrl) + "/auth/oidc/" + provider.slug() + "/callback";
    }

    public static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    /**
     * One configured provider. When {@code discoveryUrl} is set, the backend reaches the provider
     * through that base URL while browsers keep using {@code issuerUrl}.
     */
    public record Provider(
            @NotBlank String slug,
            @NotBlank String name,
            @NotBlank String issuerUrl,
            String discoveryUrl,
            @NotBlank String clientId,
            String clientSecret,
            @DefaultValue("openid email profile") String scopes
    ) {

        public boolean hasDiscoveryOverride() {
            return discoveryUrl != null && !discoveryUrl.isBlank();
        }

        public String discoveryBaseUrl() {
            return stripTrailingSlash(hasDiscoveryOverride() ? discoveryUrl : issuerUrl);
        }

        public List<String> scopeList() {
            String raw = scopes == null || scopes.isBlank() ? "openid email profile" : scopes;
            return Arrays.stream(raw.trim().split("[\\s,]+")).filter(scope -> !scope.isBlank()).toList();
        }
    }
}
