package com.kaimu.backend.modules.oidc.application;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

import com.kaimu.backend.global.error.ProblemException;
import com.kaimu.backend.modules.audit.application.AuditLogService;
import com.kaimu.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.kaimu.backend.modules.audit.domain.AuditAction;
import com.kaimu.backend.modules.auth.domain.User;
import com.kaimu.backend.modules.auth.infrastructure.persistence.UserRepository;
import com.kaimu.backend.modules.oidc.domain.FederationError;
import com.kaimu.backend.modules.oidc.domain.IdentityClaims;
import com.kaimu.backend.modules.oidc.domain.OidcIdentity;
import com.kaimu.backend.modules.oidc.infrastructure.config.OidcProperties.Provider;
import com.kaimu.backend.modules.oidc.infrastructure.persistence.OidcIdentityRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Maps a verified external identity to a local user. Rules are applied in order:
 * <ol>
 *     <li>a known (issuer, subject) logs in as its owner and syncs changed profile fields;</li>
 *     <li>a provider-verified email matching a local user's verified email links a new identity to that user;</li>
 *     <li>otherwise a new user and identity are created.</li>
 * </ol>
 * An unverified email never links to an existing account, and never overwrites a user's email.
 */
@Service
public class OidcAccountResolver {

    private static final Logger log = LoggerFactory.getLogger(OidcAccountResolver.class);

    private static final int USERNAME_ATTEMPTS = 5;
    private static final int USERNAME_BASE_MAX_LENGTH = 40;

    private final OidcIdentityRepository identityRepository;
    private final UserRepository userRepository;
    private final AuditLogService auditLogService;

    public OidcAccountResolver(
            OidcIdentityRepository identityRepository,
            UserRepository userRepository,
            AuditLogService auditLogService
    ) {
        this.identityRepository = identityRepository;
        this.userRepository = userRepository;
        this.auditLogService = auditLogService;
    }

    @Transactional
    public ResolvedAccount resolve(Provider provider, IdentityClaims claims) {
        Optional<OidcIdentity> existing = identityRepository.findByIssuerAndSubject(provider.issuerUrl(), claims.subject());
        if (existing.isPresent()) {
            return loginExisting(existing.get(), claims);
        }

        if (claims.hasVerifiedEmail()) {
            Optional<User> owner = userRepository.findFirstByEmailIgnoreCaseAndEmailVerifiedTrueOrderByCreatedAtAsc(claims.email());
            if (owner.isPresent()) {
                return linkToExisting(owner.get(), provider, claims);
            }
        }

        return createPrincipal(provider, claims);
    }

    private ResolvedAccount loginExisting(OidcIdentity identity, IdentityClaims claims) {
        User user = userRepository.findById(identity.getUserId())
                .orElseThrow(() -> new ProblemException(FederationError.IDENTITY_LINK_FAILED,
                        "Identity references a missing user"));

        boolean userChanged = false;
        // Only a provider-verified address replaces the stored email.
        if (claims.hasVerifiedEmail()
                && (!claims.email().equals(user.getEmail()) || !user.isEmailVerified())) {
            user.setEmail(claims.email());
            user.setEmailVerified(true);
            userChanged = true;
        }
        if (claims.name() != null && !claims.name().equals(user.getDisplayName())) {
            user.setDisplayName(claims.name());
            userChanged = true;
        }
        if (claims.picture() != null && !claims.picture().equals(user.getAvatarUrl())) {
            user.setAvatarUrl(claims.picture());
            userChanged = true;
        }
        if (userChanged) {
            userRepository.save(user);
        }

        if (!Objects.equals(identity.getEmail(), claims.email()) || identity.isEmailVerified() != claims.emailVerified()) {
            identity.setEmail(claims.email());
            identity.setEmailVerified(claims.emailVerified());
            identityRepository.save(identity);
        }
        return new ResolvedAccount(user, false, false);
    }

    private ResolvedAccount linkToExisting(User user, Provider provider, IdentityClaims claims) {
        persistIdentity(user.getId(), provider, claims);

        boolean userChanged = false;
        if (claims.name() != null && user.getDisplayName() == null) {
            user.setDisplayName(claims.name());
            userChanged = true;
        }
        if (claims.picture() != null && user.getAvatarUrl() == null) {
            user.setAvatarUrl(claims.picture());
            userChanged = true;
        }
        if (userChanged) {
            userRepository.save(user);
        }

        log.info("Linked {} identity to existing user {} by verified email", provider.slug(), user.getId());
        recordLink(user.getId(), provider, "verified_email");
        return new ResolvedAccount(user, false, true);
    }

    private ResolvedAccount createPrincipal(Provider provider, IdentityClaims claims) {
        User user = new User();
        user.setUsername(uniqueUsername(claims));
        user.setEmail(claims.email());
        user.setEmailVerified(claims.hasVerifiedEmail());
        user.setDisplayName(claims.name());
        user.setAvatarUrl(claims.picture());
        try {
            user = userRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException ex) {
            throw new ProblemException(FederationError.PRINCIPAL_CREATION_FAILED, null, ex);
        }

        persistIdentity(user.getId(), provider, claims);
        log.info("Created user {} from {} identity", user.getId(), provider.slug());
        recordLink(user.getId(), provider, "new_user");
        return new ResolvedAccount(user, true, false);
    }

    private void persistIdentity(UUID userId, Provider provider, IdentityClaims claims) {
        OidcIdentity identity = new OidcIdentity();
        identity.setUserId(userId);
        identity.setIssuer(provider.issuerUrl());
        identity.setSubject(claims.subject());
        identity.setEmail(claims.email());
        identity.setEmailVerified(claims.emailVerified());
        try {
            identityRepository.saveAndFlush(identity);
        } catch (DataIntegrityViolationException ex) {
            throw new ProblemException(FederationError.IDENTITY_LINK_FAILED, null, ex);
        }
    }

    private void recordLink(UUID userId, Provider provider, String reason) {
        Map<String, Object> detail = new HashMap<>();
        detail.put("provider", provider.slug());
        detail.put("reason", reason);
        auditLogService.record(AuditLogCommand.of(AuditAction.OIDC_IDENTITY_LINKED, "user", userId, userId, detail));
    }

    String uniqueUsername(IdentityClaims claims) {
        String base = usernameBase(claims);
        for (int attempt = 0; attempt < USERNAME_ATTEMPTS; attempt++) {
            String candidate = base + "_" + randomSuffix();
            if (!userRepository.existsByUsername(candidate)) {
                return candidate;
            }
        }
        throw new ProblemException(FederationError.PRINCIPAL_CREATION_FAILED, "Could not derive a free username");
    }

    static String usernameBase(IdentityClaims claims) {
        if (claims.email() != null) {
            int at = claims.email().indexOf('@');
            String local = at >= 0 ? claims.email().substring(0, at) : claims.email();
            if (!local.isBlank()) {
                return truncate(local.trim());
            }
        }
        if (claims.name() != null && !claims.name().isBlank()) {
            return truncate(claims.name().trim().toLowerCase(Locale.ROOT).replace(" ", "_"));
        }
        return "user";
    }

    private static String truncate(String value) {
        return value.length() > USERNAME_BASE_MAX_LENGTH ? value.substring(0, USERNAME_BASE_MAX_LENGTH) : value;
    }

    private static String randomSuffix() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    public record ResolvedAccount(User user, boolean newPrincipal, boolean linkedToExisting) {
    }
}
