package com.kaimu.backend.modules.oidc.application;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import com.kaimu.backend.modules.oidc.domain.AuthorizationAttempt;

import jakarta.annotation.PreDestroy;

import org.springframework.stereotype.Component;

/**
 * In-memory table of pending authorization attempts.
 * {@link #consume(String)} reads and deletes in one atomic step so a state token can be redeemed at most once.
 */
@Component
public class AuthorizationAttemptStore {

    private final Map<String, AuthorizationAttempt> attempts = new ConcurrentHashMap<>();

    public void save(AuthorizationAttempt attempt) {
        attempts.put(attempt.state(), attempt);
    }

    public Optional<AuthorizationAttempt> consume(String state) {
        if (state == null || state.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(attempts.remove(state));
    }

    public int sweepExpired(Instant now, Duration ttl) {
        int before = attempts.size();
        attempts.values().removeIf(attempt -> attempt.isExpired(now, ttl));
        return Math.max(0, before - attempts.size());
    }

    public int size() {
        return attempts.size();
    }

    @PreDestroy
    void clear() {
        attempts.clear();
    }
}
