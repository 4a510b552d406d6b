package com.kaimu.backend.modules.oidc.application;

import java.time.Clock;

import com.kaimu.backend.modules.oidc.infrastructure.config.OidcProperties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class AuthorizationAttemptSweeper {

    private static final Logger log = LoggerFactory.getLogger(AuthorizationAttemptSweeper.class);

    private final AuthorizationAttemptStore attemptStore;
    private final OidcProperties properties;
    private final Clock clock;

    public AuthorizationAttemptSweeper(AuthorizationAttemptStore attemptStore, OidcProperties properties, Clock clock) {
        this.attemptStore = attemptStore;
        this.properties = properties;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${app.oidc.state-sweep-interval:PT5M}")
    public void sweepExpiredAttempts() {
        int removed = attemptStore.sweepExpired(clock.instant(), properties.stateTtl());
        if (removed > 0) {
            log.info("Discarded {} abandoned OIDC authorization attempts", removed);
        }
    }
}
