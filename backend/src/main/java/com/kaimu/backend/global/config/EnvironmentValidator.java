package com.kaimu.backend.global.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.stereotype.Component;

/**
 * Checks required configuration once the application is ready and refuses to keep running
 * when a key is missing or out of range.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    static final String DEVELOPMENT_SECRET = "dev-jwt-secret-key-change-in-production-kaimu-2025";

    private static final String[] REQUIRED_KEYS = {
            "spring.datasource.url",
            "jwt.secret",
            "jwt.expiration",
            "jwt.refresh-expiration",
            "app.oidc.callback-base-url"
    };

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = collectProblems();
        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Configuration problem: {}", problem));
            throw new IllegalStateException("Environment validation failed: " + String.join("; ", problems));
        }
        log.info("Environment validation passed");
    }

    List<String> collectProblems() {
        List<String> problems = new ArrayList<>();

        for (String key : REQUIRED_KEYS) {
            Optional<String> value = Optional.ofNullable(environment.getProperty(key));
            if (value.map(String::trim).orElse("").isEmpty()) {
                problems.add(key + " is missing");
            }
        }

        boolean production = environment.acceptsProfiles(Profiles.of("prod"));
        Optional<String> secret = Optional.ofNullable(environment.getProperty("jwt.secret"));
        if (production && secret.filter(DEVELOPMENT_SECRET::equals).isPresent()) {
            problems.add("jwt.secret: replace the development default with a random value");
        }

        Long accessTtl = parseMillis("jwt.expiration", problems);
        if (accessTtl != null && (accessTtl < 60_000L || accessTtl > 86_400_000L)) {
            problems.add("jwt.expiration: must be between 60000 and 86400000 milliseconds");
        }

        Long refreshTtl = parseMillis("jwt.refresh-expiration", problems);
        if (accessTtl != null && refreshTtl != null && refreshTtl <= accessTtl) {
            problems.add("jwt.refresh-expiration: must be longer than jwt.expiration");
        }
        return problems;
    }

    private Long parseMillis(String key, List<String> problems) {
        String raw = environment.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            problems.add(key + ": must be a number of milliseconds");
            return null;
        }
    }
}
