package com.contactsbook.backend.global.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.contactsbook.backend.modules.auth.application.DenylistFailurePolicy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.stereotype.Component;

/**
 * Checks the required configuration once the context is up and aborts startup with a single
 * report listing every missing or invalid key.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    static final String PLACEHOLDER_SECRET = "change-me-dev-only-secret-key-0123456789abcdef";

    private static final String[] REQUIRED_KEYS = {
            "spring.datasource.url",
            "spring.data.redis.url",
            "jwt.secret",
            "jwt.access-token-ttl",
            "jwt.refresh-token-ttl"
    };

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = validate();
        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Configuration problem: {}", problem));
            throw new IllegalStateException("Invalid configuration: " + String.join("; ", problems));
        }
        log.info("Configuration validated");
    }

    List<String> validate() {
        List<String> problems = new ArrayList<>();

        for (String key : REQUIRED_KEYS) {
            Optional<String> value = Optional.ofNullable(environment.getProperty(key));
            if (value.map(String::trim).orElse("").isEmpty()) {
                problems.add(key + " is missing");
            }
        }

        if (PLACEHOLDER_SECRET.equals(environment.getProperty("jwt.secret"))
                && environment.acceptsProfiles(Profiles.of("prod"))) {
            problems.add("jwt.secret still uses the development placeholder");
        }

        checkRange(problems, "jwt.access-token-ttl", 1, 24 * 60, "minutes");
        checkRange(problems, "jwt.refresh-token-ttl", 1, 365, "days");

        String policy = environment.getProperty("auth.cache.denylist-failure-policy");
        if (policy != null) {
            try {
                DenylistFailurePolicy.valueOf(policy.trim());
            } catch (IllegalArgumentException e) {
                problems.add("auth.cache.denylist-failure-policy must be FAIL_OPEN or FAIL_CLOSED");
            }
        }
        return problems;
    }

    private void checkRange(List<String> problems, String key, long min, long max, String unit) {
        String raw = environment.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return;
        }
        try {
            long value = Long.parseLong(raw.trim());
            if (value < min || value > max) {
                problems.add(key + " must be between " + min + " and " + max + " " + unit);
            }
        } catch (NumberFormatException e) {
            problems.add(key + " must be a number of " + unit);
        }
    }
}
