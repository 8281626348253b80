package com.salesdesk.backend.global.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * 애플리케이션 시작 시 필수 설정값 검증. 누락되거나 잘못된 값이 있으면 기동을 중단한다.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    private static final Set<String> AUTH_METHODS = Set.of("ldap", "local");
    private static final long MIN_TOKEN_EXPIRATION_MILLIS = 300_000L;
    private static final long MAX_TOKEN_EXPIRATION_MILLIS = 86_400_000L;

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = validate();
        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Configuration check failed: {}", problem));
            throw new IllegalStateException("Invalid configuration: " + String.join("; ", problems));
        }
        log.info("Configuration check passed (auth method: {})", environment.getProperty("app.auth.method"));
    }

    List<String> validate() {
        List<String> problems = new ArrayList<>();

        for (String key : List.of("spring.datasource.url", "app.auth.token.secret", "app.auth.method")) {
            if (property(key).isEmpty()) {
                problems.add(key + " is missing");
            }
        }

        property("app.auth.method")
                .filter(method -> !AUTH_METHODS.contains(method))
                .ifPresent(method -> problems.add("app.auth.method must be one of " + AUTH_METHODS + " but was " + method));

        property("app.auth.token.expiration").ifPresent(raw -> {
            try {
                long expiration = Long.parseLong(raw);
                if (expiration < MIN_TOKEN_EXPIRATION_MILLIS || expiration > MAX_TOKEN_EXPIRATION_MILLIS) {
                    problems.add("app.auth.token.expiration must be within 300000-86400000 ms");
                }
            } catch (NumberFormatException e) {
                problems.add("app.auth.token.expiration must be a number");
            }
        });

        if (property("app.auth.method").filter("ldap"::equals).isPresent()
                && property("app.auth.ldap.username").isPresent()
                && property("app.auth.ldap.password").isEmpty()) {
            problems.add("app.auth.ldap.password is required when app.auth.ldap.username is set");
        }
        return problems;
    }

    private Optional<String> property(String key) {
        return Optional.ofNullable(environment.getProperty(key))
                .map(String::trim)
                .filter(value -> !value.isEmpty());
    }
}
