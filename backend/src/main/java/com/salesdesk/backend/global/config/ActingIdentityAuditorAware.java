package com.salesdesk.backend.global.config;

import java.util.Optional;
import java.util.UUID;

import com.salesdesk.backend.global.security.AccountPrincipal;
import com.salesdesk.backend.global.security.ActingIdentityContext;

import org.springframework.data.domain.AuditorAware;
import org.springframework.lang.NonNull;

/**
 * Resolves the current auditor (acting account id) for JPA auditing.
 * Falls back to {@code Optional.empty()} when no acting identity has been established.
 */
public class ActingIdentityAuditorAware implements AuditorAware<UUID> {

    private final ActingIdentityContext actingIdentityContext;

    public ActingIdentityAuditorAware(ActingIdentityContext actingIdentityContext) {
        this.actingIdentityContext = actingIdentityContext;
    }

    @Override
    @NonNull
    public Optional<UUID> getCurrentAuditor() {
        return actingIdentityContext.current().map(AccountPrincipal::accountId);
    }
}
