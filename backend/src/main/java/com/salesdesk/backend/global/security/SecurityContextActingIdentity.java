package com.salesdesk.backend.global.security;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

import com.salesdesk.backend.modules.auth.domain.Account;

import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;

/**
 * {@link ActingIdentityContext} stored in Spring Security's thread-bound {@link SecurityContextHolder}.
 */
@Component
public class SecurityContextActingIdentity implements ActingIdentityContext {

    private static final String ROLE_PREFIX = "ROLE_";

    @Override
    public void actAs(Account account) {
        AccountPrincipal principal = new AccountPrincipal(account.getId(), account.getUserName(), account.getType());
        UsernamePasswordAuthenticationToken authentication = UsernamePasswordAuthenticationToken.authenticated(
                principal,
                null,
                List.of(new SimpleGrantedAuthority(ROLE_PREFIX + account.getType().name()))
        );
        SecurityContext context = SecurityContextHolder.createEmptyContext();
        context.setAuthentication(authentication);
        SecurityContextHolder.setContext(context);
    }

    @Override
    public Optional<AccountPrincipal> current() {
        return SecurityUtils.findCurrentPrincipal();
    }

    @Override
    public void clear() {
        SecurityContextHolder.clearContext();
    }

    @Override
    public <T> T scoped(Supplier<T> work) {
        Authentication previous = SecurityContextHolder.getContext().getAuthentication();
        try {
            return work.get();
        } finally {
            if (previous == null) {
                SecurityContextHolder.clearContext();
            } else {
                SecurityContext context = SecurityContextHolder.createEmptyContext();
                context.setAuthentication(previous);
                SecurityContextHolder.setContext(context);
            }
        }
    }
}
