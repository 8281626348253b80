package com.salesdesk.backend.modules.auth.application;

import java.util.Optional;

import com.salesdesk.backend.modules.auth.domain.Account;
import com.salesdesk.backend.modules.auth.domain.AccountType;
import com.salesdesk.backend.modules.auth.infrastructure.persistence.AccountRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

/**
 * User name and password checked against the local account store.
 */
@Component
public class LocalAuthenticationProvider implements AuthenticationProvider {

    public static final String METHOD = "local";

    private static final Logger log = LoggerFactory.getLogger(LocalAuthenticationProvider.class);

    private final AccountRepository accountRepository;
    private final PasswordEncoder passwordEncoder;
    private final TokenLoginVerifier tokenLoginVerifier;

    public LocalAuthenticationProvider(
            AccountRepository accountRepository,
            PasswordEncoder passwordEncoder,
            TokenLoginVerifier tokenLoginVerifier
    ) {
        this.accountRepository = accountRepository;
        this.passwordEncoder = passwordEncoder;
        this.tokenLoginVerifier = tokenLoginVerifier;
    }

    @Override
    public String method() {
        return METHOD;
    }

    @Override
    public AuthenticationResult authenticate(AuthenticationRequest request) {
        if (request.authToken() != null) {
            return tokenLoginVerifier.verify(request);
        }
        if (!request.hasPassword() || request.isLogout()) {
            return AuthenticationResult.noAttempt();
        }

        Optional<Account> account = accountRepository
                .findByUserNameExcludingTypes(request.username(), AccountType.NON_INTERACTIVE)
                .filter(candidate -> passwordMatches(request.password(), candidate));
        if (account.isEmpty()) {
            log.debug("Local authentication failed for user [{}]", request.username());
            return AuthenticationResult.failed(AuthenticationFailure.INVALID_CREDENTIALS);
        }
        return AuthenticationResult.success(account.get());
    }

    private boolean passwordMatches(String rawPassword, Account account) {
        String hash = account.getPasswordHash();
        return hash != null && passwordEncoder.matches(rawPassword, hash);
    }
}
