package com.salesdesk.backend.modules.auth.application;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

import com.salesdesk.backend.global.error.ProblemException;
import com.salesdesk.backend.global.security.ActingIdentityContext;
import com.salesdesk.backend.modules.auth.application.JwtTokenService.InvalidTokenException;
import com.salesdesk.backend.modules.auth.application.JwtTokenService.IssuedToken;
import com.salesdesk.backend.modules.auth.domain.Account;
import com.salesdesk.backend.modules.auth.infrastructure.persistence.AccountRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

@Service
@Transactional(noRollbackFor = ProblemException.class)
public class AuthService {

    public static final String AUTHENTICATION_FAILED = "auth.authentication_failed";
    public static final String USER_INACTIVE = "auth.user_inactive";
    public static final String ACCOUNT_NOT_FOUND = "auth.account_not_found";

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    private final AuthenticationProvider provider;
    private final JwtTokenService jwtTokenService;
    private final AccountRepository accountRepository;
    private final ActingIdentityContext actingIdentity;

    public AuthService(
            List<AuthenticationProvider> providers,
            @Value("${app.auth.method:ldap}") String method,
            JwtTokenService jwtTokenService,
            AccountRepository accountRepository,
            ActingIdentityContext actingIdentity
    ) {
        Map<String, AuthenticationProvider> byMethod = providers.stream()
                .collect(Collectors.toMap(AuthenticationProvider::method, Function.identity()));
        this.provider = byMethod.get(method);
        if (this.provider == null) {
            throw new IllegalStateException("Unknown app.auth.method [" + method + "], expected one of " + byMethod.keySet());
        }
        this.jwtTokenService = jwtTokenService;
        this.accountRepository = accountRepository;
        this.actingIdentity = actingIdentity;
    }

    /**
     * The acting identity set while authenticating (the system account during provisioning)
     * does not outlive this call.
     *
     * @return empty when the command is not a login attempt (no password, logout sentinel)
     * @throws ProblemException {@code auth.authentication_failed} for every kind of failed attempt
     */
    public Optional<LoginResult> login(LoginCommand command) {
        return actingIdentity.scoped(() -> doLogin(command));
    }

    private Optional<LoginResult> doLogin(LoginCommand command) {
        AuthenticationRequest request = new AuthenticationRequest(
                command.username(),
                command.password(),
                parseToken(command),
                command.portal(),
                command.remoteAddress()
        );

        AuthenticationResult result = provider.authenticate(request);
        switch (result.status()) {
            case NO_ATTEMPT -> {
                return Optional.empty();
            }
            case FAILED -> {
                log.info("Login failed for [{}] via {}: {}", command.username(), provider.method(), result.failure());
                throw new ProblemException(AUTHENTICATION_FAILED, "Authentication failed.");
            }
            default -> {
            }
        }

        Account account = accountRepository.findWithMembershipsById(result.account().getId())
                .orElse(result.account());
        if (!account.isActive()) {
            throw new ProblemException(USER_INACTIVE, "Account is inactive.");
        }

        IssuedToken issued = jwtTokenService.issueToken(account);
        return Optional.of(new LoginResult(issued.token(), issued.expiresInSeconds(), issued.issuedAt(), AccountProfile.from(account)));
    }

    @Transactional(readOnly = true)
    public AccountProfile loadProfile(UUID accountId) {
        return accountRepository.findWithMembershipsById(accountId)
                .map(AccountProfile::from)
                .orElseThrow(() -> new ProblemException(ACCOUNT_NOT_FOUND, "Account is not found."));
    }

    private AuthToken parseToken(LoginCommand command) {
        if (!StringUtils.hasText(command.token())) {
            return null;
        }
        try {
            return jwtTokenService.parseToken(command.token());
        } catch (InvalidTokenException ex) {
            log.info("Login failed for [{}]: {}", command.username(), ex.getMessage());
            throw new ProblemException(AUTHENTICATION_FAILED, "Authentication failed.", ex);
        }
    }
}
