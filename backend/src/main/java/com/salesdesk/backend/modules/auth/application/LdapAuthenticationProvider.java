package com.salesdesk.backend.modules.auth.application;

import java.util.List;
import java.util.Optional;

import com.salesdesk.backend.modules.auth.domain.Account;
import com.salesdesk.backend.modules.auth.domain.AccountType;
import com.salesdesk.backend.modules.auth.infrastructure.persistence.AccountRepository;
import com.salesdesk.backend.modules.ldap.domain.DirectoryEntry;
import com.salesdesk.backend.modules.ldap.domain.LdapUserFilter;
import com.salesdesk.backend.modules.ldap.infrastructure.DirectoryClient;
import com.salesdesk.backend.modules.ldap.infrastructure.DirectoryException;
import com.salesdesk.backend.modules.ldap.infrastructure.DirectorySearchScope;
import com.salesdesk.backend.modules.ldap.infrastructure.LdapProperties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

/**
 * Authenticates against the directory and maps the directory user onto a local account.
 * <p>
 * Order of evaluation: token, service bind, user search, end-user bind, local account, provisioning.
 * When the directory is unreachable or does not know the user, local administrator credentials are
 * accepted instead. A rejected end-user bind never falls back to them.
 */
@Component
public class LdapAuthenticationProvider implements AuthenticationProvider {

    public static final String METHOD = "ldap";

    private static final Logger log = LoggerFactory.getLogger(LdapAuthenticationProvider.class);

    private final DirectoryClient directoryClient;
    private final LdapProperties properties;
    private final AccountRepository accountRepository;
    private final PasswordEncoder passwordEncoder;
    private final TokenLoginVerifier tokenLoginVerifier;
    private final LocalAuthenticationProvider localAuthenticationProvider;
    private final AccountProvisioner accountProvisioner;
    private final SystemActingIdentity systemActingIdentity;

    public LdapAuthenticationProvider(
            DirectoryClient directoryClient,
            LdapProperties properties,
            AccountRepository accountRepository,
            PasswordEncoder passwordEncoder,
            TokenLoginVerifier tokenLoginVerifier,
            LocalAuthenticationProvider localAuthenticationProvider,
            AccountProvisioner accountProvisioner,
            SystemActingIdentity systemActingIdentity
    ) {
        this.directoryClient = directoryClient;
        this.properties = properties;
        this.accountRepository = accountRepository;
        this.passwordEncoder = passwordEncoder;
        this.tokenLoginVerifier = tokenLoginVerifier;
        this.localAuthenticationProvider = localAuthenticationProvider;
        this.accountProvisioner = accountProvisioner;
        this.systemActingIdentity = systemActingIdentity;
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
        if (request.portal() && !properties.isPortalUserLdapAuth()) {
            return localAuthenticationProvider.authenticate(request);
        }

        String username = request.username();
        try {
            directoryClient.bind();
        } catch (DirectoryException ex) {
            log.error("LDAP: Could not connect to LDAP server [{}], details: {}", directoryClient.describe(), ex.getMessage());
            return loginAsAdministrator(request, AuthenticationFailure.UNAVAILABLE);
        }

        Optional<DirectoryEntry> userEntry;
        try {
            userEntry = findUserEntry(username);
        } catch (DirectoryException ex) {
            log.error("LDAP: Error while finding DN for [{}], details: {}", username, ex.getMessage());
            userEntry = Optional.empty();
        }
        if (userEntry.isEmpty()) {
            log.warn("LDAP: Authentication failed for user [{}], details: user is not found.", username);
            return loginAsAdministrator(request, AuthenticationFailure.USER_NOT_FOUND);
        }

        DirectoryEntry entry = userEntry.get();
        log.debug("LDAP: User [{}] is found with this DN [{}].", username, entry.dn());
        try {
            directoryClient.bind(entry.dn(), request.password());
        } catch (DirectoryException ex) {
            log.error("LDAP: Authentication failed for user [{}], details: {}", username, ex.getMessage());
            return AuthenticationResult.failed(AuthenticationFailure.INVALID_CREDENTIALS);
        }

        Optional<Account> existing = accountRepository.findByUserNameExcludingTypes(username, AccountType.NON_INTERACTIVE);
        if (existing.isPresent()) {
            return AuthenticationResult.success(existing.get());
        }

        if (!properties.isCreateUser()) {
            systemActingIdentity.switchToSystem();
            log.warn("LDAP: User [{}] has no local account and account creation is disabled.", username);
            return AuthenticationResult.failed(AuthenticationFailure.PROVISIONING_DISABLED);
        }
        return provision(entry, request);
    }

    private AuthenticationResult provision(DirectoryEntry entry, AuthenticationRequest request) {
        try {
            return AuthenticationResult.success(accountProvisioner.provision(entry, request.username(), request.portal()));
        } catch (DataIntegrityViolationException ex) {
            // a concurrent first login of the same user wins the unique index; anything else is bad data
            Optional<Account> winner = accountRepository
                    .findByUserNameExcludingTypes(request.username(), AccountType.NON_INTERACTIVE);
            if (winner.isEmpty()) {
                log.error("LDAP: Could not create account for user [{}] from [{}], details: {}",
                        request.username(), entry.dn(), ex.getMostSpecificCause().getMessage());
                return AuthenticationResult.failed(AuthenticationFailure.PROVISIONING_FAILED);
            }
            log.info("LDAP: Account [{}] was created concurrently, using the existing account.", request.username());
            return AuthenticationResult.success(winner.get());
        }
    }

    private Optional<DirectoryEntry> findUserEntry(String username) {
        String filter = LdapUserFilter.build(
                properties.getUserObjectClass(),
                properties.getUserNameAttribute(),
                username,
                properties.getUserLoginFilter()
        );
        log.debug("LDAP: user search string: \"{}\"", filter);
        List<DirectoryEntry> result = directoryClient.search(filter, null, DirectorySearchScope.SUBTREE);
        return result.stream().findFirst();
    }

    private AuthenticationResult loginAsAdministrator(AuthenticationRequest request, AuthenticationFailure failure) {
        Optional<Account> administrator = accountRepository
                .findByUserNameAndTypeIn(request.username(), AccountType.ADMINISTRATIVE)
                .filter(account -> account.getPasswordHash() != null
                        && passwordEncoder.matches(request.password(), account.getPasswordHash()));
        if (administrator.isEmpty()) {
            return AuthenticationResult.failed(failure);
        }
        log.info("LDAP: Administrator [{}] was logged in by local credentials.", request.username());
        return AuthenticationResult.success(administrator.get());
    }
}
