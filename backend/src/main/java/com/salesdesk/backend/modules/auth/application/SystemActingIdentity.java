package com.salesdesk.backend.modules.auth.application;

import com.salesdesk.backend.global.error.SystemAccountMissingException;
import com.salesdesk.backend.global.security.ActingIdentityContext;
import com.salesdesk.backend.modules.auth.domain.Account;
import com.salesdesk.backend.modules.auth.domain.AccountType;
import com.salesdesk.backend.modules.auth.infrastructure.persistence.AccountRepository;

import org.springframework.stereotype.Component;

/**
 * Switches the acting identity of the current thread to the seeded system account.
 */
@Component
public class SystemActingIdentity {

    private final AccountRepository accountRepository;
    private final ActingIdentityContext actingIdentityContext;

    public SystemActingIdentity(AccountRepository accountRepository, ActingIdentityContext actingIdentityContext) {
        this.accountRepository = accountRepository;
        this.actingIdentityContext = actingIdentityContext;
    }

    /**
     * @throws SystemAccountMissingException when no system account is seeded
     */
    public Account switchToSystem() {
        Account system = accountRepository.findFirstByTypeOrderByCreatedAtAsc(AccountType.SYSTEM)
                .orElseThrow(SystemAccountMissingException::new);
        actingIdentityContext.actAs(system);
        return system;
    }
}
