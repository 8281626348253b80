package com.salesdesk.backend.global.security;

import java.util.Optional;
import java.util.function.Supplier;

import com.salesdesk.backend.modules.auth.domain.Account;

/**
 * Identity under which side-effecting work (persistence, auditing) is attributed.
 * Scoped to the calling thread; one request never observes another request's identity.
 */
public interface ActingIdentityContext {

    void actAs(Account account);

    Optional<AccountPrincipal> current();

    void clear();

    /**
     * Runs {@code work} and afterwards puts back whatever identity was current before it,
     * including none, whether {@code work} returns or throws.
     */
    <T> T scoped(Supplier<T> work);
}
