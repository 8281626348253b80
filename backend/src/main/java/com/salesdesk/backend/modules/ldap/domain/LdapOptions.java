package com.salesdesk.backend.modules.ldap.domain;

import java.util.Optional;

/**
 * Read access to configured directory options. An option that is not configured is empty.
 */
@FunctionalInterface
public interface LdapOptions {

    Optional<Object> get(LdapOption option);
}
