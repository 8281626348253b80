package com.salesdesk.backend.modules.auth.application;

/**
 * A login method selectable through {@code app.auth.method}.
 */
public interface AuthenticationProvider {

    /**
     * Configuration name of this method, e.g. {@code ldap}.
     */
    String method();

    /**
     * Never throws for an ordinary failed login; the outcome is carried by the result.
     */
    AuthenticationResult authenticate(AuthenticationRequest request);
}
