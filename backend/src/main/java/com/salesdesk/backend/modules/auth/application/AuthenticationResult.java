package com.salesdesk.backend.modules.auth.application;

import java.util.Objects;

import com.salesdesk.backend.modules.auth.domain.Account;

public record AuthenticationResult(AuthenticationStatus status, Account account, AuthenticationFailure failure) {

    private static final AuthenticationResult NO_ATTEMPT = new AuthenticationResult(AuthenticationStatus.NO_ATTEMPT, null, null);

    public AuthenticationResult {
        Objects.requireNonNull(status, "status is required");
        if (status == AuthenticationStatus.AUTHENTICATED && account == null) {
            throw new IllegalArgumentException("authenticated result requires an account");
        }
        if (status == AuthenticationStatus.FAILED && failure == null) {
            throw new IllegalArgumentException("failed result requires a failure kind");
        }
    }

    public static AuthenticationResult success(Account account) {
        return new AuthenticationResult(AuthenticationStatus.AUTHENTICATED, account, null);
    }

    public static AuthenticationResult noAttempt() {
        return NO_ATTEMPT;
    }

    public static AuthenticationResult failed(AuthenticationFailure failure) {
        return new AuthenticationResult(AuthenticationStatus.FAILED, null, failure);
    }

    public boolean isAuthenticated() {
        return status == AuthenticationStatus.AUTHENTICATED;
    }
}
