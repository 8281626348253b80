package com.salesdesk.backend.modules.auth.application;

/**
 * Why an attempt failed. Used for diagnostics only; callers present every kind as the same failure.
 */
public enum AuthenticationFailure {
    UNAVAILABLE,
    USER_NOT_FOUND,
    INVALID_CREDENTIALS,
    PROVISIONING_DISABLED,
    PROVISIONING_FAILED,
    TOKEN_MISMATCH
}
