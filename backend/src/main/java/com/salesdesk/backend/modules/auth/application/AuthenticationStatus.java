package com.salesdesk.backend.modules.auth.application;

public enum AuthenticationStatus {
    AUTHENTICATED,
    NO_ATTEMPT,
    FAILED
}
