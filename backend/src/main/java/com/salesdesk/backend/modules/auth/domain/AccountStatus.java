package com.salesdesk.backend.modules.auth.domain;

public enum AccountStatus {
    ACTIVE,
    INACTIVE
}
