package com.salesdesk.backend.global.security;

import java.util.UUID;

import com.salesdesk.backend.modules.auth.domain.AccountType;

public record AccountPrincipal(UUID accountId, String userName, AccountType type) {
}
