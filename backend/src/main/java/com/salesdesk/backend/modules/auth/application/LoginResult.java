package com.salesdesk.backend.modules.auth.application;

import java.time.OffsetDateTime;

public record LoginResult(
        String token,
        long expiresIn,
        OffsetDateTime issuedAt,
        AccountProfile profile
) {
}
