package com.salesdesk.backend.modules.auth.application;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * A verified, previously issued auth token: the owning account id and the user name it was issued to.
 */
public record AuthToken(UUID accountId, String userName, OffsetDateTime issuedAt, OffsetDateTime expiresAt) {
}
