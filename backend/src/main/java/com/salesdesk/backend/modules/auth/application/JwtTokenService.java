package com.salesdesk.backend.modules.auth.application;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Date;
import java.util.UUID;

import com.salesdesk.backend.modules.auth.domain.Account;
import com.salesdesk.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.Jwts.SIG;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

@Service
public class JwtTokenService {

    private static final String CLAIM_USER_NAME = "userName";
    private static final String CLAIM_TYPE = "type";

    private final JwtTokenProvider tokenProvider;
    private final long tokenTtlMillis;
    private final Clock clock;

    public JwtTokenService(
            JwtTokenProvider tokenProvider,
            @Value("${app.auth.token.expiration:3600000}") long tokenTtlMillis,
            Clock clock
    ) {
        this.tokenProvider = tokenProvider;
        this.tokenTtlMillis = tokenTtlMillis;
        this.clock = clock;
    }

    public IssuedToken issueToken(Account account) {
        Instant now = clock.instant();
        Instant expiry = now.plusMillis(tokenTtlMillis);

        String token = Jwts.builder()
                .subject(account.getId().toString())
                .issuedAt(Date.from(now))
                .expiration(Date.from(expiry))
                .claim(CLAIM_USER_NAME, account.getUserName())
                .claim(CLAIM_TYPE, account.getType().name())
                .signWith(tokenProvider.getSecretKey(), SIG.HS256)
                .compact();

        return new IssuedToken(token, tokenTtlMillis / 1000L, OffsetDateTime.ofInstant(now, clock.getZone()));
    }

    public AuthToken parseToken(String token) {
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(tokenProvider.getSecretKey())
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();

            UUID accountId = UUID.fromString(claims.getSubject());
            String userName = claims.get(CLAIM_USER_NAME, String.class);
            Instant issuedAt = claims.getIssuedAt() != null ? claims.getIssuedAt().toInstant() : clock.instant();
            Instant expiresAt = claims.getExpiration() != null ? claims.getExpiration().toInstant() : issuedAt;

            return new AuthToken(
                    accountId,
                    userName,
                    OffsetDateTime.ofInstant(issuedAt, clock.getZone()),
                    OffsetDateTime.ofInstant(expiresAt, clock.getZone())
            );
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidTokenException("Invalid auth token", e);
        }
    }

    public record IssuedToken(String token, long expiresInSeconds, OffsetDateTime issuedAt) {
    }

    public static class InvalidTokenException extends RuntimeException {
        public InvalidTokenException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
