package com.salesdesk.backend.modules.auth.application;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import com.salesdesk.backend.modules.audit.application.AuditLogService;
import com.salesdesk.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.salesdesk.backend.modules.audit.application.AuditMarkers;
import com.salesdesk.backend.modules.auth.domain.Account;
import com.salesdesk.backend.modules.auth.infrastructure.persistence.AccountRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Resolves the account behind a previously issued token and checks it against the claimed user name.
 * Never touches the directory.
 */
@Component
public class TokenLoginVerifier {

    private static final Logger log = LoggerFactory.getLogger(TokenLoginVerifier.class);

    private final AccountRepository accountRepository;
    private final AuditLogService auditLogService;

    public TokenLoginVerifier(AccountRepository accountRepository, AuditLogService auditLogService) {
        this.accountRepository = accountRepository;
        this.auditLogService = auditLogService;
    }

    public AuthenticationResult verify(AuthenticationRequest request) {
        AuthToken token = request.authToken();
        if (token == null) {
            return AuthenticationResult.noAttempt();
        }

        Optional<Account> owner = accountRepository.findById(token.accountId());
        if (owner.isEmpty()) {
            log.warn("Auth token owner [{}] is not found", token.accountId());
            return AuthenticationResult.failed(AuthenticationFailure.USER_NOT_FOUND);
        }

        Account account = owner.get();
        if (!sameUserName(request.username(), account.getUserName())) {
            String remoteAddress = request.remoteAddress() == null ? "" : request.remoteAddress();
            log.error(AuditMarkers.SECURITY_ALERT,
                    "[ALERT][Auth] Unauthorized access attempt for user [{}] from IP [{}] tokenOwner={}",
                    request.username(), remoteAddress, account.getId());
            recordMismatch(request, account);
            return AuthenticationResult.failed(AuthenticationFailure.TOKEN_MISMATCH);
        }

        return AuthenticationResult.success(account);
    }

    private void recordMismatch(AuthenticationRequest request, Account owner) {
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("claimedUserName", request.username());
        detail.put("tokenUserName", owner.getUserName());
        auditLogService.record(new AuditLogCommand(
                AuditLogService.ACTION_TOKEN_USERNAME_MISMATCH,
                AuditLogService.RESOURCE_ACCOUNT,
                owner.getId().toString(),
                owner.getId(),
                request.remoteAddress(),
                detail
        ));
    }

    private static boolean sameUserName(String claimed, String stored) {
        if (claimed == null || stored == null) {
            return false;
        }
        return claimed.toLowerCase(Locale.ROOT).equals(stored.toLowerCase(Locale.ROOT));
    }
}
