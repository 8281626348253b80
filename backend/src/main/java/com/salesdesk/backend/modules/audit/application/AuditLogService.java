package com.salesdesk.backend.modules.audit.application;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import com.salesdesk.backend.modules.audit.domain.AuditLog;
import com.salesdesk.backend.modules.audit.infrastructure.AuditLogRepository;
import com.salesdesk.backend.modules.auth.domain.Account;

import jakarta.persistence.EntityManager;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Service
public class AuditLogService {

    public static final String ACTION_TOKEN_USERNAME_MISMATCH = "AUTH_TOKEN_USERNAME_MISMATCH";
    public static final String ACTION_ACCOUNT_PROVISIONED = "ACCOUNT_PROVISIONED";
    public static final String RESOURCE_ACCOUNT = "ACCOUNT";

    private final AuditLogRepository auditLogRepository;
    private final EntityManager entityManager;

    public AuditLogService(AuditLogRepository auditLogRepository, EntityManager entityManager) {
        this.auditLogRepository = auditLogRepository;
        this.entityManager = entityManager;
    }

    // 인증 실패 경로에서도 감사 기록이 롤백되지 않도록 별도 트랜잭션으로 저장한다.
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void record(AuditLogCommand command) {
        Objects.requireNonNull(command.actionType(), "actionType is required");
        Objects.requireNonNull(command.resourceType(), "resourceType is required");
        Objects.requireNonNull(command.resourceKey(), "resourceKey is required");

        AuditLog auditLog = new AuditLog();
        auditLog.setActionType(command.actionType());
        auditLog.setResourceType(command.resourceType());
        auditLog.setResourceKey(command.resourceKey());
        auditLog.setRemoteAddress(command.remoteAddress());

        if (command.actorAccountId() != null) {
            Account actorReference = entityManager.getReference(Account.class, command.actorAccountId());
            auditLog.setActor(actorReference);
        }

        if (command.detail() != null && !command.detail().isEmpty()) {
            auditLog.setDetail(new HashMap<>(command.detail()));
        }

        auditLogRepository.save(auditLog);
    }

    public record AuditLogCommand(
            String actionType,
            String resourceType,
            String resourceKey,
            UUID actorAccountId,
            String remoteAddress,
            Map<String, Object> detail
    ) {
    }
}
