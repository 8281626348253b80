package com.salesdesk.backend.modules.auth.application;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

import com.salesdesk.backend.global.common.email.EmailAddress;
import com.salesdesk.backend.global.common.email.InvalidEmailAddressException;
import com.salesdesk.backend.modules.audit.application.AuditLogService;
import com.salesdesk.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.salesdesk.backend.modules.auth.domain.Account;
import com.salesdesk.backend.modules.auth.domain.AccountType;
import com.salesdesk.backend.modules.auth.domain.Portal;
import com.salesdesk.backend.modules.auth.domain.PortalRole;
import com.salesdesk.backend.modules.auth.domain.Team;
import com.salesdesk.backend.modules.auth.infrastructure.persistence.AccountRepository;
import com.salesdesk.backend.modules.auth.infrastructure.persistence.PortalRepository;
import com.salesdesk.backend.modules.auth.infrastructure.persistence.PortalRoleRepository;
import com.salesdesk.backend.modules.auth.infrastructure.persistence.TeamRepository;
import com.salesdesk.backend.modules.ldap.domain.AccountField;
import com.salesdesk.backend.modules.ldap.domain.DirectoryEntry;
import com.salesdesk.backend.modules.ldap.domain.LdapFieldMap;
import com.salesdesk.backend.modules.ldap.domain.LdapOptions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Creates a local account for a directory user on first login.
 */
@Service
public class AccountProvisioner {

    private static final Logger log = LoggerFactory.getLogger(AccountProvisioner.class);

    private final AccountRepository accountRepository;
    private final TeamRepository teamRepository;
    private final PortalRepository portalRepository;
    private final PortalRoleRepository portalRoleRepository;
    private final LdapOptions ldapOptions;
    private final SystemActingIdentity systemActingIdentity;
    private final AuditLogService auditLogService;

    public AccountProvisioner(
            AccountRepository accountRepository,
            TeamRepository teamRepository,
            PortalRepository portalRepository,
            PortalRoleRepository portalRoleRepository,
            LdapOptions ldapOptions,
            SystemActingIdentity systemActingIdentity,
            AuditLogService auditLogService
    ) {
        this.accountRepository = accountRepository;
        this.teamRepository = teamRepository;
        this.portalRepository = portalRepository;
        this.portalRoleRepository = portalRoleRepository;
        this.ldapOptions = ldapOptions;
        this.systemActingIdentity = systemActingIdentity;
        this.auditLogService = auditLogService;
    }

    /**
     * Builds the account from {@code entry}, saves it as the system account and returns it reloaded by id.
     * A concurrent provisioning of the same user name fails here with a unique-constraint violation.
     *
     * @param loginUserName used when the entry carries no user-name attribute
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Account provision(DirectoryEntry entry, String loginUserName, boolean portal) {
        log.info("LDAP: Creating new account for [{}] from [{}]", loginUserName, entry.dn());
        log.debug("LDAP: user data: {}", entry.attributes());

        Account account = new Account();
        copyDirectoryAttributes(entry, account);
        if (account.getUserName() == null) {
            account.setUserName(loginUserName);
        }

        if (portal) {
            account.setType(AccountType.PORTAL);
            LdapFieldMap.PORTAL_USER.resolve(ldapOptions).forEach((field, value) -> applyStaticValue(account, field, value));
        } else {
            account.setType(AccountType.REGULAR);
            LdapFieldMap.USER.resolve(ldapOptions).forEach((field, value) -> applyStaticValue(account, field, value));
        }

        Account system = systemActingIdentity.switchToSystem();
        Account saved = accountRepository.saveAndFlush(account);

        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("userName", saved.getUserName());
        detail.put("dn", entry.dn());
        detail.put("type", saved.getType().name());
        auditLogService.record(new AuditLogCommand(
                AuditLogService.ACTION_ACCOUNT_PROVISIONED,
                AuditLogService.RESOURCE_ACCOUNT,
                saved.getId().toString(),
                system.getId(),
                null,
                detail
        ));

        return accountRepository.findWithMembershipsById(saved.getId())
                .orElseThrow(() -> new IllegalStateException("Provisioned account " + saved.getId() + " is not found"));
    }

    private void copyDirectoryAttributes(DirectoryEntry entry, Account account) {
        LdapFieldMap.LDAP_ATTRIBUTES.resolve(ldapOptions).forEach((field, attributeName) -> {
            Optional<String> value = entry.firstValue(attributeName.toString());
            if (value.isEmpty()) {
                return;
            }
            log.debug("LDAP: Create an account with [{}] = [{}].", field, value.get());
            applyDirectoryValue(account, field, value.get());
        });
    }

    private void applyDirectoryValue(Account account, AccountField field, String value) {
        int maxLength = maxLength(field);
        if (value.length() > maxLength) {
            log.warn("LDAP: Skipping [{}], {} characters exceed the limit of {}", field, value.length(), maxLength);
            return;
        }
        switch (field) {
            case USER_NAME -> account.setUserName(value);
            case FIRST_NAME -> account.setFirstName(value);
            case LAST_NAME -> account.setLastName(value);
            case TITLE -> account.setTitle(value);
            case PHONE_NUMBER -> account.setPhoneNumber(value);
            case EMAIL_ADDRESS -> {
                try {
                    account.setEmailAddress(EmailAddress.parse(value));
                } catch (InvalidEmailAddressException ex) {
                    log.warn("LDAP: Skipping invalid email address [{}]", ex.getRawValue());
                }
            }
            default -> log.warn("LDAP: Field [{}] cannot be read from a directory attribute", field);
        }
    }

    private static int maxLength(AccountField field) {
        return switch (field) {
            case USER_NAME -> Account.USER_NAME_MAX_LENGTH;
            case FIRST_NAME, LAST_NAME -> Account.NAME_MAX_LENGTH;
            case TITLE -> Account.TITLE_MAX_LENGTH;
            case PHONE_NUMBER -> Account.PHONE_NUMBER_MAX_LENGTH;
            default -> Integer.MAX_VALUE;
        };
    }

    private void applyStaticValue(Account account, AccountField field, Object value) {
        switch (field) {
            case TEAMS_IDS -> account.getTeams().addAll(findAll(field, toUuids(value), teamRepository::findAllById, Team::getId));
            case DEFAULT_TEAM_ID -> toUuids(value).stream().findFirst()
                    .ifPresent(id -> teamRepository.findById(id).ifPresentOrElse(
                            account::setDefaultTeam,
                            () -> log.warn("LDAP: Default team [{}] does not exist, skipping", id)));
            case PORTALS_IDS -> account.getPortals().addAll(findAll(field, toUuids(value), portalRepository::findAllById, Portal::getId));
            case PORTAL_ROLES_IDS -> account.getPortalRoles().addAll(
                    findAll(field, toUuids(value), portalRoleRepository::findAllById, PortalRole::getId));
            default -> log.warn("LDAP: Field [{}] has no static value", field);
        }
    }

    private static <T> List<T> findAll(
            AccountField field,
            List<UUID> ids,
            Function<List<UUID>, List<T>> loader,
            Function<T, UUID> idOf
    ) {
        List<T> found = loader.apply(ids);
        if (found.size() < ids.size()) {
            List<UUID> missing = new ArrayList<>(ids);
            found.forEach(item -> missing.remove(idOf.apply(item)));
            log.warn("LDAP: Skipping unknown ids for [{}]: {}", field, missing);
        }
        return found;
    }

    private static List<UUID> toUuids(Object value) {
        List<UUID> ids = new ArrayList<>();
        if (value instanceof Collection<?> collection) {
            collection.forEach(item -> addUuid(ids, item));
        } else {
            addUuid(ids, value);
        }
        return ids;
    }

    private static void addUuid(List<UUID> ids, Object item) {
        if (item instanceof UUID uuid) {
            ids.add(uuid);
        } else if (item != null) {
            try {
                ids.add(UUID.fromString(item.toString().trim()));
            } catch (IllegalArgumentException ex) {
                log.warn("LDAP: Skipping malformed id [{}]", item);
            }
        }
    }
}
