package com.salesdesk.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

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
import com.salesdesk.backend.modules.ldap.domain.DirectoryEntry;
import com.salesdesk.backend.modules.ldap.infrastructure.LdapProperties;
import com.salesdesk.backend.support.TestAccountFactory;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class AccountProvisionerTest {

    private static final UUID NEW_ID = UUID.fromString("7d1c8e0a-3b54-4b8e-9a8f-0c2d4e6f8a10");
    private static final UUID SALES_TEAM_ID = UUID.fromString("11111111-1111-1111-1111-111111111111");
    private static final UUID GONE_TEAM_ID = UUID.fromString("22222222-2222-2222-2222-222222222222");
    private static final UUID PORTAL_ID = UUID.fromString("33333333-3333-3333-3333-333333333333");
    private static final UUID ROLE_ID = UUID.fromString("44444444-4444-4444-4444-444444444444");

    @Mock
    private AccountRepository accountRepository;

    @Mock
    private TeamRepository teamRepository;

    @Mock
    private PortalRepository portalRepository;

    @Mock
    private PortalRoleRepository portalRoleRepository;

    @Mock
    private SystemActingIdentity systemActingIdentity;

    @Mock
    private AuditLogService auditLogService;

    private LdapProperties properties;
    private AccountProvisioner provisioner;
    private final AtomicReference<Account> saved = new AtomicReference<>();

    @BeforeEach
    void setUp() {
        properties = new LdapProperties();
        provisioner = new AccountProvisioner(
                accountRepository,
                teamRepository,
                portalRepository,
                portalRoleRepository,
                properties,
                systemActingIdentity,
                auditLogService
        );
        when(systemActingIdentity.switchToSystem()).thenReturn(TestAccountFactory.system());
        when(accountRepository.saveAndFlush(any(Account.class))).thenAnswer(invocation -> {
            Account account = invocation.getArgument(0);
            ReflectionTestUtils.setField(account, "id", NEW_ID);
            saved.set(account);
            return account;
        });
        when(accountRepository.findWithMembershipsById(NEW_ID)).thenAnswer(invocation -> Optional.ofNullable(saved.get()));
    }

    @Test
    @DisplayName("매핑 표에 있고 엔트리에도 있는 속성만 복사한다")
    void copiesOnlyAttributesPresentInEntryAndMapping() {
        DirectoryEntry entry = new DirectoryEntry("cn=Jane Doe,ou=people,dc=example,dc=com", Map.of(
                "sAMAccountName", List.of("jdoe"),
                "givenName", List.of("Jane"),
                "sn", List.of("Doe"),
                "mail", List.of("jane.doe@example.com", "jd@example.com"),
                "telephoneNumber", List.of("+1 555 0100"),
                "department", List.of("Sales")
        ));

        Account account = provisioner.provision(entry, "jdoe", false);

        assertThat(account.getId()).isEqualTo(NEW_ID);
        assertThat(account.getUserName()).isEqualTo("jdoe");
        assertThat(account.getFirstName()).isEqualTo("Jane");
        assertThat(account.getLastName()).isEqualTo("Doe");
        assertThat(account.getTitle()).isNull();
        assertThat(account.getEmailAddress().getAddress()).isEqualTo("jane.doe@example.com");
        assertThat(account.getPhoneNumber()).isEqualTo("+1 555 0100");
        assertThat(account.getType()).isEqualTo(AccountType.REGULAR);
        assertThat(account.getPasswordHash()).isNull();
        verifyNoInteractions(teamRepository, portalRepository, portalRoleRepository);
    }

    @Test
    void customAttributeMappingIsHonoured() {
        properties.setUserNameAttribute("uid");
        properties.setUserTitleAttribute("description");
        DirectoryEntry entry = new DirectoryEntry("uid=jdoe,ou=people,dc=example,dc=com", Map.of(
                "uid", List.of("jdoe"),
                "sAMAccountName", List.of("ignored"),
                "description", List.of("Account Executive")
        ));

        Account account = provisioner.provision(entry, "jdoe", false);

        assertThat(account.getUserName()).isEqualTo("jdoe");
        assertThat(account.getTitle()).isEqualTo("Account Executive");
    }

    @Test
    void loginNameIsUsedWhenEntryHasNoUserNameAttribute() {
        DirectoryEntry entry = new DirectoryEntry("cn=Jane Doe,dc=example,dc=com", Map.of("sn", List.of("Doe")));

        Account account = provisioner.provision(entry, "jdoe", false);

        assertThat(account.getUserName()).isEqualTo("jdoe");
    }

    @Test
    void invalidEmailAttributeIsSkipped() {
        DirectoryEntry entry = new DirectoryEntry("cn=Mark Roe,dc=example,dc=com", Map.of(
                "sAMAccountName", List.of("mroe"),
                "mail", List.of("not-an-email")
        ));

        Account account = provisioner.provision(entry, "mroe", false);

        assertThat(account.getEmailAddress()).isNull();
        assertThat(account.getUserName()).isEqualTo("mroe");
    }

    @Test
    void overLengthAttributesAreSkipped() {
        DirectoryEntry entry = new DirectoryEntry("cn=Jane Doe,dc=example,dc=com", Map.of(
                "sAMAccountName", List.of("jdoe"),
                "title", List.of("T".repeat(Account.TITLE_MAX_LENGTH + 1)),
                "telephoneNumber", List.of("+1 555 0100 ext. " + "9".repeat(Account.PHONE_NUMBER_MAX_LENGTH)),
                "givenName", List.of("Jane")
        ));

        Account account = provisioner.provision(entry, "jdoe", false);

        assertThat(account.getTitle()).isNull();
        assertThat(account.getPhoneNumber()).isNull();
        assertThat(account.getFirstName()).isEqualTo("Jane");
        assertThat(account.getUserName()).isEqualTo("jdoe");
    }

    @Test
    void regularUserGetsConfiguredTeamsAndSkipsUnknownIds() {
        Team sales = team(SALES_TEAM_ID, "Sales");
        properties.setUserTeamsIds(List.of(SALES_TEAM_ID, GONE_TEAM_ID));
        properties.setUserDefaultTeamId(SALES_TEAM_ID);
        when(teamRepository.findAllById(List.of(SALES_TEAM_ID, GONE_TEAM_ID))).thenReturn(List.of(sales));
        when(teamRepository.findById(SALES_TEAM_ID)).thenReturn(Optional.of(sales));
        DirectoryEntry entry = new DirectoryEntry("cn=Jane Doe,dc=example,dc=com", Map.of("sAMAccountName", List.of("jdoe")));

        Account account = provisioner.provision(entry, "jdoe", false);

        assertThat(account.getTeams()).containsExactly(sales);
        assertThat(account.getDefaultTeam()).isSameAs(sales);
        assertThat(account.getPortals()).isEmpty();
        verifyNoInteractions(portalRepository, portalRoleRepository);
    }

    @Test
    @DisplayName("포털 사용자는 PORTAL 유형과 포털 전용 기본값을 받는다")
    void portalUserGetsPortalTypeAndPortalDefaults() {
        Portal portal = new Portal();
        ReflectionTestUtils.setField(portal, "id", PORTAL_ID);
        PortalRole role = new PortalRole();
        ReflectionTestUtils.setField(role, "id", ROLE_ID);
        properties.setUserTeamsIds(List.of(SALES_TEAM_ID));
        properties.setPortalUserPortalsIds(List.of(PORTAL_ID));
        properties.setPortalUserRolesIds(List.of(ROLE_ID));
        when(portalRepository.findAllById(List.of(PORTAL_ID))).thenReturn(List.of(portal));
        when(portalRoleRepository.findAllById(List.of(ROLE_ID))).thenReturn(List.of(role));
        DirectoryEntry entry = new DirectoryEntry("cn=Paula Port,dc=example,dc=com", Map.of("sAMAccountName", List.of("pport")));

        Account account = provisioner.provision(entry, "pport", true);

        assertThat(account.getType()).isEqualTo(AccountType.PORTAL);
        assertThat(account.getPortals()).containsExactly(portal);
        assertThat(account.getPortalRoles()).containsExactly(role);
        assertThat(account.getTeams()).isEmpty();
        verifyNoInteractions(teamRepository);
    }

    @Test
    void savesAsSystemAccountRecordsAuditAndReloadsById() {
        DirectoryEntry entry = new DirectoryEntry("cn=Jane Doe,dc=example,dc=com", Map.of("sAMAccountName", List.of("jdoe")));

        Account account = provisioner.provision(entry, "jdoe", false);

        InOrder order = inOrder(systemActingIdentity, accountRepository, auditLogService);
        order.verify(systemActingIdentity).switchToSystem();
        order.verify(accountRepository).saveAndFlush(any(Account.class));
        order.verify(auditLogService).record(any(AuditLogCommand.class));
        order.verify(accountRepository).findWithMembershipsById(NEW_ID);
        assertThat(account).isSameAs(saved.get());

        ArgumentCaptor<AuditLogCommand> command = ArgumentCaptor.forClass(AuditLogCommand.class);
        verify(auditLogService).record(command.capture());
        assertThat(command.getValue().actionType()).isEqualTo(AuditLogService.ACTION_ACCOUNT_PROVISIONED);
        assertThat(command.getValue().resourceKey()).isEqualTo(NEW_ID.toString());
        assertThat(command.getValue().actorAccountId()).isEqualTo(TestAccountFactory.SYSTEM_ACCOUNT_ID);
        assertThat(command.getValue().detail()).containsEntry("dn", "cn=Jane Doe,dc=example,dc=com");
    }

    private static Team team(UUID id, String name) {
        Team team = new Team();
        team.setName(name);
        ReflectionTestUtils.setField(team, "id", id);
        return team;
    }
}
