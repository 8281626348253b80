package com.salesdesk.backend.modules.auth.domain;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;

import com.salesdesk.backend.global.common.email.EmailAddress;
import com.salesdesk.backend.global.jpa.AbstractAuditedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.JoinTable;
import jakarta.persistence.ManyToMany;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * SalesDesk 사용자 계정 엔터티.
 */
@Entity
@Table(name = "account")
public class Account extends AbstractAuditedEntity {

    public static final int USER_NAME_MAX_LENGTH = 100;
    public static final int NAME_MAX_LENGTH = 100;
    public static final int TITLE_MAX_LENGTH = 100;
    public static final int PHONE_NUMBER_MAX_LENGTH = 50;

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "user_name", nullable = false, length = USER_NAME_MAX_LENGTH)
    private String userName;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, length = 16)
    private AccountType type = AccountType.REGULAR;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private AccountStatus status = AccountStatus.ACTIVE;

    @Column(name = "password_hash", length = 255)
    private String passwordHash;

    @Column(name = "first_name", length = NAME_MAX_LENGTH)
    private String firstName;

    @Column(name = "last_name", length = NAME_MAX_LENGTH)
    private String lastName;

    @Column(name = "title", length = TITLE_MAX_LENGTH)
    private String title;

    @Column(name = "email_address", length = 320)
    private String emailAddress;

    @Column(name = "email_address_invalid", nullable = false)
    private boolean emailAddressInvalid;

    @Column(name = "email_address_opted_out", nullable = false)
    private boolean emailAddressOptedOut;

    @Column(name = "phone_number", length = PHONE_NUMBER_MAX_LENGTH)
    private String phoneNumber;

    @ManyToMany(fetch = FetchType.LAZY)
    @JoinTable(
            name = "account_team",
            joinColumns = @JoinColumn(name = "account_id"),
            inverseJoinColumns = @JoinColumn(name = "team_id")
    )
    private Set<Team> teams = new LinkedHashSet<>();

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "default_team_id")
    private Team defaultTeam;

    @ManyToMany(fetch = FetchType.LAZY)
    @JoinTable(
            name = "account_portal",
            joinColumns = @JoinColumn(name = "account_id"),
            inverseJoinColumns = @JoinColumn(name = "portal_id")
    )
    private Set<Portal> portals = new LinkedHashSet<>();

    @ManyToMany(fetch = FetchType.LAZY)
    @JoinTable(
            name = "account_portal_role",
            joinColumns = @JoinColumn(name = "account_id"),
            inverseJoinColumns = @JoinColumn(name = "portal_role_id")
    )
    private Set<PortalRole> portalRoles = new LinkedHashSet<>();

    public UUID getId() {
        return id;
    }

    public String getUserName() {
        return userName;
    }

    public void setUserName(String userName) {
        this.userName = userName;
    }

    public AccountType getType() {
        return type;
    }

    public void setType(AccountType type) {
        this.type = type;
    }

    public AccountStatus getStatus() {
        return status;
    }

    public void setStatus(AccountStatus status) {
        this.status = status;
    }

    public String getPasswordHash() {
        return passwordHash;
    }

    public void setPasswordHash(String passwordHash) {
        this.passwordHash = passwordHash;
    }

    public String getFirstName() {
        return firstName;
    }

    public void setFirstName(String firstName) {
        this.firstName = firstName;
    }

    public String getLastName() {
        return lastName;
    }

    public void setLastName(String lastName) {
        this.lastName = lastName;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public EmailAddress getEmailAddress() {
        if (emailAddress == null) {
            return null;
        }
        return EmailAddress.of(emailAddress, emailAddressInvalid, emailAddressOptedOut);
    }

    public void setEmailAddress(EmailAddress email) {
        if (email == null) {
            this.emailAddress = null;
            this.emailAddressInvalid = false;
            this.emailAddressOptedOut = false;
            return;
        }
        this.emailAddress = email.getAddress();
        this.emailAddressInvalid = email.isInvalid();
        this.emailAddressOptedOut = email.isOptedOut();
    }

    public String getPhoneNumber() {
        return phoneNumber;
    }

    public void setPhoneNumber(String phoneNumber) {
        this.phoneNumber = phoneNumber;
    }

    public Set<Team> getTeams() {
        return teams;
    }

    public Team getDefaultTeam() {
        return defaultTeam;
    }

    public void setDefaultTeam(Team defaultTeam) {
        this.defaultTeam = defaultTeam;
    }

    public Set<Portal> getPortals() {
        return portals;
    }

    public Set<PortalRole> getPortalRoles() {
        return portalRoles;
    }

    public boolean isActive() {
        return status == AccountStatus.ACTIVE;
    }

    public String getFullName() {
        if (firstName == null && lastName == null) {
            return userName;
        }
        if (firstName == null) {
            return lastName;
        }
        if (lastName == null) {
            return firstName;
        }
        return firstName + " " + lastName;
    }
}
