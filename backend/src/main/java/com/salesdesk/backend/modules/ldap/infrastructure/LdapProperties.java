package com.salesdesk.backend.modules.ldap.infrastructure;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.salesdesk.backend.modules.ldap.domain.LdapOption;
import com.salesdesk.backend.modules.ldap.domain.LdapOptions;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Directory connection, user lookup and provisioning settings ({@code app.auth.ldap.*}).
 */
@Validated
@ConfigurationProperties(prefix = "app.auth.ldap")
public class LdapProperties implements LdapOptions {

    @NotBlank
    private String host = "localhost";

    @Min(1)
    @Max(65535)
    private int port = 389;

    private boolean useSsl;

    // service account; both blank means anonymous search
    private String username;

    private String password;

    private String baseDn;

    @NotNull
    private Duration connectTimeout = Duration.ofSeconds(5);

    @NotNull
    private Duration readTimeout = Duration.ofSeconds(15);

    @NotBlank
    private String userObjectClass = "person";

    @NotBlank
    private String userNameAttribute = "sAMAccountName";

    private String userLoginFilter;

    private boolean createUser = true;

    private boolean portalUserLdapAuth;

    private String userFirstNameAttribute = "givenName";

    private String userLastNameAttribute = "sn";

    private String userTitleAttribute = "title";

    private String userEmailAddressAttribute = "mail";

    private String userPhoneNumberAttribute = "telephoneNumber";

    private List<UUID> userTeamsIds = new ArrayList<>();

    private UUID userDefaultTeamId;

    private List<UUID> portalUserPortalsIds = new ArrayList<>();

    private List<UUID> portalUserRolesIds = new ArrayList<>();

    @Override
    public Optional<Object> get(LdapOption option) {
        Object value = switch (option) {
            case USER_NAME_ATTRIBUTE -> userNameAttribute;
            case USER_FIRST_NAME_ATTRIBUTE -> userFirstNameAttribute;
            case USER_LAST_NAME_ATTRIBUTE -> userLastNameAttribute;
            case USER_TITLE_ATTRIBUTE -> userTitleAttribute;
            case USER_EMAIL_ADDRESS_ATTRIBUTE -> userEmailAddressAttribute;
            case USER_PHONE_NUMBER_ATTRIBUTE -> userPhoneNumberAttribute;
            case USER_TEAMS_IDS -> userTeamsIds;
            case USER_DEFAULT_TEAM_ID -> userDefaultTeamId;
            case PORTAL_USER_PORTALS_IDS -> portalUserPortalsIds;
            case PORTAL_USER_ROLES_IDS -> portalUserRolesIds;
        };
        return Optional.ofNullable(value);
    }

    public String getUrl() {
        return (useSsl ? "ldaps" : "ldap") + "://" + host + ":" + port;
    }

    public String getHost() {
        return host;
    }

    public void setHost(String host) {
        this.host = host;
    }

    public int getPort() {
        return port;
    }

    public void setPort(int port) {
        this.port = port;
    }

    public boolean isUseSsl() {
        return useSsl;
    }

    public void setUseSsl(boolean useSsl) {
        this.useSsl = useSsl;
    }

    public String getUsername() {
        return username;
    }

    public void setUsername(String username) {
        this.username = username;
    }

    public String getPassword() {
        return password;
    }

    public void setPassword(String password) {
        this.password = password;
    }

    public String getBaseDn() {
        return baseDn;
    }

    public void setBaseDn(String baseDn) {
        this.baseDn = baseDn;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public void setConnectTimeout(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    public Duration getReadTimeout() {
        return readTimeout;
    }

    public void setReadTimeout(Duration readTimeout) {
        this.readTimeout = readTimeout;
    }

    public String getUserObjectClass() {
        return userObjectClass;
    }

    public void setUserObjectClass(String userObjectClass) {
        this.userObjectClass = userObjectClass;
    }

    public String getUserNameAttribute() {
        return userNameAttribute;
    }

    public void setUserNameAttribute(String userNameAttribute) {
        this.userNameAttribute = userNameAttribute;
    }

    public String getUserLoginFilter() {
        return userLoginFilter;
    }

    public void setUserLoginFilter(String userLoginFilter) {
        this.userLoginFilter = userLoginFilter;
    }

    public boolean isCreateUser() {
        return createUser;
    }

    public void setCreateUser(boolean createUser) {
        this.createUser = createUser;
    }

    public boolean isPortalUserLdapAuth() {
        return portalUserLdapAuth;
    }

    public void setPortalUserLdapAuth(boolean portalUserLdapAuth) {
        this.portalUserLdapAuth = portalUserLdapAuth;
    }

    public String getUserFirstNameAttribute() {
        return userFirstNameAttribute;
    }

    public void setUserFirstNameAttribute(String userFirstNameAttribute) {
        this.userFirstNameAttribute = userFirstNameAttribute;
    }

    public String getUserLastNameAttribute() {
        return userLastNameAttribute;
    }

    public void setUserLastNameAttribute(String userLastNameAttribute) {
        this.userLastNameAttribute = userLastNameAttribute;
    }

    public String getUserTitleAttribute() {
        return userTitleAttribute;
    }

    public void setUserTitleAttribute(String userTitleAttribute) {
        this.userTitleAttribute = userTitleAttribute;
    }

    public String getUserEmailAddressAttribute() {
        return userEmailAddressAttribute;
    }

    public void setUserEmailAddressAttribute(String userEmailAddressAttribute) {
        this.userEmailAddressAttribute = userEmailAddressAttribute;
    }

    public String getUserPhoneNumberAttribute() {
        return userPhoneNumberAttribute;
    }

    public void setUserPhoneNumberAttribute(String userPhoneNumberAttribute) {
        this.userPhoneNumberAttribute = userPhoneNumberAttribute;
    }

    public List<UUID> getUserTeamsIds() {
        return userTeamsIds;
    }

    public void setUserTeamsIds(List<UUID> userTeamsIds) {
        this.userTeamsIds = userTeamsIds;
    }

    public UUID getUserDefaultTeamId() {
        return userDefaultTeamId;
    }

    public void setUserDefaultTeamId(UUID userDefaultTeamId) {
        this.userDefaultTeamId = userDefaultTeamId;
    }

    public List<UUID> getPortalUserPortalsIds() {
        return portalUserPortalsIds;
    }

    public void setPortalUserPortalsIds(List<UUID> portalUserPortalsIds) {
        this.portalUserPortalsIds = portalUserPortalsIds;
    }

    public List<UUID> getPortalUserRolesIds() {
        return portalUserRolesIds;
    }

    public void setPortalUserRolesIds(List<UUID> portalUserRolesIds) {
        this.portalUserRolesIds = portalUserRolesIds;
    }
}
