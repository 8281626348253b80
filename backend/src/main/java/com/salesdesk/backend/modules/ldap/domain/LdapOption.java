package com.salesdesk.backend.modules.ldap.domain;

public enum LdapOption {
    USER_NAME_ATTRIBUTE("userNameAttribute"),
    USER_FIRST_NAME_ATTRIBUTE("userFirstNameAttribute"),
    USER_LAST_NAME_ATTRIBUTE("userLastNameAttribute"),
    USER_TITLE_ATTRIBUTE("userTitleAttribute"),
    USER_EMAIL_ADDRESS_ATTRIBUTE("userEmailAddressAttribute"),
    USER_PHONE_NUMBER_ATTRIBUTE("userPhoneNumberAttribute"),
    USER_TEAMS_IDS("userTeamsIds"),
    USER_DEFAULT_TEAM_ID("userDefaultTeamId"),
    PORTAL_USER_PORTALS_IDS("portalUserPortalsIds"),
    PORTAL_USER_ROLES_IDS("portalUserRolesIds");

    private final String key;

    LdapOption(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
