package com.salesdesk.backend.modules.ldap.domain;

/**
 * Account fields that can be populated when an account is provisioned from the directory.
 */
public enum AccountField {
    USER_NAME,
    FIRST_NAME,
    LAST_NAME,
    TITLE,
    EMAIL_ADDRESS,
    PHONE_NUMBER,
    TEAMS_IDS,
    DEFAULT_TEAM_ID,
    PORTALS_IDS,
    PORTAL_ROLES_IDS
}
