package com.salesdesk.backend.modules.ldap.domain;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Fixed account-field to option tables used when provisioning an account from a directory entry.
 * <p>
 * {@link #LDAP_ATTRIBUTES} resolves to directory attribute names whose values are copied per entry.
 * {@link #USER} and {@link #PORTAL_USER} resolve to static values applied to every new account of that kind.
 */
public enum LdapFieldMap {

    LDAP_ATTRIBUTES(table(
            AccountField.USER_NAME, LdapOption.USER_NAME_ATTRIBUTE,
            AccountField.FIRST_NAME, LdapOption.USER_FIRST_NAME_ATTRIBUTE,
            AccountField.LAST_NAME, LdapOption.USER_LAST_NAME_ATTRIBUTE,
            AccountField.TITLE, LdapOption.USER_TITLE_ATTRIBUTE,
            AccountField.EMAIL_ADDRESS, LdapOption.USER_EMAIL_ADDRESS_ATTRIBUTE,
            AccountField.PHONE_NUMBER, LdapOption.USER_PHONE_NUMBER_ATTRIBUTE
    )),
    USER(table(
            AccountField.TEAMS_IDS, LdapOption.USER_TEAMS_IDS,
            AccountField.DEFAULT_TEAM_ID, LdapOption.USER_DEFAULT_TEAM_ID
    )),
    PORTAL_USER(table(
            AccountField.PORTALS_IDS, LdapOption.PORTAL_USER_PORTALS_IDS,
            AccountField.PORTAL_ROLES_IDS, LdapOption.PORTAL_USER_ROLES_IDS
    ));

    private final Map<AccountField, LdapOption> entries;

    LdapFieldMap(Map<AccountField, LdapOption> entries) {
        this.entries = entries;
    }

    public Map<AccountField, LdapOption> entries() {
        return entries;
    }

    /**
     * Returns field to option value for every entry whose option is configured, in table order.
     */
    public Map<AccountField, Object> resolve(LdapOptions options) {
        Map<AccountField, Object> resolved = new LinkedHashMap<>();
        entries.forEach((field, option) -> {
            Optional<Object> value = options.get(option);
            if (value.isPresent() && isPresent(value.get())) {
                resolved.put(field, value.get());
            }
        });
        return Collections.unmodifiableMap(resolved);
    }

    private static boolean isPresent(Object value) {
        if (value instanceof CharSequence text) {
            return !text.toString().isBlank();
        }
        if (value instanceof Collection<?> collection) {
            return !collection.isEmpty();
        }
        return true;
    }

    private static Map<AccountField, LdapOption> table(Object... pairs) {
        Map<AccountField, LdapOption> table = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            table.put((AccountField) pairs[i], (LdapOption) pairs[i + 1]);
        }
        return Collections.unmodifiableMap(table);
    }
}
