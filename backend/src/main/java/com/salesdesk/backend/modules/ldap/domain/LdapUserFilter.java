package com.salesdesk.backend.modules.ldap.domain;

import org.springframework.ldap.filter.AndFilter;
import org.springframework.ldap.filter.EqualsFilter;
import org.springframework.ldap.filter.HardcodedFilter;

/**
 * Builds the search filter used to locate a user entry by login name.
 */
public final class LdapUserFilter {

    private LdapUserFilter() {
    }

    /**
     * {@code (&(objectClass=<objectClass>)(<userNameAttribute>=<userName>)<loginFilter>)}; the user name is escaped,
     * the login filter is embedded as configured after {@link #normalizeLoginFilter(String)}.
     */
    public static String build(String objectClass, String userNameAttribute, String userName, String loginFilter) {
        AndFilter filter = new AndFilter()
                .and(new EqualsFilter("objectClass", objectClass))
                .and(new EqualsFilter(userNameAttribute, userName));
        String normalized = normalizeLoginFilter(loginFilter);
        if (normalized != null) {
            filter.and(new HardcodedFilter(normalized));
        }
        return filter.encode();
    }

    /**
     * Wraps a configured filter fragment such as {@code memberof=CN=testers,OU=groups,DC=example,DC=com}
     * in parentheses when they are missing. Blank input yields {@code null}.
     */
    public static String normalizeLoginFilter(String loginFilter) {
        if (loginFilter == null) {
            return null;
        }
        String filter = loginFilter.trim();
        if (filter.isEmpty()) {
            return null;
        }
        if (!filter.startsWith("(")) {
            filter = "(" + filter;
        }
        if (!filter.endsWith(")")) {
            filter = filter + ")";
        }
        return filter;
    }
}
