package com.salesdesk.backend.modules.ldap.infrastructure;

import javax.naming.directory.SearchControls;

public enum DirectorySearchScope {
    BASE(SearchControls.OBJECT_SCOPE),
    ONE_LEVEL(SearchControls.ONELEVEL_SCOPE),
    SUBTREE(SearchControls.SUBTREE_SCOPE);

    private final int jndiScope;

    DirectorySearchScope(int jndiScope) {
        this.jndiScope = jndiScope;
    }

    public int getJndiScope() {
        return jndiScope;
    }
}
