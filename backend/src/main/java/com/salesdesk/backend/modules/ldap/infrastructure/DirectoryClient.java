package com.salesdesk.backend.modules.ldap.infrastructure;

import java.util.List;

import com.salesdesk.backend.modules.ldap.domain.DirectoryEntry;

/**
 * Blocking, single-attempt access to the directory service. Every failure surfaces as {@link DirectoryException}.
 */
public interface DirectoryClient {

    /**
     * Binds with the configured service credentials (anonymous when none are configured).
     */
    void bind();

    /**
     * Binds as {@code dn} with {@code password}. An empty password is rejected instead of
     * being sent as an unauthenticated bind.
     */
    void bind(String dn, String password);

    /**
     * @param base search base relative to the configured base DN; {@code null} searches the base DN itself
     */
    List<DirectoryEntry> search(String filter, String base, DirectorySearchScope scope);

    /**
     * Describes the directory endpoint for diagnostics, never including credentials.
     */
    String describe();
}
