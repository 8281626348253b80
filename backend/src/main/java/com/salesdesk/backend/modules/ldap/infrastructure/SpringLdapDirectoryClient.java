package com.salesdesk.backend.modules.ldap.infrastructure;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import javax.naming.NamingEnumeration;
import javax.naming.directory.Attribute;
import javax.naming.directory.Attributes;
import javax.naming.directory.DirContext;
import javax.naming.directory.SearchControls;

import com.salesdesk.backend.modules.ldap.domain.DirectoryEntry;

import org.springframework.ldap.NamingException;
import org.springframework.ldap.core.ContextMapper;
import org.springframework.ldap.core.DirContextAdapter;
import org.springframework.ldap.core.LdapTemplate;
import org.springframework.ldap.core.support.LdapContextSource;
import org.springframework.ldap.support.LdapUtils;

/**
 * {@link DirectoryClient} over Spring LDAP. Connections are not pooled; each call opens and closes its own context.
 */
public class SpringLdapDirectoryClient implements DirectoryClient {

    private final LdapContextSource contextSource;
    private final LdapTemplate ldapTemplate;
    private final int timeLimitMillis;

    public SpringLdapDirectoryClient(LdapContextSource contextSource, int timeLimitMillis) {
        this.contextSource = contextSource;
        this.ldapTemplate = new LdapTemplate(contextSource);
        // Active Directory answers subtree searches at the domain root with referrals
        this.ldapTemplate.setIgnorePartialResultException(true);
        this.timeLimitMillis = timeLimitMillis;
    }

    @Override
    public void bind() {
        DirContext context = null;
        try {
            context = contextSource.getReadOnlyContext();
        } catch (NamingException ex) {
            throw new DirectoryException("Service bind to " + describe() + " failed: " + ex.getMessage(), ex);
        } finally {
            LdapUtils.closeContext(context);
        }
    }

    @Override
    public void bind(String dn, String password) {
        if (dn == null || dn.isBlank()) {
            throw new DirectoryException("Bind DN is empty");
        }
        if (password == null || password.isEmpty()) {
            throw new DirectoryException("Empty password rejected for [" + dn + "]");
        }
        DirContext context = null;
        try {
            context = contextSource.getContext(dn, password);
        } catch (NamingException ex) {
            throw new DirectoryException("Bind as [" + dn + "] failed: " + ex.getMessage(), ex);
        } finally {
            LdapUtils.closeContext(context);
        }
    }

    @Override
    public List<DirectoryEntry> search(String filter, String base, DirectorySearchScope scope) {
        SearchControls controls = new SearchControls();
        controls.setSearchScope(scope.getJndiScope());
        controls.setTimeLimit(timeLimitMillis);
        controls.setReturningObjFlag(true);

        ContextMapper<DirectoryEntry> mapper = ctx -> toEntry((DirContextAdapter) ctx);
        try {
            return ldapTemplate.search(base == null ? "" : base, filter, controls, mapper);
        } catch (NamingException ex) {
            throw new DirectoryException("Search " + filter + " on " + describe() + " failed: " + ex.getMessage(), ex);
        }
    }

    @Override
    public String describe() {
        return String.join(",", contextSource.getUrls());
    }

    private DirectoryEntry toEntry(DirContextAdapter adapter) throws javax.naming.NamingException {
        Map<String, List<String>> values = new LinkedHashMap<>();
        Attributes attributes = adapter.getAttributes();
        NamingEnumeration<? extends Attribute> all = attributes.getAll();
        try {
            while (all.hasMore()) {
                Attribute attribute = all.next();
                List<String> textValues = new ArrayList<>();
                NamingEnumeration<?> attributeValues = attribute.getAll();
                while (attributeValues.hasMore()) {
                    // binary values (photos, certificates) are not mapped onto accounts
                    if (attributeValues.next() instanceof String text) {
                        textValues.add(text);
                    }
                }
                if (!textValues.isEmpty()) {
                    values.put(attribute.getID(), textValues);
                }
            }
        } finally {
            all.close();
        }
        return new DirectoryEntry(adapter.getNameInNamespace(), values);
    }
}
