package com.salesdesk.backend.modules.ldap.infrastructure;

import java.util.HashMap;
import java.util.Map;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.ldap.core.support.LdapContextSource;
import org.springframework.util.StringUtils;

@Configuration
public class LdapClientConfig {

    private static final String CONNECT_TIMEOUT_ENV = "com.sun.jndi.ldap.connect.timeout";
    private static final String READ_TIMEOUT_ENV = "com.sun.jndi.ldap.read.timeout";

    @Bean
    public LdapContextSource directoryContextSource(LdapProperties properties) {
        LdapContextSource contextSource = new LdapContextSource();
        contextSource.setUrl(properties.getUrl());
        if (StringUtils.hasText(properties.getBaseDn())) {
            contextSource.setBase(properties.getBaseDn());
        }
        if (StringUtils.hasText(properties.getUsername())) {
            contextSource.setUserDn(properties.getUsername());
            contextSource.setPassword(properties.getPassword() == null ? "" : properties.getPassword());
        } else {
            contextSource.setAnonymousReadOnly(true);
        }
        contextSource.setPooled(false);

        Map<String, Object> environment = new HashMap<>();
        environment.put(CONNECT_TIMEOUT_ENV, Long.toString(properties.getConnectTimeout().toMillis()));
        environment.put(READ_TIMEOUT_ENV, Long.toString(properties.getReadTimeout().toMillis()));
        contextSource.setBaseEnvironmentProperties(environment);
        return contextSource;
    }

    @Bean
    public DirectoryClient directoryClient(LdapContextSource directoryContextSource, LdapProperties properties) {
        return new SpringLdapDirectoryClient(directoryContextSource, (int) properties.getReadTimeout().toMillis());
    }
}
