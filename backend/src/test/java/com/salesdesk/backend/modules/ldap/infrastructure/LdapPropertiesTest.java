package com.salesdesk.backend.modules.ldap.infrastructure;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.UUID;

import com.salesdesk.backend.modules.ldap.domain.LdapOption;

import org.junit.jupiter.api.Test;

class LdapPropertiesTest {

    @Test
    void urlFollowsSslFlag() {
        LdapProperties properties = new LdapProperties();
        properties.setHost("dc1.corp.example.com");

        assertThat(properties.getUrl()).isEqualTo("ldap://dc1.corp.example.com:389");

        properties.setUseSsl(true);
        properties.setPort(636);
        assertThat(properties.getUrl()).isEqualTo("ldaps://dc1.corp.example.com:636");
    }

    @Test
    void exposesEveryOptionByKey() {
        UUID teamId = UUID.randomUUID();
        LdapProperties properties = new LdapProperties();
        properties.setUserTeamsIds(List.of(teamId));

        assertThat(properties.get(LdapOption.USER_NAME_ATTRIBUTE)).contains("sAMAccountName");
        assertThat(properties.get(LdapOption.USER_EMAIL_ADDRESS_ATTRIBUTE)).contains("mail");
        assertThat(properties.get(LdapOption.USER_TEAMS_IDS)).contains(List.of(teamId));
        assertThat(properties.get(LdapOption.USER_DEFAULT_TEAM_ID)).isEmpty();
        for (LdapOption option : LdapOption.values()) {
            assertThat(option.getKey()).isNotBlank();
        }
    }
}
