package com.salesdesk.backend.modules.ldap.infrastructure;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.List;

import com.salesdesk.backend.modules.ldap.domain.DirectoryEntry;
import com.salesdesk.backend.modules.ldap.domain.LdapUserFilter;
import com.salesdesk.backend.support.InMemoryDirectory;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.ldap.core.support.LdapContextSource;

class SpringLdapDirectoryClientTest {

    private static final String JANE_DN = "cn=Jane Doe,ou=people,dc=example,dc=com";

    private final LdapClientConfig config = new LdapClientConfig();

    private InMemoryDirectory directory;
    private LdapProperties properties;

    @BeforeEach
    void setUp() {
        directory = InMemoryDirectory.start();
        properties = new LdapProperties();
        properties.setHost("localhost");
        properties.setPort(directory.port());
        properties.setBaseDn(InMemoryDirectory.BASE_DN);
        properties.setUsername(InMemoryDirectory.SERVICE_DN);
        properties.setPassword(InMemoryDirectory.SERVICE_PASSWORD);
        properties.setConnectTimeout(Duration.ofSeconds(2));
        properties.setReadTimeout(Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() {
        directory.stop();
    }

    @Test
    void serviceBindSucceedsWithConfiguredCredentials() {
        DirectoryClient client = client();

        assertThatCode(client::bind).doesNotThrowAnyException();
        assertThat(client.describe()).isEqualTo(directory.url());
    }

    @Test
    void serviceBindFailsWithWrongPassword() {
        properties.setPassword("wrong");

        assertThatThrownBy(() -> client().bind()).isInstanceOf(DirectoryException.class);
    }

    @Test
    void serviceBindFailsWhenServerIsDown() {
        DirectoryClient client = client();
        directory.stop();

        assertThatThrownBy(client::bind)
                .isInstanceOf(DirectoryException.class)
                .hasMessageContaining(directory.url());
    }

    @Test
    void searchReturnsEntryWithFullDnAndStringAttributes() {
        DirectoryClient client = client();
        String filter = LdapUserFilter.build("person", "sAMAccountName", "jdoe", null);

        List<DirectoryEntry> result = client.search(filter, null, DirectorySearchScope.SUBTREE);

        assertThat(result).hasSize(1);
        DirectoryEntry jane = result.get(0);
        assertThat(jane.dn()).isEqualToIgnoringCase(JANE_DN);
        assertThat(jane.firstValue("givenname")).contains("Jane");
        assertThat(jane.firstValue("SN")).contains("Doe");
        assertThat(jane.firstValue("mail")).contains("jane.doe@example.com");
        assertThat(jane.firstValue("telephoneNumber")).contains("+1 555 0100");
    }

    @Test
    void searchAppliesLoginFilter() {
        DirectoryClient client = client();

        String salesOnly = LdapUserFilter.build("person", "sAMAccountName", "mroe",
                "memberOf=cn=sales,ou=groups,dc=example,dc=com");
        String supportOnly = LdapUserFilter.build("person", "sAMAccountName", "mroe",
                "(memberOf=cn=support,ou=groups,dc=example,dc=com)");

        assertThat(client.search(salesOnly, null, DirectorySearchScope.SUBTREE)).isEmpty();
        assertThat(client.search(supportOnly, null, DirectorySearchScope.SUBTREE)).hasSize(1);
    }

    @Test
    void oneLevelSearchUnderBaseDoesNotReachPeople() {
        DirectoryClient client = client();
        String filter = LdapUserFilter.build("person", "sAMAccountName", "jdoe", null);

        assertThat(client.search(filter, null, DirectorySearchScope.ONE_LEVEL)).isEmpty();
        assertThat(client.search(filter, "ou=people", DirectorySearchScope.ONE_LEVEL)).hasSize(1);
    }

    @Test
    void userBindChecksPassword() {
        DirectoryClient client = client();

        assertThatCode(() -> client.bind(JANE_DN, "jane-secret")).doesNotThrowAnyException();
        assertThatThrownBy(() -> client.bind(JANE_DN, "wrong")).isInstanceOf(DirectoryException.class);
    }

    @Test
    void userBindRejectsEmptyPasswordWithoutContactingServer() {
        DirectoryClient client = client();
        directory.stop();

        assertThatThrownBy(() -> client.bind(JANE_DN, ""))
                .isInstanceOf(DirectoryException.class)
                .hasMessageContaining("Empty password");
    }

    private DirectoryClient client() {
        LdapContextSource contextSource = config.directoryContextSource(properties);
        contextSource.afterPropertiesSet();
        return config.directoryClient(contextSource, properties);
    }
}
