package tech.yump.gateway.secrets.kv;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.vault.authentication.TokenAuthentication;
import org.springframework.vault.client.VaultEndpoint;
import org.springframework.vault.core.VaultTemplate;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.vault.VaultContainer;
import tech.yump.gateway.config.GatewayProperties;
import tech.yump.gateway.config.TestGatewayProperties;

import java.net.URI;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs the KV store against a Vault dev server, whose "secret/" mount is a KV version 2 engine.
 */
@Testcontainers(disabledWithoutDocker = true)
class VaultKvStaticSecretStoreIntegrationTest {

    private static final String ROOT_TOKEN = "test-root-token";

    @Container
    static VaultContainer<?> vaultContainer = new VaultContainer<>("hashicorp/vault:1.15")
            .withVaultToken(ROOT_TOKEN);

    private VaultKvStaticSecretStore store;

    @BeforeEach
    void setUp() {
        VaultTemplate vaultTemplate = new VaultTemplate(
                VaultEndpoint.from(URI.create(vaultContainer.getHttpHostAddress())),
                new TokenAuthentication(ROOT_TOKEN));
        GatewayProperties properties = TestGatewayProperties.defaults();
        store = new VaultKvStaticSecretStore(vaultTemplate, properties);
    }

    @Test
    @DisplayName("Writes create new versions, reads return the latest one, destroy removes everything")
    void writeReadDestroy() {
        String name = "it-" + UUID.randomUUID().toString().substring(0, 8);

        StaticSecretVersion v1 = store.write(name, Map.of("stripe_api", "sk_test_1"));
        StaticSecretVersion v2 = store.write(name, Map.of("stripe_api", "sk_test_2", "sendgrid_api", "SG.x"));

        assertThat(v1.version()).isEqualTo(1);
        assertThat(v2.version()).isEqualTo(2);

        StaticSecret latest = store.read(name).orElseThrow();
        assertThat(latest.version()).isEqualTo(2);
        assertThat(latest.data()).containsEntry("stripe_api", "sk_test_2").containsKey("sendgrid_api");
        assertThat(latest.createdTime()).isNotNull();
        assertThat(store.list()).contains(name);

        store.destroy(name);

        assertThat(store.read(name)).isEmpty();
        assertThat(store.list()).doesNotContain(name);
    }
}
