package tech.yump.gateway.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.ClientHttpRequestFactory;
import org.springframework.vault.authentication.SimpleSessionManager;
import org.springframework.vault.authentication.TokenAuthentication;
import org.springframework.vault.client.ClientHttpRequestFactoryFactory;
import org.springframework.vault.client.VaultEndpoint;
import org.springframework.vault.core.VaultTemplate;
import org.springframework.vault.support.ClientOptions;
import org.springframework.vault.support.SslConfiguration;

import java.net.URI;

@Configuration
@RequiredArgsConstructor
@Slf4j
public class VaultConfig {

    private final GatewayProperties gatewayProperties;

    @Bean
    public VaultTemplate vaultTemplate() {
        GatewayProperties.VaultProperties vaultProps = gatewayProperties.vault();

        VaultEndpoint endpoint = VaultEndpoint.from(URI.create(vaultProps.uri()));
        ClientOptions clientOptions = new ClientOptions(vaultProps.connectTimeout(), vaultProps.readTimeout());
        ClientHttpRequestFactory requestFactory =
                ClientHttpRequestFactoryFactory.create(clientOptions, SslConfiguration.unconfigured());

        // HTTP calls only happen on first use; nothing here contacts Vault.
        TokenAuthentication authentication = new TokenAuthentication(new String(vaultProps.token()));
        log.info("Configuring Vault client for {} (connect timeout {}, read timeout {})",
                endpoint, vaultProps.connectTimeout(), vaultProps.readTimeout());
        return new VaultTemplate(endpoint, requestFactory, new SimpleSessionManager(authentication));
    }
}
