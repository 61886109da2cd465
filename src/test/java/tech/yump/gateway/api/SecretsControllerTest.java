package tech.yump.gateway.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import tech.yump.gateway.api.dto.DynamicSecretResponse;
import tech.yump.gateway.api.dto.StaticSecretView;
import tech.yump.gateway.secrets.CredentialProviderException;
import tech.yump.gateway.service.DynamicCredentialService;
import tech.yump.gateway.service.StaticSecretService;

import java.time.Instant;
import java.util.Map;

import static org.hamcrest.Matchers.is;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class SecretsControllerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private StaticSecretService staticSecretService;

    @MockBean
    private DynamicCredentialService dynamicCredentialService;

    @Test
    @DisplayName("GET /secrets/all: Combines static secrets and dynamic credentials")
    void getAllSecrets() throws Exception {
        when(staticSecretService.listAll()).thenReturn(Map.of("app",
                new StaticSecretView("static_app_secrets", "manual", Map.of("log_level", "info"),
                        new StaticSecretView.VersionMetadata(2, NOW))));
        when(dynamicCredentialService.getAllCredentials()).thenReturn(Map.of("db_admin",
                new DynamicSecretResponse("dynamic_database_credentials", "automatic_1h", Map.of("username", "v-admin"),
                        new DynamicSecretResponse.Metadata(NOW, NOW.plusSeconds(3600), "successful", "cached"))));

        mockMvc.perform(get("/secrets/all"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.static_secrets.app.data.log_level", is("info")))
                .andExpect(jsonPath("$.dynamic_secrets.db_admin.data.username", is("v-admin")))
                .andExpect(jsonPath("$.dynamic_secrets.db_admin.metadata.connection_test", is("successful")))
                .andExpect(jsonPath("$.secrets").doesNotExist());
    }

    @Test
    @DisplayName("GET /secrets/all: A failing role fails the whole request with 502")
    void getAllSecrets_DynamicFailure() throws Exception {
        when(staticSecretService.listAll()).thenReturn(Map.of());
        when(dynamicCredentialService.getAllCredentials())
                .thenThrow(new CredentialProviderException("admin", "permission denied"));

        mockMvc.perform(get("/secrets/all"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.title", is("Secret Backend Error")));
    }
}
