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
import tech.yump.gateway.secrets.CredentialProviderException;
import tech.yump.gateway.secrets.LeaseWaitInterruptedException;
import tech.yump.gateway.secrets.RoleNotFoundException;
import tech.yump.gateway.service.DynamicCredentialService;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.notNullValue;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class DynamicSecretsControllerTest {

    private static final Instant ISSUED = Instant.parse("2024-01-01T00:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private DynamicCredentialService dynamicCredentialService;

    private static DynamicSecretResponse readonlyResponse(String cacheStatus) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("username", "v-token-readonly-x1");
        data.put("password", "A1a-pass");
        data.put("host", "postgres");
        data.put("port", "5432");
        data.put("database", "devdb");
        data.put("lease_duration", 3600L);
        data.put("renewable", true);
        return new DynamicSecretResponse("dynamic_database_credentials", "automatic_1h", data,
                new DynamicSecretResponse.Metadata(ISSUED, ISSUED.plusSeconds(3600), "skipped", cacheStatus));
    }

    @Test
    @DisplayName("GET /secrets/dynamic/{role}: Returns credentials with snake_case metadata")
    void getDynamicCredentials_Success() throws Exception {
        when(dynamicCredentialService.getCredentials("readonly")).thenReturn(readonlyResponse("cached"));

        mockMvc.perform(get("/secrets/dynamic/readonly"))
                .andExpect(status().isOk())
                .andExpect(header().exists("X-Request-Id"))
                .andExpect(jsonPath("$.secret_type", is("dynamic_database_credentials")))
                .andExpect(jsonPath("$.rotation", is("automatic_1h")))
                .andExpect(jsonPath("$.data.username", is("v-token-readonly-x1")))
                .andExpect(jsonPath("$.data.lease_duration", is(3600)))
                .andExpect(jsonPath("$.data.renewable", is(true)))
                .andExpect(jsonPath("$.metadata.generated_at", is("2024-01-01T00:00:00Z")))
                .andExpect(jsonPath("$.metadata.expires_at", is("2024-01-01T01:00:00Z")))
                .andExpect(jsonPath("$.metadata.cache_status", is("cached")))
                .andExpect(jsonPath("$.metadata.connection_test", is("skipped")));
    }

    @Test
    @DisplayName("GET /secrets/dynamic/{role}: Unknown role is 404")
    void getDynamicCredentials_UnknownRole() throws Exception {
        when(dynamicCredentialService.getCredentials("superuser")).thenThrow(new RoleNotFoundException("superuser"));

        mockMvc.perform(get("/secrets/dynamic/superuser"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.title", is("Role Not Found")))
                .andExpect(jsonPath("$.detail", is("Role not found or configured: superuser")));
    }

    @Test
    @DisplayName("GET /secrets/dynamic/{role}: Backend failure is 502")
    void getDynamicCredentials_ProviderFailure() throws Exception {
        when(dynamicCredentialService.getCredentials("readonly"))
                .thenThrow(new CredentialProviderException("readonly", "Vault is sealed"));

        mockMvc.perform(get("/secrets/dynamic/readonly"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.title", is("Secret Backend Error")))
                .andExpect(jsonPath("$.status", is(502)));
    }

    @Test
    @DisplayName("GET /secrets/dynamic/{role}: Interrupted wait is 503")
    void getDynamicCredentials_Interrupted() throws Exception {
        when(dynamicCredentialService.getCredentials("readonly"))
                .thenThrow(new LeaseWaitInterruptedException("readonly", new InterruptedException()));

        mockMvc.perform(get("/secrets/dynamic/readonly"))
                .andExpect(status().isServiceUnavailable());
    }

    @Test
    @DisplayName("GET /secrets/dynamic-all: Returns every role keyed by response key")
    void getAllDynamicCredentials() throws Exception {
        when(dynamicCredentialService.getAllCredentials()).thenReturn(Map.of("db_readonly", readonlyResponse("new_credentials")));
        when(dynamicCredentialService.configuredRoles()).thenReturn(Set.of("readonly"));

        mockMvc.perform(get("/secrets/dynamic-all"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.timestamp", notNullValue()))
                .andExpect(jsonPath("$.secrets.db_readonly.metadata.cache_status", is("new_credentials")))
                .andExpect(jsonPath("$.static_secrets").doesNotExist());
    }
}
