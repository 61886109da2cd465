package tech.yump.gateway.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.HttpHeaders;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import tech.yump.gateway.api.dto.HealthResponse;
import tech.yump.gateway.api.dto.VaultDebugResponse;
import tech.yump.gateway.secrets.SecretsEngineException;
import tech.yump.gateway.service.BackendStatusService;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.options;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class RootControllerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private BackendStatusService backendStatusService;

    @Test
    @DisplayName("GET /: Returns service name, version and endpoints")
    void root() throws Exception {
        mockMvc.perform(get("/"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message", is("Secrets Management API with Dynamic Rotation")))
                .andExpect(jsonPath("$.version", is("2.0.0")))
                .andExpect(jsonPath("$.endpoints.health", is("/health")))
                .andExpect(jsonPath("$.endpoints.dynamic_secrets", is("/secrets/dynamic-all")));
    }

    @Test
    @DisplayName("GET /health: A degraded backend still answers 200")
    void health_Degraded() throws Exception {
        Map<String, String> services = new LinkedHashMap<>();
        services.put("vault", "connected");
        services.put("database", "disconnected");
        services.put("backend", "running");
        when(backendStatusService.health()).thenReturn(new HealthResponse("degraded", true, false, NOW, services));

        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status", is("degraded")))
                .andExpect(jsonPath("$.vault_connected", is(true)))
                .andExpect(jsonPath("$.database_connected", is(false)))
                .andExpect(jsonPath("$.services.database", is("disconnected")))
                .andExpect(jsonPath("$.timestamp", is("2024-05-01T12:00:00Z")));
    }

    @Test
    @DisplayName("GET /debug/vault: Returns diagnostics; a Vault failure is 502")
    void debugVault() throws Exception {
        VaultDebugResponse debug = new VaultDebugResponse(true, List.of("database/", "secret/"), true,
                List.of("admin", "readonly"), 1, List.of("api"),
                Map.of("readonly", new VaultDebugResponse.CachedLeaseInfo(NOW, NOW.plusSeconds(3600), true, false)), NOW);
        when(backendStatusService.debugVault())
                .thenReturn(debug)
                .thenThrow(new SecretsEngineException("Failed to list secrets engines"));

        mockMvc.perform(get("/debug/vault"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.database_mounted", is(true)))
                .andExpect(jsonPath("$.database_roles", contains("admin", "readonly")))
                .andExpect(jsonPath("$.static_secrets_count", is(1)))
                .andExpect(jsonPath("$.cached_leases.readonly.fresh", is(true)))
                .andExpect(jsonPath("$.cached_leases.readonly.refresh_in_flight", is(false)));

        mockMvc.perform(get("/debug/vault"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.detail", is("Failed to list secrets engines")));
    }

    @Test
    @DisplayName("CORS: The configured origin is allowed, others are rejected")
    void corsPreflight() throws Exception {
        mockMvc.perform(options("/health")
                        .header(HttpHeaders.ORIGIN, "http://localhost:3000")
                        .header(HttpHeaders.ACCESS_CONTROL_REQUEST_METHOD, "GET"))
                .andExpect(status().isOk())
                .andExpect(header().string(HttpHeaders.ACCESS_CONTROL_ALLOW_ORIGIN, "http://localhost:3000"))
                .andExpect(header().string(HttpHeaders.ACCESS_CONTROL_ALLOW_CREDENTIALS, "true"));

        mockMvc.perform(options("/health")
                        .header(HttpHeaders.ORIGIN, "http://evil.example")
                        .header(HttpHeaders.ACCESS_CONTROL_REQUEST_METHOD, "GET"))
                .andExpect(status().isForbidden());
    }
}
