package tech.yump.gateway.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

public record HealthResponse(
        String status,
        @JsonProperty("vault_connected") boolean vaultConnected,
        @JsonProperty("database_connected") boolean databaseConnected,
        Instant timestamp,
        Map<String, String> services
) {
}
