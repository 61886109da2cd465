package tech.yump.gateway.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record VaultDebugResponse(
        @JsonProperty("vault_connected") boolean vaultConnected,
        @JsonProperty("secrets_engines") List<String> secretsEngines,
        @JsonProperty("database_mounted") boolean databaseMounted,
        @JsonProperty("database_roles") List<String> databaseRoles,
        @JsonProperty("static_secrets_count") int staticSecretsCount,
        @JsonProperty("static_secrets_types") List<String> staticSecretsTypes,
        @JsonProperty("cached_leases") Map<String, CachedLeaseInfo> cachedLeases,
        Instant timestamp
) {

    public record CachedLeaseInfo(
            @JsonProperty("issued_at") Instant issuedAt,
            @JsonProperty("expires_at") Instant expiresAt,
            boolean fresh,
            @JsonProperty("refresh_in_flight") boolean refreshInFlight
    ) {}
}
