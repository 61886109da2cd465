package tech.yump.gateway.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;
import java.util.Map;

@Schema(description = "Dynamically issued database credentials with their lease information.")
public record DynamicSecretResponse(
        @Schema(description = "Kind of dynamic secret.", example = "dynamic_database_credentials", requiredMode = Schema.RequiredMode.REQUIRED)
        @JsonProperty("secret_type")
        String secretType,

        @Schema(description = "Rotation policy of the credentials.", example = "automatic_1h", requiredMode = Schema.RequiredMode.REQUIRED)
        String rotation,

        @Schema(description = "Credential fields issued by Vault plus connection info, lease_duration and renewable.",
                example = "{\"username\": \"v-token-readonly-abc\", \"password\": \"A1b2-C3d4\", \"lease_duration\": 3600, \"renewable\": true}",
                requiredMode = Schema.RequiredMode.REQUIRED)
        Map<String, Object> data,

        @Schema(requiredMode = Schema.RequiredMode.REQUIRED)
        Metadata metadata
) {

    @Schema(description = "Lease timing and gateway-side status of the credentials.")
    public record Metadata(
            @Schema(description = "When the credentials were issued.")
            @JsonProperty("generated_at")
            Instant generatedAt,

            @Schema(description = "When the lease of the credentials expires.")
            @JsonProperty("expires_at")
            Instant expiresAt,

            @Schema(description = "Result of logging in with the credentials.", allowableValues = {"successful", "failed", "skipped"})
            @JsonProperty("connection_test")
            String connectionTest,

            @Schema(description = "Whether the credentials came from the gateway cache.", allowableValues = {"new_credentials", "cached"})
            @JsonProperty("cache_status")
            String cacheStatus
    ) {}
}
