package tech.yump.gateway.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import tech.yump.gateway.secrets.kv.StaticSecret;

import java.time.Instant;
import java.util.Map;

@Schema(description = "Latest version of a static key/value secret.")
public record StaticSecretView(
        @Schema(example = "static_api_secrets", requiredMode = Schema.RequiredMode.REQUIRED)
        @JsonProperty("secret_type")
        String secretType,

        @Schema(example = "manual", requiredMode = Schema.RequiredMode.REQUIRED)
        String rotation,

        @Schema(example = "{\"stripe_api\": \"sk_test_12345\"}", requiredMode = Schema.RequiredMode.REQUIRED)
        Map<String, Object> data,

        @Schema(requiredMode = Schema.RequiredMode.REQUIRED)
        VersionMetadata metadata
) {

    public static StaticSecretView from(StaticSecret secret) {
        return new StaticSecretView(
                "static_" + secret.name() + "_secrets",
                "manual",
                secret.data(),
                new VersionMetadata(secret.version(), secret.createdTime())
        );
    }

    public record VersionMetadata(
            @Schema(description = "Version number of the secret.", example = "3")
            int version,

            @Schema(description = "When this version was written.")
            @JsonProperty("created_time")
            Instant createdTime
    ) {}
}
