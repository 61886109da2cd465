package tech.yump.gateway.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotEmpty;

import java.util.Map;

@Schema(description = "Key/value pairs of a new static secret.")
public record SecretsRequest(
        @Schema(example = "{\"client_id\": \"abc\", \"client_secret\": \"xyz\"}", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotEmpty(message = "secrets must contain at least one key")
        Map<String, Object> secrets
) {
}
