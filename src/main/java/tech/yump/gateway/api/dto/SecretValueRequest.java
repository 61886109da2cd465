package tech.yump.gateway.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;

@Schema(description = "New value for a single key of a static secret.")
public record SecretValueRequest(
        @Schema(example = "sk_live_abc123", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull(message = "value must be provided")
        String value
) {
}
