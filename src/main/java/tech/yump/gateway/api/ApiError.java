package tech.yump.gateway.api;

import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Schema-only description of the RFC 7807 problem bodies returned on errors.
 */
@Schema(description = "Problem details error response")
public record ApiError(
        @Schema(description = "Short error title.", example = "Secret Backend Error", requiredMode = Schema.RequiredMode.REQUIRED)
        String title,
        @Schema(description = "HTTP status code.", example = "502", requiredMode = Schema.RequiredMode.REQUIRED)
        int status,
        @Schema(description = "Detailed error message.", example = "Failed to issue credentials for role 'readonly'", requiredMode = Schema.RequiredMode.REQUIRED)
        String detail,
        @Schema(description = "Request path.", example = "/secrets/dynamic/readonly")
        String instance
) {
}
