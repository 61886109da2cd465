package tech.yump.gateway.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;
import java.util.Map;

@Schema(description = "Result of a change to a static secret.")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SecretMutationResponse(
        @Schema(example = "success", requiredMode = Schema.RequiredMode.REQUIRED)
        String status,

        @Schema(example = "Key 'log_level' updated in app", requiredMode = Schema.RequiredMode.REQUIRED)
        String message,

        @Schema(description = "Data written by the operation.")
        Map<String, Object> data,

        @Schema(description = "Keys left in the secret after a key was deleted.")
        @JsonProperty("remaining_keys")
        List<String> remainingKeys,

        @Schema(description = "Version metadata of a newly created secret.")
        StaticSecretView.VersionMetadata metadata
) {

    public static SecretMutationResponse success(String message) {
        return new SecretMutationResponse("success", message, null, null, null);
    }

    public static SecretMutationResponse withData(String message, Map<String, Object> data) {
        return new SecretMutationResponse("success", message, data, null, null);
    }
}
