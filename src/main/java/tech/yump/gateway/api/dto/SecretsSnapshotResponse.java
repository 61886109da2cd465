package tech.yump.gateway.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

/**
 * Listing of static and/or dynamic secrets at one point in time.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SecretsSnapshotResponse(
        Instant timestamp,
        Map<String, ?> secrets,
        @JsonProperty("static_secrets") Map<String, StaticSecretView> staticSecrets,
        @JsonProperty("dynamic_secrets") Map<String, DynamicSecretResponse> dynamicSecrets
) {

    public static SecretsSnapshotResponse of(Instant timestamp, Map<String, ?> secrets) {
        return new SecretsSnapshotResponse(timestamp, secrets, null, null);
    }

    public static SecretsSnapshotResponse combined(Instant timestamp,
                                                   Map<String, StaticSecretView> staticSecrets,
                                                   Map<String, DynamicSecretResponse> dynamicSecrets) {
        return new SecretsSnapshotResponse(timestamp, null, staticSecrets, dynamicSecrets);
    }
}
