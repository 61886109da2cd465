package tech.yump.gateway.audit;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.time.Instant;
import java.util.Map;

/**
 * A single audit log entry: who called which gateway operation, on what, and with what outcome.
 * Serialized as one JSON object per event. Never carries secret values.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuditEvent(
        Instant timestamp,
        String type,            // e.g. "dynamic_credentials", "static_secret", "probe"
        String action,          // e.g. "resolve", "create_key", "delete_secret"
        String outcome,         // "success" or "failure"
        AuthInfo authInfo,
        RequestInfo requestInfo,
        ResponseInfo responseInfo,
        Map<String, Object> data
) {

    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record AuthInfo(
            String principal,
            String sourceAddress
    ) {}

    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record RequestInfo(
            String requestId,
            String httpMethod,
            String path,
            Map<String, String> headers // non-sensitive headers only
    ) {}

    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ResponseInfo(
            int statusCode,
            String errorMessage
    ) {}
}
