package tech.yump.rotator.audit;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.time.Instant;
import java.util.Map;

/**
 * A single audit log entry: who did what, against which request, and how it ended.
 * Serialized as one JSON line per event.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuditEvent(
        Instant timestamp,
        String type,            // e.g. "rotation", "rotation_request", "auth"
        String action,          // e.g. "rotate_secret", "preview", "token_validation"
        String outcome,         // "success", "failure", "skipped"

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
            Map<String, String> headers // non-sensitive only
    ) {}

    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ResponseInfo(
            int statusCode,
            String errorMessage
    ) {}
}
