package tech.yump.rotator.audit;

import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;
import tech.yump.rotator.auth.StaticTokenAuthFilter;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

@Component
@RequiredArgsConstructor
@Slf4j
public class AuditHelper {

    private final AuditBackend auditBackend;

    /**
     * Logs the outcome of an HTTP request. Authentication and request details are taken from the
     * current security context and request, when present.
     *
     * @param type         The type of event (e.g., "rotation_request").
     * @param action       The specific action performed (e.g., "preview", "create_or_update").
     * @param outcome      The result ("success" or "failure").
     * @param statusCode   The HTTP status code associated with the outcome.
     * @param errorMessage Optional error message (for failures).
     * @param data         Optional map containing context-specific data.
     */
    public void logHttpEvent(
            String type,
            String action,
            String outcome,
            int statusCode,
            @Nullable String errorMessage,
            @Nullable Map<String, Object> data) {

        HttpServletRequest request = getCurrentHttpRequest();
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();

        AuditEvent.AuthInfo authInfo = buildAuthInfo(authentication, request);
        AuditEvent.RequestInfo requestInfo = buildRequestInfo(request);
        AuditEvent.ResponseInfo responseInfo = AuditEvent.ResponseInfo.builder()
                .statusCode(statusCode)
                .errorMessage(errorMessage)
                .build();

        logEventInternal(type, action, outcome, authInfo, requestInfo, responseInfo, data);
    }

    /**
     * Logs an event raised by internal processing, such as a single credential rotation.
     * The principal falls back to the authenticated caller, then to "system".
     *
     * @param type      The type of event (e.g., "rotation").
     * @param action    The specific action performed (e.g., "rotate_secret", "delete_secret").
     * @param outcome   The result ("success", "failure" or "skipped").
     * @param principal Optional principal identifier if known.
     * @param data      Optional map containing context-specific data.
     */
    public void logInternalEvent(
            String type,
            String action,
            String outcome,
            @Nullable String principal,
            @Nullable Map<String, Object> data) {

        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        String effectivePrincipal = Optional.ofNullable(principal)
                .orElseGet(() -> isAuthenticatedCaller(authentication) ? authentication.getName() : "system");

        AuditEvent.AuthInfo authInfo = AuditEvent.AuthInfo.builder()
                .principal(effectivePrincipal)
                .build();

        logEventInternal(type, action, outcome, authInfo, null, null, data);
    }

    private void logEventInternal(
            String type,
            String action,
            String outcome,
            @Nullable AuditEvent.AuthInfo authInfo,
            @Nullable AuditEvent.RequestInfo requestInfo,
            @Nullable AuditEvent.ResponseInfo responseInfo,
            @Nullable Map<String, Object> data) {
        try {
            AuditEvent auditEvent = AuditEvent.builder()
                    .timestamp(Instant.now())
                    .type(type)
                    .action(action)
                    .outcome(outcome)
                    .authInfo(authInfo)
                    .requestInfo(requestInfo)
                    .responseInfo(responseInfo)
                    .data(data != null && !data.isEmpty() ? data : null)
                    .build();

            auditBackend.logEvent(auditEvent);

        } catch (Exception e) {
            // Auditing must never break the operation being audited.
            log.error("Failed to log audit event in AuditHelper: Type={}, Action={}, Outcome={}, Error={}",
                    type, action, outcome, e.getMessage(), e);
        }
    }

    @Nullable
    private HttpServletRequest getCurrentHttpRequest() {
        return Optional.ofNullable(RequestContextHolder.getRequestAttributes())
                .filter(ServletRequestAttributes.class::isInstance)
                .map(ServletRequestAttributes.class::cast)
                .map(ServletRequestAttributes::getRequest)
                .orElse(null);
    }

    private static boolean isAuthenticatedCaller(@Nullable Authentication authentication) {
        return authentication != null
                && authentication.isAuthenticated()
                && !"anonymousUser".equals(authentication.getPrincipal());
    }

    private AuditEvent.AuthInfo buildAuthInfo(@Nullable Authentication authentication, @Nullable HttpServletRequest request) {
        return AuditEvent.AuthInfo.builder()
                .sourceAddress(request != null ? request.getRemoteAddr() : "unknown")
                .principal(isAuthenticatedCaller(authentication) ? authentication.getName() : "anonymous")
                .build();
    }

    @Nullable
    private AuditEvent.RequestInfo buildRequestInfo(@Nullable HttpServletRequest request) {
        if (request == null) {
            return null;
        }
        return AuditEvent.RequestInfo.builder()
                .requestId((String) request.getAttribute(StaticTokenAuthFilter.REQUEST_ID_ATTR))
                .httpMethod(request.getMethod())
                .path(request.getRequestURI())
                .headers(Map.of("User-Agent", Optional.ofNullable(request.getHeader("User-Agent")).orElse("N/A")))
                .build();
    }
}
