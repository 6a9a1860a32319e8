package tech.yump.rotator.auth;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;
import tech.yump.rotator.audit.AuditHelper;
import tech.yump.rotator.config.RotatorProperties;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Tags every request with a request id and, when enabled, authenticates callers presenting a
 * configured static token. Requests without a valid token continue unauthenticated and are
 * rejected later by the security rules.
 */
@Slf4j
public class StaticTokenAuthFilter extends OncePerRequestFilter {

  public static final String TOKEN_HEADER = "X-Rotator-Token";
  public static final String REQUEST_ID_ATTR = "auditRequestId";
  public static final String MDC_REQUEST_ID_KEY = "requestId";
  public static final String ROTATOR_AUTHORITY = "ROLE_ROTATOR";

  private final boolean staticAuthEnabled;
  private final List<RotatorProperties.AuthProperties.StaticTokenMapping> tokenMappings;
  private final AuditHelper auditHelper;

  public StaticTokenAuthFilter(
          RotatorProperties.AuthProperties.StaticTokenAuthProperties staticTokenProps,
          AuditHelper auditHelper
  ) {
    this.staticAuthEnabled = staticTokenProps.enabled();
    this.tokenMappings = List.copyOf(staticTokenProps.mappings());
    this.auditHelper = auditHelper;

    log.debug("StaticTokenAuthFilter initialized. Enabled: {}, Mappings count: {}",
            this.staticAuthEnabled, this.tokenMappings.size());
  }

  @Override
  protected void doFilterInternal(
          @NonNull HttpServletRequest request,
          @NonNull HttpServletResponse response,
          @NonNull FilterChain filterChain) throws ServletException, IOException {

    String requestId = UUID.randomUUID().toString();
    request.setAttribute(REQUEST_ID_ATTR, requestId);
    MDC.put(MDC_REQUEST_ID_KEY, requestId);

    try {
      if (!staticAuthEnabled) {
        log.trace("Static token authentication is disabled via configuration. Skipping filter.");
        filterChain.doFilter(request, response);
        return;
      }

      final String tokenHeader = request.getHeader(TOKEN_HEADER);
      if (!StringUtils.hasText(tokenHeader) || SecurityContextHolder.getContext().getAuthentication() != null) {
        log.trace("No {} header found or authentication already present for {}. Proceeding.",
                TOKEN_HEADER, request.getRequestURI());
        filterChain.doFilter(request, response);
        return;
      }

      final String providedToken = tokenHeader.trim();
      Optional<RotatorProperties.AuthProperties.StaticTokenMapping> mapping = tokenMappings.stream()
              .filter(candidate -> providedToken.equals(candidate.token()))
              .findFirst();

      if (mapping.isPresent()) {
        UsernamePasswordAuthenticationToken authentication = new UsernamePasswordAuthenticationToken(
                mapping.get().name(),
                null,
                List.of(new SimpleGrantedAuthority(ROTATOR_AUTHORITY))
        );
        authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
        SecurityContextHolder.getContext().setAuthentication(authentication);
        log.info("Authenticated '{}' using static token for URI: {}", mapping.get().name(), request.getRequestURI());

        auditHelper.logInternalEvent("auth", "token_validation", "success", mapping.get().name(),
                Map.of("path", request.getRequestURI(), "request_id", requestId));
      } else {
        log.warn("Invalid or unknown static token received for URI: {}", request.getRequestURI());
        auditHelper.logInternalEvent("auth", "token_validation", "failure", "anonymous",
                Map.of("path", request.getRequestURI(), "request_id", requestId, "reason", "invalid_token"));
      }

      filterChain.doFilter(request, response);
    } finally {
      MDC.remove(MDC_REQUEST_ID_KEY);
    }
  }
}
