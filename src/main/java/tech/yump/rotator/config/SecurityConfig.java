package tech.yump.rotator.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;
import tech.yump.rotator.audit.AuditHelper;
import tech.yump.rotator.auth.StaticTokenAuthFilter;

@Configuration
@EnableWebSecurity
@RequiredArgsConstructor
@Slf4j
public class SecurityConfig {

  private final RotatorProperties rotatorProperties;
  private final AuditHelper auditHelper;

  @Bean
  public StaticTokenAuthFilter staticTokenAuthFilter() {
    return new StaticTokenAuthFilter(rotatorProperties.auth().staticTokens(), auditHelper);
  }

  @Bean
  public SecurityFilterChain securityFilterChain(HttpSecurity http, StaticTokenAuthFilter staticTokenAuthFilter) throws Exception {
    http
            .csrf(AbstractHttpConfigurer::disable)
            .formLogin(AbstractHttpConfigurer::disable)
            .httpBasic(AbstractHttpConfigurer::disable)
            .logout(AbstractHttpConfigurer::disable)
            .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
            .addFilterBefore(staticTokenAuthFilter, UsernamePasswordAuthenticationFilter.class);

    if (rotatorProperties.auth().staticTokens().enabled()) {
      log.info("Configuring Spring Security for Static Token Authentication.");
      http.authorizeHttpRequests(authz -> authz
              .requestMatchers("/", "/error").permitAll()
              .requestMatchers("/actuator/health/**", "/v3/api-docs/**", "/swagger-ui/**", "/swagger-ui.html").permitAll()
              .requestMatchers("/v1/**").hasAuthority(StaticTokenAuthFilter.ROTATOR_AUTHORITY)
              .anyRequest().authenticated()
      );
    } else {
      log.warn("Static Token Authentication is disabled via configuration (rotator.auth.static-tokens.enabled=false). All API endpoints are accessible without authentication. THIS IS INSECURE FOR PRODUCTION.");
      http.authorizeHttpRequests(authz -> authz.anyRequest().permitAll());
    }

    return http.build();
  }
}
