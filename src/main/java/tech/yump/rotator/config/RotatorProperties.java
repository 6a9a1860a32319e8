package tech.yump.rotator.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the secret rotator under the 'rotator' prefix.
 */
@ConfigurationProperties(prefix = "rotator")
@Validated
public record RotatorProperties(

        @Valid
        AuthProperties auth,

        @Valid
        DirectoryProperties directory,

        @Valid
        AuditProperties audit
) {

    public RotatorProperties {
        if (auth == null) {
            auth = new AuthProperties(null);
        }
        if (directory == null) {
            directory = new DirectoryProperties(null, null);
        }
        if (audit == null) {
            audit = new AuditProperties(null, null);
        }
    }

    // --- AuthProperties ---
    @Validated
    public record AuthProperties(
            @Valid
            StaticTokenAuthProperties staticTokens
    ) {

        public AuthProperties {
            if (staticTokens == null) {
                staticTokens = new StaticTokenAuthProperties(false, null);
            }
        }

        @Validated
        public record StaticTokenMapping(
                @NotBlank(message = "Static token value cannot be blank")
                String token,

                @NotBlank(message = "Static token must have a principal name")
                String name
        ) {
            @Override
            public String toString() {
                return "StaticTokenMapping[token=******, name='" + name + "']";
            }
        }

        /**
         * Static token authentication for the /v1 API. Mappings are mandatory once enabled.
         */
        @Validated
        public record StaticTokenAuthProperties(
                boolean enabled,

                @Valid
                List<StaticTokenMapping> mappings
        ) {
            public StaticTokenAuthProperties {
                if (mappings == null) {
                    mappings = Collections.emptyList();
                }
            }

            @AssertTrue(message = "Static token mappings (rotator.auth.static-tokens.mappings) cannot be empty when static token auth is enabled.")
            public boolean isMappingsValid() {
                return !this.enabled() || !this.mappings().isEmpty();
            }
        }
    }

    /**
     * Which directory implementation serves the tenants.
     */
    public enum DirectoryBackend {
        GRAPH, IN_MEMORY
    }

    // --- DirectoryProperties ---
    @Validated
    public record DirectoryProperties(
            DirectoryBackend backend,

            @Valid
            GraphProperties graph
    ) {
        public DirectoryProperties {
            if (backend == null) {
                backend = DirectoryBackend.GRAPH;
            }
            if (graph == null) {
                graph = new GraphProperties(null, null, null);
            }
        }

        @AssertTrue(message = "A Graph access token (rotator.directory.graph.access-token or rotator.directory.graph.tenant-access-tokens) must be provided when the graph backend is selected.")
        public boolean isGraphConfigValid() {
            return backend != DirectoryBackend.GRAPH || graph.hasAnyAccessToken();
        }
    }

    /**
     * Microsoft Graph connection. Tokens are used as given; acquiring them is left to the deployment.
     */
    @Validated
    public record GraphProperties(
            @NotBlank(message = "Graph base URL (rotator.directory.graph.base-url) must not be blank.")
            String baseUrl,

            String accessToken,

            Map<String, String> tenantAccessTokens
    ) {
        public static final String DEFAULT_BASE_URL = "https://graph.microsoft.com/v1.0";

        public GraphProperties {
            if (baseUrl == null) {
                baseUrl = DEFAULT_BASE_URL;
            }
            if (tenantAccessTokens == null) {
                tenantAccessTokens = Collections.emptyMap();
            }
        }

        public boolean hasAnyAccessToken() {
            return StringUtils.hasText(accessToken) || !tenantAccessTokens.isEmpty();
        }

        /**
         * Token for the given tenant, falling back to the shared token.
         */
        public String accessTokenFor(String tenantId) {
            return tenantAccessTokens.getOrDefault(tenantId, accessToken);
        }

        @Override
        public String toString() {
            // Avoid logging tokens in toString()
            return "GraphProperties[" +
                    "baseUrl='" + baseUrl + '\'' +
                    ", accessToken=" + (accessToken == null ? "null" : "******") +
                    ", tenantAccessTokens=" + tenantAccessTokens.keySet() +
                    ']';
        }
    }

    // --- AuditProperties ---
    @Validated
    public record AuditProperties(
            @Pattern(regexp = "slf4j|file", message = "Audit backend (rotator.audit.backend) must be 'slf4j' or 'file'.")
            String backend,

            @Valid
            FileAuditProperties file
    ) {
        public AuditProperties {
            if (backend == null) {
                backend = "slf4j";
            }
        }

        @Validated
        public record FileAuditProperties(
                String path
        ) {
            public static final String PATH_PROPERTY = "rotator.audit.file.path";
        }
    }
}
