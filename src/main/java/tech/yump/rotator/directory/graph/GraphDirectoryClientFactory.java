package tech.yump.rotator.directory.graph;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import tech.yump.rotator.config.RotatorProperties;
import tech.yump.rotator.directory.CredentialDirectoryClient;
import tech.yump.rotator.directory.CredentialDirectoryClientFactory;
import tech.yump.rotator.directory.DirectoryUnavailableException;

import java.time.Clock;

/**
 * Builds one {@link GraphCredentialDirectoryClient} per tenant, authenticated with the tenant's
 * configured bearer token.
 */
@Slf4j
public class GraphDirectoryClientFactory implements CredentialDirectoryClientFactory {

    private final RestClient.Builder restClientBuilder;
    private final RotatorProperties.GraphProperties graphProperties;
    private final Clock clock;

    public GraphDirectoryClientFactory(
            RestClient.Builder restClientBuilder,
            RotatorProperties.GraphProperties graphProperties,
            Clock clock) {
        this.restClientBuilder = restClientBuilder;
        this.graphProperties = graphProperties;
        this.clock = clock;
    }

    @Override
    public CredentialDirectoryClient forTenant(String tenantId) {
        String accessToken = graphProperties.accessTokenFor(tenantId);
        if (!StringUtils.hasText(accessToken)) {
            log.error("No Graph access token configured for tenant '{}'", tenantId);
            throw new DirectoryUnavailableException("No Graph access token configured for tenant " + tenantId);
        }
        log.debug("Creating Graph directory client for tenant '{}' at {}", tenantId, graphProperties.baseUrl());
        RestClient restClient = restClientBuilder.clone()
                .baseUrl(graphProperties.baseUrl())
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + accessToken)
                .build();
        return new GraphCredentialDirectoryClient(restClient, tenantId, clock);
    }
}
