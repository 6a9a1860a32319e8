package tech.yump.rotator.directory.graph;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;
import tech.yump.rotator.config.RotatorProperties;
import tech.yump.rotator.directory.CredentialDirectoryClient;
import tech.yump.rotator.directory.DirectoryUnavailableException;

import java.time.Clock;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class GraphDirectoryClientFactoryTest {

    private static final String BASE_URL = "https://graph.test/v1.0";

    @Test
    @DisplayName("forTenant: Should use the tenant's own token when one is configured")
    void usesTenantSpecificToken() {
        // Arrange
        RestClient.Builder builder = RestClient.builder();
        MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
        RotatorProperties.GraphProperties graph = new RotatorProperties.GraphProperties(
                BASE_URL, "shared-token", Map.of("tenant-1", "tenant-1-token"));
        GraphDirectoryClientFactory factory = new GraphDirectoryClientFactory(builder, graph, Clock.systemUTC());

        server.expect(requestTo(startsWith(BASE_URL + "/applications")))
                .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer tenant-1-token"))
                .andRespond(withSuccess("{\"value\":[]}", MediaType.APPLICATION_JSON));
        server.expect(requestTo(startsWith(BASE_URL + "/applications")))
                .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer shared-token"))
                .andRespond(withSuccess("{\"value\":[]}", MediaType.APPLICATION_JSON));

        // Act
        CredentialDirectoryClient tenantOne = factory.forTenant("tenant-1");
        CredentialDirectoryClient tenantTwo = factory.forTenant("tenant-2");
        tenantOne.listApplicationsWithCredentials();
        tenantTwo.listApplicationsWithCredentials();

        // Assert
        server.verify();
        assertThat(tenantOne).isInstanceOf(GraphCredentialDirectoryClient.class);
    }

    @Test
    @DisplayName("forTenant: Should fail when no token is available for the tenant")
    void failsWithoutToken() {
        // Arrange
        RotatorProperties.GraphProperties graph = new RotatorProperties.GraphProperties(
                BASE_URL, null, Map.of("tenant-1", "tenant-1-token"));
        GraphDirectoryClientFactory factory = new GraphDirectoryClientFactory(RestClient.builder(), graph, Clock.systemUTC());

        // Act & Assert
        assertThatThrownBy(() -> factory.forTenant("tenant-2"))
                .isInstanceOf(DirectoryUnavailableException.class)
                .hasMessageContaining("tenant-2");
    }
}
