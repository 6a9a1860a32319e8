package tech.yump.rotator.directory.graph;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import tech.yump.rotator.directory.ApplicationCredentialSet;
import tech.yump.rotator.directory.Credential;
import tech.yump.rotator.directory.CredentialDirectoryClient;
import tech.yump.rotator.directory.DirectoryUnavailableException;
import tech.yump.rotator.directory.DirectoryWriteException;
import tech.yump.rotator.directory.IssuedCredential;

import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Directory client backed by the Microsoft Graph {@code /applications} API of one tenant.
 */
@Slf4j
public class GraphCredentialDirectoryClient implements CredentialDirectoryClient {

    static final String APPLICATIONS_URI = "/applications?$select=id,displayName,passwordCredentials";
    static final String ADD_PASSWORD_URI = "/applications/{id}/addPassword";
    static final String REMOVE_PASSWORD_URI = "/applications/{id}/removePassword";

    private final RestClient restClient;
    private final String tenantId;
    private final Clock clock;

    public GraphCredentialDirectoryClient(RestClient restClient, String tenantId, Clock clock) {
        this.restClient = restClient;
        this.tenantId = tenantId;
        this.clock = clock;
    }

    @Override
    public List<ApplicationCredentialSet> listApplicationsWithCredentials() {
        log.debug("Listing applications with password credentials for tenant '{}'", tenantId);
        List<ApplicationCredentialSet> applications = new ArrayList<>();
        try {
            GraphModels.ApplicationPage page = restClient.get()
                    .uri(APPLICATIONS_URI)
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .body(GraphModels.ApplicationPage.class);
            int pages = 0;
            while (page != null) {
                pages++;
                if (page.value() != null) {
                    page.value().stream()
                            .map(this::toApplicationCredentialSet)
                            .filter(Objects::nonNull)
                            .forEach(applications::add);
                }
                if (page.nextLink() == null) {
                    break;
                }
                page = restClient.get()
                        .uri(nextPageUri(page.nextLink()))
                        .accept(MediaType.APPLICATION_JSON)
                        .retrieve()
                        .body(GraphModels.ApplicationPage.class);
            }
            log.debug("Read {} applications in {} page(s) for tenant '{}'", applications.size(), pages, tenantId);
        } catch (RestClientException e) {
            log.error("Failed to list applications for tenant '{}': {}", tenantId, e.getMessage());
            throw new DirectoryUnavailableException("Failed to list applications for tenant " + tenantId, e);
        }
        return applications;
    }

    @Override
    public IssuedCredential createCredential(String applicationId, String credentialName, int expiresInDays) {
        OffsetDateTime endDateTime = OffsetDateTime.now(clock.withZone(ZoneOffset.UTC)).plusDays(expiresInDays);
        log.debug("Adding password '{}' to application {} (tenant '{}'), expiring {}",
                credentialName, applicationId, tenantId, endDateTime);

        GraphModels.PasswordCredential created;
        try {
            created = restClient.post()
                    .uri(ADD_PASSWORD_URI, applicationId)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(new GraphModels.AddPasswordRequest(
                            GraphModels.PasswordCredential.request(credentialName, endDateTime)))
                    .retrieve()
                    .body(GraphModels.PasswordCredential.class);
        } catch (RestClientException e) {
            log.error("Failed to add password '{}' to application {}: {}", credentialName, applicationId, e.getMessage());
            throw new DirectoryWriteException(
                    "Failed to create credential '" + credentialName + "' on application " + applicationId, e);
        }

        if (created == null || created.secretText() == null || created.endDateTime() == null) {
            throw new DirectoryWriteException(
                    "Directory returned an incomplete credential for '" + credentialName + "' on application " + applicationId);
        }
        return new IssuedCredential(
                created.keyId(),
                created.secretText(),
                created.startDateTime() != null ? created.startDateTime().toInstant() : clock.instant(),
                created.endDateTime().toInstant()
        );
    }

    @Override
    public void deleteCredential(String applicationId, UUID keyId) {
        log.debug("Removing password {} from application {} (tenant '{}')", keyId, applicationId, tenantId);
        try {
            restClient.post()
                    .uri(REMOVE_PASSWORD_URI, applicationId)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(new GraphModels.RemovePasswordRequest(keyId))
                    .retrieve()
                    .toBodilessEntity();
        } catch (RestClientException e) {
            log.error("Failed to remove password {} from application {}: {}", keyId, applicationId, e.getMessage());
            throw new DirectoryWriteException(
                    "Failed to delete credential " + keyId + " on application " + applicationId, e);
        }
    }

    private URI nextPageUri(String nextLink) {
        try {
            return URI.create(nextLink);
        } catch (IllegalArgumentException e) {
            log.error("Invalid next page link while listing applications for tenant '{}': {}", tenantId, e.getMessage());
            throw new DirectoryUnavailableException(
                    "Directory returned an invalid next page link while listing applications for tenant " + tenantId, e);
        }
    }

    private ApplicationCredentialSet toApplicationCredentialSet(GraphModels.Application application) {
        if (application.id() == null) {
            log.warn("Ignoring application '{}' in tenant '{}': no id", application.displayName(), tenantId);
            return null;
        }
        List<Credential> credentials = application.passwordCredentials() == null
                ? List.of()
                : application.passwordCredentials().stream()
                        .map(password -> toCredential(application, password))
                        .filter(Objects::nonNull)
                        .toList();
        String displayName = application.displayName() != null ? application.displayName() : application.id();
        return new ApplicationCredentialSet(displayName, application.id(), credentials);
    }

    private Credential toCredential(GraphModels.Application application, GraphModels.PasswordCredential password) {
        if (password.endDateTime() == null) {
            log.warn("Ignoring password {} on application {}: no end date", password.keyId(), application.id());
            return null;
        }
        Instant start = password.startDateTime() != null ? password.startDateTime().toInstant() : Instant.EPOCH;
        String name = password.displayName() != null ? password.displayName() : "";
        return Credential.existing(name, password.keyId(), start, password.endDateTime().toInstant());
    }
}
