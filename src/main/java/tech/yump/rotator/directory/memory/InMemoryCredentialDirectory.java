package tech.yump.rotator.directory.memory;

import lombok.extern.slf4j.Slf4j;
import tech.yump.rotator.directory.ApplicationCredentialSet;
import tech.yump.rotator.directory.Credential;
import tech.yump.rotator.directory.CredentialDirectoryClient;
import tech.yump.rotator.directory.CredentialDirectoryClientFactory;
import tech.yump.rotator.directory.DirectoryWriteException;
import tech.yump.rotator.directory.IssuedCredential;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Process-local directory holding applications and credentials per tenant.
 * Used for local runs and integration tests; nothing is persisted.
 */
@Slf4j
public class InMemoryCredentialDirectory implements CredentialDirectoryClientFactory {

    private static final String ALLOWED_SECRET_CHARS = "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789~._-";
    static final int SECRET_LENGTH = 40;

    private final Clock clock;
    private final SecureRandom random = new SecureRandom();
    private final ConcurrentMap<String, TenantDirectory> tenants = new ConcurrentHashMap<>();

    public InMemoryCredentialDirectory(Clock clock) {
        this.clock = clock;
    }

    @Override
    public CredentialDirectoryClient forTenant(String tenantId) {
        return new TenantClient(tenant(tenantId));
    }

    /**
     * Registers an application and returns its generated identifier.
     */
    public String registerApplication(String tenantId, String displayName) {
        String id = UUID.randomUUID().toString();
        tenant(tenantId).put(id, displayName);
        log.debug("Registered application '{}' with id {} in tenant '{}'", displayName, id, tenantId);
        return id;
    }

    /**
     * Adds an existing credential (e.g. a seeded one) to an application.
     */
    public void addCredential(String tenantId, String applicationId, Credential credential) {
        tenant(tenantId).add(applicationId, credential);
    }

    /**
     * Snapshot of a tenant's applications as the directory would list them.
     */
    public List<ApplicationCredentialSet> applications(String tenantId) {
        return tenant(tenantId).list();
    }

    public void clear() {
        tenants.clear();
    }

    private TenantDirectory tenant(String tenantId) {
        return tenants.computeIfAbsent(tenantId, TenantDirectory::new);
    }

    private String generateSecret() {
        StringBuilder secret = new StringBuilder(SECRET_LENGTH);
        for (int i = 0; i < SECRET_LENGTH; i++) {
            secret.append(ALLOWED_SECRET_CHARS.charAt(random.nextInt(ALLOWED_SECRET_CHARS.length())));
        }
        return secret.toString();
    }

    private record StoredApplication(String displayName, List<Credential> credentials) {}

    private static final class TenantDirectory {

        private final String tenantId;
        private final Map<String, StoredApplication> applications = new LinkedHashMap<>();

        private TenantDirectory(String tenantId) {
            this.tenantId = tenantId;
        }

        synchronized void put(String id, String displayName) {
            applications.put(id, new StoredApplication(displayName, new ArrayList<>()));
        }

        synchronized void add(String applicationId, Credential credential) {
            require(applicationId).credentials().add(credential);
        }

        synchronized boolean remove(String applicationId, UUID keyId) {
            return require(applicationId).credentials().removeIf(c -> c.keyId().equals(keyId));
        }

        synchronized List<ApplicationCredentialSet> list() {
            return applications.entrySet().stream()
                    .map(e -> new ApplicationCredentialSet(e.getValue().displayName(), e.getKey(), e.getValue().credentials()))
                    .toList();
        }

        private StoredApplication require(String applicationId) {
            StoredApplication application = applications.get(applicationId);
            if (application == null) {
                throw new DirectoryWriteException("Application not found in tenant " + tenantId + ": " + applicationId);
            }
            return application;
        }
    }

    private final class TenantClient implements CredentialDirectoryClient {

        private final TenantDirectory directory;

        private TenantClient(TenantDirectory directory) {
            this.directory = directory;
        }

        @Override
        public List<ApplicationCredentialSet> listApplicationsWithCredentials() {
            return directory.list();
        }

        @Override
        public IssuedCredential createCredential(String applicationId, String credentialName, int expiresInDays) {
            Instant now = clock.instant();
            IssuedCredential issued = new IssuedCredential(
                    UUID.randomUUID(), generateSecret(), now, now.plus(Duration.ofDays(expiresInDays)));
            directory.add(applicationId, Credential.existing(credentialName, issued.keyId(), issued.startTime(), issued.endTime()));
            log.debug("Issued credential '{}' ({}) on application {} in tenant '{}'",
                    credentialName, issued.keyId(), applicationId, directory.tenantId);
            return issued;
        }

        @Override
        public void deleteCredential(String applicationId, UUID keyId) {
            if (!directory.remove(applicationId, keyId)) {
                throw new DirectoryWriteException("Credential " + keyId + " not found on application " + applicationId);
            }
            log.debug("Deleted credential {} from application {} in tenant '{}'", keyId, applicationId, directory.tenantId);
        }
    }
}
