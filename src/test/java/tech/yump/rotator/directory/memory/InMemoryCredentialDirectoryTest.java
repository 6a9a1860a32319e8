package tech.yump.rotator.directory.memory;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.yump.rotator.directory.ApplicationCredentialSet;
import tech.yump.rotator.directory.Credential;
import tech.yump.rotator.directory.CredentialDirectoryClient;
import tech.yump.rotator.directory.DirectoryWriteException;
import tech.yump.rotator.directory.IssuedCredential;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryCredentialDirectoryTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    private InMemoryCredentialDirectory directory;

    @BeforeEach
    void setUp() {
        directory = new InMemoryCredentialDirectory(Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("createCredential: Should issue a fresh secret and keep the older generation")
    void createKeepsOlderGeneration() {
        // Arrange
        String appId = directory.registerApplication("tenant-1", "A");
        UUID oldKey = UUID.randomUUID();
        directory.addCredential("tenant-1", appId,
                Credential.existing("S1", oldKey, NOW.minus(Duration.ofDays(170)), NOW.plus(Duration.ofDays(10))));
        CredentialDirectoryClient client = directory.forTenant("tenant-1");

        // Act
        IssuedCredential issued = client.createCredential(appId, "S1", 90);

        // Assert
        assertThat(issued.secretText()).hasSize(InMemoryCredentialDirectory.SECRET_LENGTH);
        assertThat(issued.endTime()).isEqualTo(NOW.plus(Duration.ofDays(90)));
        assertThat(client.listApplicationsWithCredentials()).singleElement()
                .extracting(ApplicationCredentialSet::credentials)
                .satisfies(credentials -> assertThat(credentials)
                        .extracting(Credential::keyId)
                        .containsExactly(oldKey, issued.keyId()));
    }

    @Test
    @DisplayName("deleteCredential: Should remove only the given key")
    void deleteRemovesGivenKey() {
        // Arrange
        String appId = directory.registerApplication("tenant-1", "A");
        CredentialDirectoryClient client = directory.forTenant("tenant-1");
        IssuedCredential first = client.createCredential(appId, "S1", 30);
        IssuedCredential second = client.createCredential(appId, "S1", 30);

        // Act
        client.deleteCredential(appId, first.keyId());

        // Assert
        assertThat(directory.applications("tenant-1").get(0).credentials())
                .extracting(Credential::keyId)
                .containsExactly(second.keyId());
    }

    @Test
    @DisplayName("Writes: Should fail for unknown applications and keys")
    void writesToUnknownTargetsFail() {
        // Arrange
        String appId = directory.registerApplication("tenant-1", "A");
        CredentialDirectoryClient client = directory.forTenant("tenant-1");

        // Act & Assert
        assertThatThrownBy(() -> client.createCredential("missing-app", "S1", 30))
                .isInstanceOf(DirectoryWriteException.class);
        assertThatThrownBy(() -> client.deleteCredential(appId, UUID.randomUUID()))
                .isInstanceOf(DirectoryWriteException.class);
    }

    @Test
    @DisplayName("Tenants: Should keep tenants isolated")
    void tenantsAreIsolated() {
        // Arrange
        directory.registerApplication("tenant-1", "A");

        // Act & Assert
        assertThat(directory.forTenant("tenant-2").listApplicationsWithCredentials()).isEmpty();
        assertThat(directory.forTenant("tenant-1").listApplicationsWithCredentials()).hasSize(1);

        directory.clear();
        assertThat(directory.applications("tenant-1")).isEmpty();
    }
}
