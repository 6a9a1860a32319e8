package tech.yump.rotator.service;

import tech.yump.rotator.api.dto.SecretRotationProperties;
import tech.yump.rotator.api.dto.SecretRotationResponse;
import tech.yump.rotator.directory.DirectoryUnavailableException;
import tech.yump.rotator.directory.DirectoryWriteException;

/**
 * Entry operations for a secret rotation resource.
 */
public interface SecretRotationService {

    /**
     * Lists the tenant's applications and classifies their secrets without writing anything.
     *
     * @param properties The declared resource.
     * @return The resource with {@code appsWithExpiringSecrets} filled when any application has secrets.
     * @throws DirectoryUnavailableException If the directory cannot be listed.
     */
    SecretRotationResponse preview(SecretRotationProperties properties) throws DirectoryUnavailableException;

    /**
     * Rotates requested secrets that are expiring soon and creates requested secrets that are missing.
     *
     * @param properties The declared resource.
     * @return The resource with the resulting secrets in {@code appsWithExpiringSecrets}.
     * @throws DirectoryUnavailableException If the directory cannot be listed.
     * @throws DirectoryWriteException If a create or delete call fails; remaining writes are not attempted.
     * @throws tech.yump.rotator.rotation.RotationCancelledException If the calling thread was interrupted.
     */
    SecretRotationResponse createOrUpdate(SecretRotationProperties properties)
            throws DirectoryUnavailableException, DirectoryWriteException;
}
