package tech.yump.rotator.directory;

import java.util.List;
import java.util.UUID;

/**
 * Access to the applications and password credentials of one directory tenant.
 */
public interface CredentialDirectoryClient {

    /**
     * Lists every application of the tenant together with all of its password credentials,
     * including older generations that share a display name.
     *
     * @return Applications in directory order. Applications without credentials are included.
     * @throws DirectoryUnavailableException If the directory cannot be reached or refuses the call.
     */
    List<ApplicationCredentialSet> listApplicationsWithCredentials() throws DirectoryUnavailableException;

    /**
     * Issues a new password credential on an application. An existing credential with the same
     * display name is left in place.
     *
     * @param applicationId  Directory identifier of the application.
     * @param credentialName Display name of the new credential.
     * @param expiresInDays  Validity of the new credential, counted from now.
     * @return The issued credential including its one-time visible secret text.
     * @throws DirectoryWriteException If the credential could not be created.
     */
    IssuedCredential createCredential(String applicationId, String credentialName, int expiresInDays)
            throws DirectoryWriteException;

    /**
     * Removes one physical credential from an application.
     *
     * @throws DirectoryWriteException If the credential could not be removed.
     */
    void deleteCredential(String applicationId, UUID keyId) throws DirectoryWriteException;
}
