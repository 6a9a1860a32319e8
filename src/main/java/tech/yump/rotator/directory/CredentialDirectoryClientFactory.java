package tech.yump.rotator.directory;

/**
 * Creates the directory client used for a given tenant.
 */
@FunctionalInterface
public interface CredentialDirectoryClientFactory {

    CredentialDirectoryClient forTenant(String tenantId);
}
