package tech.yump.rotator.directory;

/**
 * Base exception for failures reported by a credential directory.
 */
public class CredentialDirectoryException extends RuntimeException {
    public CredentialDirectoryException(String message) {
        super(message);
    }

    public CredentialDirectoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
