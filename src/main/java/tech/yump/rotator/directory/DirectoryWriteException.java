package tech.yump.rotator.directory;

/**
 * Thrown when creating or deleting a credential fails.
 */
public class DirectoryWriteException extends CredentialDirectoryException {
    public DirectoryWriteException(String message) {
        super(message);
    }

    public DirectoryWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
