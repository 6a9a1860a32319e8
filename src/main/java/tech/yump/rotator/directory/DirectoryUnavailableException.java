package tech.yump.rotator.directory;

/**
 * Thrown when the directory cannot be read (transport, authentication or permission failure).
 */
public class DirectoryUnavailableException extends CredentialDirectoryException {
    public DirectoryUnavailableException(String message) {
        super(message);
    }

    public DirectoryUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
