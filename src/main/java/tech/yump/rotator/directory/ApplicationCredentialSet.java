package tech.yump.rotator.directory;

import java.util.List;
import java.util.Objects;

/**
 * A directory application together with its password credentials.
 *
 * @param displayName Human readable name, used to match requested secrets. Not guaranteed unique.
 * @param id          Directory identifier of the application, used for all write calls.
 * @param credentials Credentials in directory listing order.
 */
public record ApplicationCredentialSet(
        String displayName,
        String id,
        List<Credential> credentials
) {
    public ApplicationCredentialSet {
        Objects.requireNonNull(displayName, "displayName must not be null");
        Objects.requireNonNull(id, "id must not be null");
        credentials = credentials == null ? List.of() : List.copyOf(credentials);
    }

    public ApplicationCredentialSet withCredentials(List<Credential> replacement) {
        return new ApplicationCredentialSet(displayName, id, replacement);
    }
}
