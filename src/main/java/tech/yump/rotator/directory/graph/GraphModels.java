package tech.yump.rotator.directory.graph;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Wire shapes of the Microsoft Graph application endpoints used by {@link GraphCredentialDirectoryClient}.
 */
final class GraphModels {

    private GraphModels() {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ApplicationPage(
            List<Application> value,
            @JsonProperty("@odata.nextLink") String nextLink
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Application(
            String id,
            String displayName,
            List<PasswordCredential> passwordCredentials
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record PasswordCredential(
            String displayName,
            UUID keyId,
            OffsetDateTime startDateTime,
            OffsetDateTime endDateTime,
            String secretText
    ) {
        static PasswordCredential request(String displayName, OffsetDateTime endDateTime) {
            return new PasswordCredential(displayName, null, null, endDateTime, null);
        }

        @Override
        public String toString() {
            return "PasswordCredential[displayName='" + displayName + "', keyId=" + keyId
                    + ", startDateTime=" + startDateTime + ", endDateTime=" + endDateTime
                    + ", secretText=" + (secretText == null ? "null" : "******") + ']';
        }
    }

    record AddPasswordRequest(PasswordCredential passwordCredential) {}

    record RemovePasswordRequest(UUID keyId) {}
}
