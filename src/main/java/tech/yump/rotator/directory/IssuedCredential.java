package tech.yump.rotator.directory;

import java.time.Instant;
import java.util.UUID;

/**
 * Result of issuing a new password credential. {@code secretText} is only ever visible here.
 */
public record IssuedCredential(
        UUID keyId,
        String secretText,
        Instant startTime,
        Instant endTime
) {
    @Override
    public String toString() {
        return "IssuedCredential[keyId=" + keyId + ", secretText=******, startTime=" + startTime + ", endTime=" + endTime + ']';
    }
}
