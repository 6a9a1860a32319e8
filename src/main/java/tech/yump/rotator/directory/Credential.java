package tech.yump.rotator.directory;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * One password credential registered on a directory application.
 * <p>
 * Several physical entries may share a {@code displayName}; each one is a generation of the same
 * logical secret and is identified by its own {@code keyId}. The flags are derived by the rotation
 * engine and are never returned by the directory itself.
 *
 * @param displayName     Logical name of the secret.
 * @param keyId           Identifier of this physical entry, {@link #NO_KEY_ID} until the entry exists.
 * @param startTime       Start of the validity window.
 * @param endTime         Expiry of the validity window.
 * @param isExpiringSoon  True when {@code endTime} falls within the rotation threshold.
 * @param isRenewed       True only for entries issued by the current rotation run.
 * @param isNew           True for entries that did not exist in the directory before this run.
 * @param value           Plaintext secret, present only right after it was issued.
 */
public record Credential(
        String displayName,
        UUID keyId,
        Instant startTime,
        Instant endTime,
        boolean isExpiringSoon,
        boolean isRenewed,
        boolean isNew,
        String value
) {

    public static final UUID NO_KEY_ID = new UUID(0L, 0L);

    public Credential {
        Objects.requireNonNull(displayName, "displayName must not be null");
        Objects.requireNonNull(startTime, "startTime must not be null");
        Objects.requireNonNull(endTime, "endTime must not be null");
        keyId = keyId == null ? NO_KEY_ID : keyId;
    }

    /**
     * A credential as listed by the directory, before classification.
     */
    public static Credential existing(String displayName, UUID keyId, Instant startTime, Instant endTime) {
        return new Credential(displayName, keyId, startTime, endTime, false, false, false, null);
    }

    /**
     * Placeholder for a requested credential that does not exist yet. The validity window is
     * provisional and is replaced by the one the directory returns on creation.
     */
    public static Credential placeholder(String displayName, Instant now) {
        return new Credential(displayName, NO_KEY_ID, now, now, false, false, true, null);
    }

    public Credential withExpiringSoon(boolean expiringSoon) {
        return new Credential(displayName, keyId, startTime, endTime, expiringSoon, isRenewed, isNew, value);
    }

    /**
     * The same logical credential after the directory issued a new generation of it.
     * The expiry classification made before issuing is kept.
     */
    public Credential renewedWith(IssuedCredential issued) {
        return new Credential(
                displayName,
                issued.keyId(),
                issued.startTime(),
                issued.endTime(),
                isExpiringSoon,
                true,
                isNew,
                issued.secretText()
        );
    }

    public boolean hasKeyId() {
        return !NO_KEY_ID.equals(keyId);
    }

    @Override
    public String toString() {
        // Never print the secret value.
        return "Credential[" +
                "displayName='" + displayName + '\'' +
                ", keyId=" + keyId +
                ", startTime=" + startTime +
                ", endTime=" + endTime +
                ", isExpiringSoon=" + isExpiringSoon +
                ", isRenewed=" + isRenewed +
                ", isNew=" + isNew +
                ", value=" + (value == null ? "null" : "******") +
                ']';
    }
}
