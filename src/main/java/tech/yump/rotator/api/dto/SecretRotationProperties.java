package tech.yump.rotator.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import tech.yump.rotator.rotation.RotationReportRow;

import java.util.List;

/**
 * Declarative properties of a secret rotation resource. Absent fields take their defaults;
 * {@code appsWithExpiringSecrets} is output only.
 */
@Schema(description = "Secret rotation resource for one directory tenant.")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SecretRotationProperties(
        @NotBlank(message = "id must not be blank")
        @Schema(description = "Tenant identifier; also the identity of the resource.", example = "7f1c9a2e-3b44-4d1e-9c55-0a1b2c3d4e5f", requiredMode = Schema.RequiredMode.REQUIRED)
        String id,

        @Min(value = 0, message = "rotateSecretsExpiringWithinDays must not be negative")
        @Schema(description = "Rotate secrets expiring within this many days.", defaultValue = "30")
        Integer rotateSecretsExpiringWithinDays,

        @Min(value = 1, message = "expiresInDays must be at least 1")
        @Schema(description = "Validity in days of newly issued secrets.", defaultValue = "180")
        Integer expiresInDays,

        @Valid
        @Schema(description = "Application secrets to rotate or create. Others are never written.")
        List<SecretToRotate> secretsToRotate,

        @Schema(description = "Delete the superseded secret after a successful rotation.", defaultValue = "false")
        Boolean deleteAfterRenew,

        @Schema(description = "Secrets found or issued by the last call.", accessMode = Schema.AccessMode.READ_ONLY)
        List<RotationReportRow> appsWithExpiringSecrets
) {
    public static final int DEFAULT_ROTATE_SECRETS_EXPIRING_WITHIN_DAYS = 30;
    public static final int DEFAULT_EXPIRES_IN_DAYS = 180;

    public SecretRotationProperties {
        if (rotateSecretsExpiringWithinDays == null) {
            rotateSecretsExpiringWithinDays = DEFAULT_ROTATE_SECRETS_EXPIRING_WITHIN_DAYS;
        }
        if (expiresInDays == null) {
            expiresInDays = DEFAULT_EXPIRES_IN_DAYS;
        }
        secretsToRotate = secretsToRotate == null ? List.of() : List.copyOf(secretsToRotate);
        if (deleteAfterRenew == null) {
            deleteAfterRenew = false;
        }
    }

    public SecretRotationProperties withAppsWithExpiringSecrets(List<RotationReportRow> rows) {
        return new SecretRotationProperties(
                id, rotateSecretsExpiringWithinDays, expiresInDays, secretsToRotate, deleteAfterRenew, rows);
    }
}
