package tech.yump.rotator.rotation;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "One secret of one application after preview or rotation.")
public record RotationReportRow(
        @Schema(description = "Display name of the application.", example = "billing-api")
        String appRegistrationName,

        @Schema(description = "Display name of the secret.", example = "ci-deploy")
        String secretName,

        @Schema(description = "Expiry of the secret, UTC, formatted yyyy-MM-dd HH:mm:ss.", example = "2026-04-17 09:30:00")
        String secretExpiresOn,

        @Schema(description = "The new secret value when it was issued by this call, otherwise 'No Secret Changed'.")
        String secretValue,

        @JsonProperty("isExpiringSoon")
        @Schema(description = "True when the secret expired, or expires within the rotation threshold.")
        boolean isExpiringSoon,

        @JsonProperty("isRenewed")
        @Schema(description = "True when the secret was rotated or created by this call.")
        boolean isRenewed
) {
    @Override
    public String toString() {
        return "RotationReportRow[appRegistrationName='" + appRegistrationName + "', secretName='" + secretName
                + "', secretExpiresOn='" + secretExpiresOn + "', isExpiringSoon=" + isExpiringSoon
                + ", isRenewed=" + isRenewed + ']';
    }
}
