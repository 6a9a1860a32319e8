package tech.yump.rotator.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import tech.yump.rotator.rotation.RotationRequest;

@Schema(description = "An application secret that should be kept fresh, or created when missing.")
public record SecretToRotate(
        @NotBlank(message = "appRegistrationName must not be blank")
        @Schema(description = "Display name of the application.", example = "billing-api", requiredMode = Schema.RequiredMode.REQUIRED)
        String appRegistrationName,

        @NotBlank(message = "secretName must not be blank")
        @Schema(description = "Display name of the secret on that application.", example = "ci-deploy", requiredMode = Schema.RequiredMode.REQUIRED)
        String secretName
) {
    public RotationRequest toRotationRequest() {
        return new RotationRequest(appRegistrationName, secretName);
    }
}
