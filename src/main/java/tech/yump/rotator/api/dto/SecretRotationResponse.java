package tech.yump.rotator.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Resource state returned by preview and create-or-update.")
public record SecretRotationResponse(
        @Schema(description = "Resource type.", example = SecretRotationResponse.RESOURCE_TYPE, requiredMode = Schema.RequiredMode.REQUIRED)
        String type,

        @Schema(requiredMode = Schema.RequiredMode.REQUIRED)
        SecretRotationIdentifiers identifiers,

        @Schema(requiredMode = Schema.RequiredMode.REQUIRED)
        SecretRotationProperties properties
) {
    public static final String RESOURCE_TYPE = "SecretRotationEntraId";

    public static SecretRotationResponse of(SecretRotationProperties properties) {
        return new SecretRotationResponse(RESOURCE_TYPE, SecretRotationIdentifiers.of(properties), properties);
    }
}
