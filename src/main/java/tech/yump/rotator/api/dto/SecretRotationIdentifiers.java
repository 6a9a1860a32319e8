package tech.yump.rotator.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Properties that identify a secret rotation resource.")
public record SecretRotationIdentifiers(
        @Schema(description = "Tenant identifier.", requiredMode = Schema.RequiredMode.REQUIRED)
        String id
) {
    public static SecretRotationIdentifiers of(SecretRotationProperties properties) {
        return new SecretRotationIdentifiers(properties.id());
    }
}
