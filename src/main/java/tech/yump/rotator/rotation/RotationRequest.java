package tech.yump.rotator.rotation;

/**
 * One requested secret: the application it lives on and its display name.
 */
public record RotationRequest(String applicationName, String secretName) {
}
