package tech.yump.rotator.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tech.yump.rotator.api.dto.SecretRotationProperties;
import tech.yump.rotator.api.dto.SecretRotationResponse;
import tech.yump.rotator.api.dto.SecretToRotate;
import tech.yump.rotator.directory.ApplicationCredentialSet;
import tech.yump.rotator.rotation.RotationReportProjector;
import tech.yump.rotator.rotation.RotationRequest;
import tech.yump.rotator.rotation.SecretRotator;
import tech.yump.rotator.rotation.SecretRotatorRegistry;

import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class SecretRotationServiceImpl implements SecretRotationService {

    private final SecretRotatorRegistry rotatorRegistry;
    private final RotationReportProjector reportProjector;

    @Override
    public SecretRotationResponse preview(SecretRotationProperties properties) {
        log.info("Service layer: Preview for tenant '{}'", properties.id());
        SecretRotator rotator = rotatorRegistry.getOrCreate(properties.id(), properties.rotateSecretsExpiringWithinDays());

        List<ApplicationCredentialSet> applications = rotator.fetchNormalizedState();

        SecretRotationProperties result = properties.withAppsWithExpiringSecrets(
                applications.isEmpty() ? null : reportProjector.project(applications));
        log.info("Service layer: Preview for tenant '{}' found {} applications with secrets",
                properties.id(), applications.size());
        return SecretRotationResponse.of(result);
    }

    @Override
    public SecretRotationResponse createOrUpdate(SecretRotationProperties properties) {
        log.info("Service layer: Create or update for tenant '{}' with {} requested secrets (deleteAfterRenew={})",
                properties.id(), properties.secretsToRotate().size(), properties.deleteAfterRenew());
        SecretRotator rotator = rotatorRegistry.getOrCreate(properties.id(), properties.rotateSecretsExpiringWithinDays());

        if (properties.expiresInDays() <= rotator.getRotateSecretsExpiringWithinDays()) {
            log.warn("expiresInDays ({}) is not greater than the rotation threshold ({} days) for tenant '{}': "
                            + "issued secrets are already expiring soon and will be rotated again on every run",
                    properties.expiresInDays(), rotator.getRotateSecretsExpiringWithinDays(), properties.id());
        }

        List<RotationRequest> requests = properties.secretsToRotate().stream()
                .map(SecretToRotate::toRotationRequest)
                .toList();

        List<ApplicationCredentialSet> applications = rotator.rotate(
                requests, properties.expiresInDays(), properties.deleteAfterRenew());

        log.info("Service layer: Create or update for tenant '{}' finished", properties.id());
        return SecretRotationResponse.of(properties.withAppsWithExpiringSecrets(reportProjector.project(applications)));
    }
}
