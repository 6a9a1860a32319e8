package tech.yump.rotator.rotation;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tech.yump.rotator.audit.AuditHelper;
import tech.yump.rotator.directory.CredentialDirectoryClientFactory;

import java.time.Clock;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Holds one {@link SecretRotator} per tenant for the lifetime of the process.
 * <p>
 * The rotation threshold passed by the first caller for a tenant is bound to that tenant's
 * rotator; later calls with another threshold get the existing rotator unchanged.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SecretRotatorRegistry {

    private final CredentialDirectoryClientFactory clientFactory;
    private final Clock clock;
    private final AuditHelper auditHelper;

    private final ConcurrentMap<String, SecretRotator> rotators = new ConcurrentHashMap<>();

    public SecretRotator getOrCreate(String tenantId, int rotateSecretsExpiringWithinDays) {
        SecretRotator rotator = rotators.computeIfAbsent(tenantId, id -> {
            log.info("Creating secret rotator for tenant '{}' with rotation threshold {} days",
                    id, rotateSecretsExpiringWithinDays);
            return new SecretRotator(clientFactory.forTenant(id), rotateSecretsExpiringWithinDays, clock, auditHelper);
        });
        if (rotator.getRotateSecretsExpiringWithinDays() != rotateSecretsExpiringWithinDays) {
            log.debug("Tenant '{}' keeps rotation threshold {} days; requested {} days is ignored",
                    tenantId, rotator.getRotateSecretsExpiringWithinDays(), rotateSecretsExpiringWithinDays);
        }
        return rotator;
    }
}
