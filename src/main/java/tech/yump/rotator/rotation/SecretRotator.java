package tech.yump.rotator.rotation;

import lombok.extern.slf4j.Slf4j;
import tech.yump.rotator.audit.AuditHelper;
import tech.yump.rotator.directory.ApplicationCredentialSet;
import tech.yump.rotator.directory.Credential;
import tech.yump.rotator.directory.CredentialDirectoryClient;
import tech.yump.rotator.directory.IssuedCredential;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reconciles requested secrets against the credentials of one directory tenant.
 * <p>
 * A run goes through three stages, each returning new immutable snapshots:
 * {@link #fetchNormalizedState()} reads and classifies the directory,
 * {@link #planRotationOrCreation(List, Collection)} selects what must be written, and
 * {@link #execute(List, List, int, boolean)} performs the writes and merges the outcome back.
 * Instances hold no per-call state and may be shared by concurrent requests.
 */
@Slf4j
public class SecretRotator {

    static final String AUDIT_TYPE = "rotation";

    private final CredentialDirectoryClient client;
    private final int rotateSecretsExpiringWithinDays;
    private final Clock clock;
    private final AuditHelper auditHelper;

    public SecretRotator(
            CredentialDirectoryClient client,
            int rotateSecretsExpiringWithinDays,
            Clock clock,
            AuditHelper auditHelper) {
        this.client = client;
        this.rotateSecretsExpiringWithinDays = rotateSecretsExpiringWithinDays;
        this.clock = clock;
        this.auditHelper = auditHelper;
    }

    public int getRotateSecretsExpiringWithinDays() {
        return rotateSecretsExpiringWithinDays;
    }

    /**
     * Lists the directory, drops applications without credentials, keeps only the latest
     * generation of each credential name and classifies its expiry.
     */
    public List<ApplicationCredentialSet> fetchNormalizedState() {
        checkNotCancelled("listing applications");
        List<ApplicationCredentialSet> applications = client.listApplicationsWithCredentials();

        Instant expiryThreshold = clock.instant().plus(Duration.ofDays(rotateSecretsExpiringWithinDays));
        List<ApplicationCredentialSet> normalized = applications.stream()
                .filter(application -> !application.credentials().isEmpty())
                .map(application -> application.withCredentials(
                        latestPerDisplayName(application.credentials()).stream()
                                .map(credential -> credential.withExpiringSoon(
                                        !credential.endTime().isAfter(expiryThreshold)))
                                .toList()))
                .toList();

        log.info("Found {} applications with secrets ({} listed), rotation threshold {} days",
                normalized.size(), applications.size(), rotateSecretsExpiringWithinDays);
        return normalized;
    }

    /**
     * Keeps one credential per display name: the one with the latest start time. On equal start
     * times the entry listed first wins. Names keep the position of their first occurrence.
     */
    static List<Credential> latestPerDisplayName(List<Credential> credentials) {
        Map<String, Credential> latest = new LinkedHashMap<>();
        for (Credential credential : credentials) {
            latest.merge(credential.displayName(), credential,
                    (kept, candidate) -> candidate.startTime().isAfter(kept.startTime()) ? candidate : kept);
        }
        return List.copyOf(latest.values());
    }

    /**
     * Selects the credentials that need a directory write: requested ones that are expiring soon,
     * plus a placeholder for every requested name the application does not have yet.
     * Requests for unknown applications are logged and skipped.
     *
     * @return Only the applications with at least one planned write, in normalized order.
     */
    public List<ApplicationCredentialSet> planRotationOrCreation(
            List<ApplicationCredentialSet> normalizedState,
            Collection<RotationRequest> requests) {

        Map<String, Set<String>> requestedByApplication = new LinkedHashMap<>();
        for (RotationRequest request : requests) {
            requestedByApplication
                    .computeIfAbsent(request.applicationName(), name -> new LinkedHashSet<>())
                    .add(request.secretName());
        }

        Set<String> knownApplications = normalizedState.stream()
                .map(ApplicationCredentialSet::displayName)
                .collect(Collectors.toSet());
        requestedByApplication.forEach((applicationName, secretNames) -> {
            if (!knownApplications.contains(applicationName)) {
                log.warn("Skipping application '{}': not found in directory or has no secrets (requested: {})",
                        applicationName, secretNames);
                auditHelper.logInternalEvent(AUDIT_TYPE, "skip_application", "skipped", null, Map.of(
                        "application", applicationName,
                        "reason", "unknown_application"));
            }
        });

        Instant now = clock.instant();
        List<ApplicationCredentialSet> plan = new ArrayList<>();
        for (ApplicationCredentialSet application : normalizedState) {
            Set<String> requested = requestedByApplication.get(application.displayName());
            if (requested == null) {
                log.debug("Skipping application '{}': no secrets requested", application.displayName());
                continue;
            }

            List<Credential> planned = new ArrayList<>();
            Set<String> existingNames = new HashSet<>();
            for (Credential credential : application.credentials()) {
                existingNames.add(credential.displayName());
                if (!requested.contains(credential.displayName())) {
                    log.info("Skipping {} with secret {} as it is not in the list of secrets to rotate",
                            application.displayName(), credential.displayName());
                } else if (!credential.isExpiringSoon()) {
                    log.info("Skipping {} with secret {}. Not expiring soon (expires {})",
                            application.displayName(), credential.displayName(), credential.endTime());
                } else {
                    planned.add(credential);
                }
            }
            for (String secretName : requested) {
                if (!existingNames.contains(secretName)) {
                    planned.add(Credential.placeholder(secretName, now));
                }
            }

            if (!planned.isEmpty()) {
                plan.add(application.withCredentials(planned));
            }
        }
        return plan;
    }

    /**
     * Issues every planned credential, one at a time and in plan order. Rotated credentials are
     * followed by deletion of the superseded entry when {@code deleteAfterRenew} is set; created
     * ones never are. The first directory failure aborts the run and propagates; earlier writes
     * stay in place.
     *
     * @return The normalized state with planned credentials replaced by their issued versions
     * and created credentials appended to their application.
     */
    public List<ApplicationCredentialSet> execute(
            List<ApplicationCredentialSet> normalizedState,
            List<ApplicationCredentialSet> plan,
            int expiresInDays,
            boolean deleteAfterRenew) {

        Map<String, List<Credential>> issuedByApplicationId = new HashMap<>();
        for (ApplicationCredentialSet application : plan) {
            List<Credential> issued = new ArrayList<>();
            for (Credential credential : application.credentials()) {
                issued.add(issue(application, credential, expiresInDays, deleteAfterRenew));
            }
            issuedByApplicationId.put(application.id(), issued);
        }

        return normalizedState.stream()
                .map(application -> merge(application, issuedByApplicationId.get(application.id())))
                .toList();
    }

    /**
     * Runs fetch, plan and execute in sequence.
     */
    public List<ApplicationCredentialSet> rotate(
            Collection<RotationRequest> requests,
            int expiresInDays,
            boolean deleteAfterRenew) {
        log.info("Starting rotation of secrets expiring within {} days", rotateSecretsExpiringWithinDays);

        List<ApplicationCredentialSet> normalizedState = fetchNormalizedState();
        List<ApplicationCredentialSet> plan = planRotationOrCreation(normalizedState, requests);

        long plannedWrites = plan.stream().mapToLong(application -> application.credentials().size()).sum();
        log.info("Planned {} secret rotations/creations across {} applications", plannedWrites, plan.size());

        List<ApplicationCredentialSet> result = execute(normalizedState, plan, expiresInDays, deleteAfterRenew);
        log.info("Finished rotation: {} secrets issued", plannedWrites);
        return result;
    }

    private Credential issue(
            ApplicationCredentialSet application,
            Credential credential,
            int expiresInDays,
            boolean deleteAfterRenew) {

        String action = credential.isNew() ? "create_secret" : "rotate_secret";
        if (credential.isNew()) {
            log.info("Creating secret {} on application {}", credential.displayName(), application.displayName());
        } else {
            log.info("Rotating application {} with secret {}", application.displayName(), credential.displayName());
        }

        checkNotCancelled("issuing secret " + credential.displayName());
        IssuedCredential issued = client.createCredential(application.id(), credential.displayName(), expiresInDays);
        Credential renewed = credential.renewedWith(issued);

        auditHelper.logInternalEvent(AUDIT_TYPE, action, "success", null, Map.of(
                "application", application.displayName(),
                "application_id", application.id(),
                "secret_name", credential.displayName(),
                "key_id", String.valueOf(renewed.keyId()),
                "expires_on", renewed.endTime().toString()));
        log.info("{} secret {} on application {}, new expiry {}",
                credential.isNew() ? "Created" : "Rotated", credential.displayName(), application.displayName(), renewed.endTime());

        if (deleteAfterRenew && !credential.isNew()) {
            checkNotCancelled("deleting superseded secret " + credential.displayName());
            client.deleteCredential(application.id(), credential.keyId());
            auditHelper.logInternalEvent(AUDIT_TYPE, "delete_secret", "success", null, Map.of(
                    "application", application.displayName(),
                    "application_id", application.id(),
                    "secret_name", credential.displayName(),
                    "key_id", credential.keyId().toString()));
            log.info("Deleted superseded secret {} ({}) on application {}",
                    credential.displayName(), credential.keyId(), application.displayName());
        }
        return renewed;
    }

    private static ApplicationCredentialSet merge(ApplicationCredentialSet application, List<Credential> issued) {
        if (issued == null || issued.isEmpty()) {
            return application;
        }
        Map<String, Credential> rotatedByName = new HashMap<>();
        List<Credential> created = new ArrayList<>();
        for (Credential credential : issued) {
            if (credential.isNew()) {
                created.add(credential);
            } else {
                rotatedByName.put(credential.displayName(), credential);
            }
        }

        List<Credential> merged = new ArrayList<>(application.credentials().size() + created.size());
        for (Credential credential : application.credentials()) {
            merged.add(rotatedByName.getOrDefault(credential.displayName(), credential));
        }
        merged.addAll(created);
        return application.withCredentials(merged);
    }

    private void checkNotCancelled(String nextStep) {
        if (Thread.currentThread().isInterrupted()) {
            log.warn("Rotation cancelled before {}", nextStep);
            throw new RotationCancelledException("Rotation cancelled before " + nextStep);
        }
    }
}
