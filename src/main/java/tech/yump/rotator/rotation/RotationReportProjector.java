package tech.yump.rotator.rotation;

import org.springframework.stereotype.Component;
import tech.yump.rotator.directory.ApplicationCredentialSet;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Flattens applications and their credentials into report rows, one row per credential,
 * in input order.
 */
@Component
public class RotationReportProjector {

    public static final String UNCHANGED_SECRET_VALUE = "No Secret Changed";

    static final DateTimeFormatter EXPIRES_ON_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneOffset.UTC);

    public List<RotationReportRow> project(List<ApplicationCredentialSet> applications) {
        return applications.stream()
                .flatMap(application -> application.credentials().stream()
                        .map(credential -> new RotationReportRow(
                                application.displayName(),
                                credential.displayName(),
                                EXPIRES_ON_FORMAT.format(credential.endTime()),
                                credential.value() != null ? credential.value() : UNCHANGED_SECRET_VALUE,
                                credential.isExpiringSoon(),
                                credential.isRenewed())))
                .toList();
    }
}
