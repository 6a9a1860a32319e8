package tech.yump.rotator.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import tech.yump.rotator.api.dto.SecretRotationProperties;
import tech.yump.rotator.api.dto.SecretRotationResponse;
import tech.yump.rotator.audit.AuditHelper;
import tech.yump.rotator.rotation.RotationReportRow;
import tech.yump.rotator.service.SecretRotationService;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/v1/rotation/entra-id")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Secret Rotation", description = "Preview and apply rotation of application secrets in a directory tenant")
public class SecretRotationController {

    static final String AUDIT_TYPE = "rotation_request";

    private final SecretRotationService secretRotationService;
    private final AuditHelper auditHelper;

    @PostMapping(value = "/preview", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
            summary = "Preview secret rotation",
            description = "Lists the tenant's applications with their latest secrets and whether each expires within the rotation threshold. Performs no writes."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Current secret state.",
                    content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = SecretRotationResponse.class))),
            @ApiResponse(responseCode = "400", description = "Invalid resource properties.", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "403", description = "Missing or invalid token.", content = @Content),
            @ApiResponse(responseCode = "502", description = "The directory could not be listed.", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<SecretRotationResponse> preview(@Valid @RequestBody SecretRotationProperties properties) {
        log.info("Controller: Received preview request for tenant '{}'", properties.id());
        SecretRotationResponse response = secretRotationService.preview(properties);

        auditHelper.logHttpEvent(AUDIT_TYPE, "preview", "success", HttpStatus.OK.value(), null,
                Map.of("tenant_id", properties.id(), "secret_count", rowCount(response)));
        return ResponseEntity.ok(response);
    }

    @PutMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
            summary = "Rotate or create secrets",
            description = "Rotates requested secrets that expire within the threshold and creates requested secrets that do not exist. New secret values are returned once, in this response only."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Resulting secret state.",
                    content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = SecretRotationResponse.class))),
            @ApiResponse(responseCode = "400", description = "Invalid resource properties.", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "403", description = "Missing or invalid token.", content = @Content),
            @ApiResponse(responseCode = "502", description = "The directory could not be listed, or a secret could not be written. Earlier writes are kept.", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "503", description = "The request was cancelled.", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<SecretRotationResponse> createOrUpdate(@Valid @RequestBody SecretRotationProperties properties) {
        log.info("Controller: Received create-or-update request for tenant '{}'", properties.id());
        SecretRotationResponse response = secretRotationService.createOrUpdate(properties);

        long renewed = response.properties().appsWithExpiringSecrets().stream()
                .filter(RotationReportRow::isRenewed)
                .count();
        auditHelper.logHttpEvent(AUDIT_TYPE, "create_or_update", "success", HttpStatus.OK.value(), null,
                Map.of("tenant_id", properties.id(), "secret_count", rowCount(response), "renewed_count", renewed));
        return ResponseEntity.ok(response);
    }

    private static int rowCount(SecretRotationResponse response) {
        List<RotationReportRow> rows = response.properties().appsWithExpiringSecrets();
        return rows == null ? 0 : rows.size();
    }
}
