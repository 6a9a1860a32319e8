package tech.yump.rotator.api.advice;

import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.lang.NonNull;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.ServletWebRequest;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;
import tech.yump.rotator.audit.AuditHelper;
import tech.yump.rotator.directory.DirectoryUnavailableException;
import tech.yump.rotator.directory.DirectoryWriteException;
import tech.yump.rotator.rotation.RotationCancelledException;

import java.util.stream.Collectors;

@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

    private static final String ROTATION_PATH_PREFIX = "/v1/rotation/";

    private final AuditHelper auditHelper;

    // --- Directory failures ---

    @ExceptionHandler(DirectoryUnavailableException.class)
    public ResponseEntity<ProblemDetail> handleDirectoryUnavailable(DirectoryUnavailableException ex, HttpServletRequest request) {
        HttpStatus status = HttpStatus.BAD_GATEWAY;
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, ex.getMessage());
        problemDetail.setTitle("Directory Unavailable");
        log.error("Directory unavailable: {}. Request: {} {}", ex.getMessage(), request.getMethod(), request.getRequestURI(), ex);

        auditFailure(request, status, ex.getMessage());
        return ResponseEntity.status(status).body(problemDetail);
    }

    @ExceptionHandler(DirectoryWriteException.class)
    public ResponseEntity<ProblemDetail> handleDirectoryWrite(DirectoryWriteException ex, HttpServletRequest request) {
        HttpStatus status = HttpStatus.BAD_GATEWAY;
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status,
                ex.getMessage() + ". Secrets issued before this failure were kept; retry to complete the rotation.");
        problemDetail.setTitle("Directory Write Failed");
        log.error("Directory write failed: {}. Request: {} {}", ex.getMessage(), request.getMethod(), request.getRequestURI(), ex);

        auditFailure(request, status, ex.getMessage());
        return ResponseEntity.status(status).body(problemDetail);
    }

    @ExceptionHandler(RotationCancelledException.class)
    public ResponseEntity<ProblemDetail> handleRotationCancelled(RotationCancelledException ex, HttpServletRequest request) {
        HttpStatus status = HttpStatus.SERVICE_UNAVAILABLE;
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, ex.getMessage());
        problemDetail.setTitle("Rotation Cancelled");
        log.warn("Rotation cancelled: {}. Request: {} {}", ex.getMessage(), request.getMethod(), request.getRequestURI());

        auditFailure(request, status, ex.getMessage());
        return ResponseEntity.status(status).body(problemDetail);
    }

    // --- Request body problems ---

    @Override
    protected ResponseEntity<Object> handleMethodArgumentNotValid(
            @NonNull MethodArgumentNotValidException ex, @NonNull HttpHeaders headers, @NonNull HttpStatusCode status, @NonNull WebRequest request) {

        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .sorted()
                .collect(Collectors.joining("; "));
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, message);
        problemDetail.setTitle("Invalid Resource Properties");
        log.warn("Invalid resource properties: {}. Request: {}", message, request.getDescription(false));

        if (request instanceof ServletWebRequest servletWebRequest) {
            auditFailure(servletWebRequest.getRequest(), status, message);
        }
        return handleExceptionInternal(ex, problemDetail, headers, status, request);
    }

    @Override
    protected ResponseEntity<Object> handleHttpMessageNotReadable(
            @NonNull HttpMessageNotReadableException ex, @NonNull HttpHeaders headers, @NonNull HttpStatusCode status, @NonNull WebRequest request) {

        String message = "Malformed request body. Please check the JSON format.";
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, message);
        problemDetail.setTitle("Bad Request");

        // The parser message may echo request content, so it is only logged.
        log.warn("Bad request: Malformed JSON received. Request: {}. Details: {}",
                request.getDescription(false), ex.getMessage());

        if (request instanceof ServletWebRequest servletWebRequest) {
            auditHelper.logHttpEvent("request_validation", determineAction(servletWebRequest.getRequest()),
                    "failure", status.value(), message, null);
        }
        return handleExceptionInternal(ex, problemDetail, headers, status, request);
    }

    // --- Fallback Handler ---

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleGenericException(Exception ex, HttpServletRequest request) {
        HttpStatus status = HttpStatus.INTERNAL_SERVER_ERROR;
        String message = "An unexpected internal error occurred.";
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, message);
        problemDetail.setTitle("Internal Server Error");
        log.error("An unexpected error occurred: {}. Request: {} {}", ex.getMessage(), request.getMethod(), request.getRequestURI(), ex);

        auditHelper.logHttpEvent("system_error", determineAction(request), "failure", status.value(), message, null);
        return ResponseEntity.status(status).body(problemDetail);
    }

    private void auditFailure(HttpServletRequest request, HttpStatusCode status, String message) {
        auditHelper.logHttpEvent(determineEventType(request), determineAction(request), "failure", status.value(), message, null);
    }

    private String determineEventType(HttpServletRequest request) {
        return request.getRequestURI().startsWith(ROTATION_PATH_PREFIX) ? "rotation_request" : "request_error";
    }

    private String determineAction(HttpServletRequest request) {
        String path = request.getRequestURI();
        if (!path.startsWith(ROTATION_PATH_PREFIX)) {
            return "unknown";
        }
        if (path.endsWith("/preview")) {
            return "preview";
        }
        return "PUT".equalsIgnoreCase(request.getMethod()) ? "create_or_update" : "unknown";
    }
}
