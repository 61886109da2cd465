package tech.yump.gateway.api.advice;

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
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.ServletWebRequest;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;
import tech.yump.gateway.audit.AuditHelper;
import tech.yump.gateway.secrets.CredentialProviderException;
import tech.yump.gateway.secrets.LeaseWaitInterruptedException;
import tech.yump.gateway.secrets.RoleNotFoundException;
import tech.yump.gateway.secrets.SecretsEngineException;
import tech.yump.gateway.secrets.kv.KVEngineException;
import tech.yump.gateway.secrets.kv.StaticSecretConflictException;
import tech.yump.gateway.secrets.kv.StaticSecretNotFoundException;

import java.util.HashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

    private final AuditHelper auditHelper;

    private static final Pattern DYNAMIC_ROLE_PATH_PATTERN = Pattern.compile(".*/secrets/dynamic/([^/]+)");
    private static final Pattern STATIC_KEY_PATH_PATTERN = Pattern.compile(".*/secrets/static/([^/]+)/([^/]+)");
    private static final Pattern STATIC_SECRET_PATH_PATTERN = Pattern.compile(".*/secrets/static/([^/]+)");

    // --- Secret backend failures ---

    @ExceptionHandler(RoleNotFoundException.class)
    public ResponseEntity<ProblemDetail> handleRoleNotFound(RoleNotFoundException ex, HttpServletRequest request) {
        return respond(HttpStatus.NOT_FOUND, "Role Not Found", ex.getMessage(), ex, request);
    }

    @ExceptionHandler(CredentialProviderException.class)
    public ResponseEntity<ProblemDetail> handleCredentialProvider(CredentialProviderException ex, HttpServletRequest request) {
        return respond(HttpStatus.BAD_GATEWAY, "Secret Backend Error", ex.getMessage(), ex, request);
    }

    @ExceptionHandler(LeaseWaitInterruptedException.class)
    public ResponseEntity<ProblemDetail> handleLeaseWaitInterrupted(LeaseWaitInterruptedException ex, HttpServletRequest request) {
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "Request Interrupted", ex.getMessage(), ex, request);
    }

    @ExceptionHandler(KVEngineException.class)
    public ResponseEntity<ProblemDetail> handleKVEngineException(KVEngineException ex, HttpServletRequest request) {
        return respond(HttpStatus.BAD_GATEWAY, "KV Engine Error", ex.getMessage(), ex, request);
    }

    @ExceptionHandler(StaticSecretNotFoundException.class)
    public ResponseEntity<ProblemDetail> handleStaticSecretNotFound(StaticSecretNotFoundException ex, HttpServletRequest request) {
        return respond(HttpStatus.NOT_FOUND, "Secret Not Found", ex.getMessage(), ex, request);
    }

    @ExceptionHandler(StaticSecretConflictException.class)
    public ResponseEntity<ProblemDetail> handleStaticSecretConflict(StaticSecretConflictException ex, HttpServletRequest request) {
        return respond(HttpStatus.CONFLICT, "Secret Conflict", ex.getMessage(), ex, request);
    }

    @ExceptionHandler(SecretsEngineException.class) // Remaining backend errors
    public ResponseEntity<ProblemDetail> handleSecretsEngineException(SecretsEngineException ex, HttpServletRequest request) {
        return respond(HttpStatus.BAD_GATEWAY, "Secrets Engine Error", ex.getMessage(), ex, request);
    }

    // --- Client errors ---

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ProblemDetail> handleIllegalArgumentException(IllegalArgumentException ex, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, "Bad Request", ex.getMessage(), ex, request);
    }

    @Override
    protected ResponseEntity<Object> handleHttpMessageNotReadable(
            @NonNull HttpMessageNotReadableException ex, @NonNull HttpHeaders headers, @NonNull HttpStatusCode status, @NonNull WebRequest request) {

        String message = "Malformed request body. Please check the JSON format.";
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, message);
        problemDetail.setTitle("Bad Request");

        // The parser message can echo request content, so it is logged but not returned.
        log.warn("Bad request: Malformed JSON received. Request: {}. Details: {}",
                request.getDescription(false), ex.getMessage());
        auditValidationFailure(request, status, message);

        return handleExceptionInternal(ex, problemDetail, headers, status, request);
    }

    @Override
    protected ResponseEntity<Object> handleMethodArgumentNotValid(
            @NonNull MethodArgumentNotValidException ex, @NonNull HttpHeaders headers, @NonNull HttpStatusCode status, @NonNull WebRequest request) {

        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .collect(Collectors.joining("; "));
        if (message.isEmpty()) {
            message = "Request validation failed.";
        }
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, message);
        problemDetail.setTitle("Bad Request");

        log.warn("Bad request: Validation failed. Request: {}. Details: {}", request.getDescription(false), message);
        auditValidationFailure(request, status, message);

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

        auditHelper.logHttpEvent(
                "system_error",
                determineActionFromRequest(request),
                "failure",
                status.value(),
                message, // Don't expose internal details
                extractContextData(request)
        );
        return ResponseEntity.status(status).body(problemDetail);
    }

    private ResponseEntity<ProblemDetail> respond(HttpStatus status, String title, String detail,
                                                  Exception ex, HttpServletRequest request) {
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, detail);
        problemDetail.setTitle(title);
        if (status.is5xxServerError()) {
            log.error("{}: {}. Request: {} {}", title, detail, request.getMethod(), request.getRequestURI(), ex);
        } else {
            log.warn("{}: {}. Request: {} {}", title, detail, request.getMethod(), request.getRequestURI());
        }

        auditHelper.logHttpEvent(
                determineEventType(request),
                determineActionFromRequest(request),
                "failure",
                status.value(),
                detail,
                extractContextData(request)
        );
        return ResponseEntity.status(status).body(problemDetail);
    }

    private void auditValidationFailure(WebRequest request, HttpStatusCode status, String message) {
        if (request instanceof ServletWebRequest servletWebRequest) {
            HttpServletRequest servletRequest = servletWebRequest.getRequest();
            auditHelper.logHttpEvent(
                    "request_validation",
                    determineActionFromRequest(servletRequest),
                    "failure",
                    status.value(),
                    message,
                    extractContextData(servletRequest)
            );
        } else {
            log.error("Could not obtain HttpServletRequest from WebRequest for audit logging.");
        }
    }

    private String determineEventType(HttpServletRequest request) {
        String path = request.getRequestURI();
        if (path.startsWith("/secrets/static")) {
            return "static_secret";
        } else if (path.startsWith("/secrets/dynamic")) {
            return "dynamic_credentials";
        } else if (path.startsWith("/secrets/")) {
            return "secrets";
        } else if (path.startsWith("/debug/")) {
            return "system";
        }
        return "request_error";
    }

    private String determineActionFromRequest(HttpServletRequest request) {
        String path = request.getRequestURI();
        String method = request.getMethod().toUpperCase();

        if (path.startsWith("/secrets/dynamic/")) return "get_credentials";
        if (path.startsWith("/secrets/dynamic-all")) return "get_all_credentials";
        if (path.startsWith("/secrets/all")) return "get_all";
        if (path.startsWith("/debug/vault")) return "debug_vault";

        if (STATIC_KEY_PATH_PATTERN.matcher(path).matches()) {
            return switch (method) {
                case "POST" -> "create_key";
                case "PUT" -> "update_key";
                case "DELETE" -> "delete_key";
                default -> "unknown_static";
            };
        }
        if (STATIC_SECRET_PATH_PATTERN.matcher(path).matches()) {
            return switch (method) {
                case "GET" -> "read";
                case "POST" -> "create_secret";
                case "DELETE" -> "delete_secret";
                default -> "unknown_static";
            };
        }
        if (path.startsWith("/secrets/static")) return "list";
        return "unknown";
    }

    private Map<String, Object> extractContextData(HttpServletRequest request) {
        Map<String, Object> data = new HashMap<>();
        String uri = request.getRequestURI();

        Matcher roleMatcher = DYNAMIC_ROLE_PATH_PATTERN.matcher(uri);
        if (roleMatcher.matches()) {
            data.put("role_name", roleMatcher.group(1));
            return data;
        }

        Matcher keyMatcher = STATIC_KEY_PATH_PATTERN.matcher(uri);
        if (keyMatcher.matches()) {
            data.put("secret_type", keyMatcher.group(1));
            data.put("key", keyMatcher.group(2));
            return data;
        }

        Matcher secretMatcher = STATIC_SECRET_PATH_PATTERN.matcher(uri);
        if (secretMatcher.matches()) {
            data.put("secret_type", secretMatcher.group(1));
        }
        return data;
    }
}
