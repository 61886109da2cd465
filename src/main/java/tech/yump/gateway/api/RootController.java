package tech.yump.gateway.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import tech.yump.gateway.api.dto.HealthResponse;
import tech.yump.gateway.api.dto.VaultDebugResponse;
import tech.yump.gateway.audit.AuditHelper;
import tech.yump.gateway.service.BackendStatusService;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequiredArgsConstructor
@Slf4j
@Tag(name = "System", description = "Service information, health and diagnostics")
public class RootController {

  static final String SERVICE_MESSAGE = "Secrets Management API with Dynamic Rotation";
  static final String SERVICE_VERSION = "2.0.0";

  private final BackendStatusService backendStatusService;
  private final AuditHelper auditHelper;

  @GetMapping("/")
  @Operation(
          summary = "Root Endpoint",
          description = "Service name, version and the main endpoints."
  )
  @ApiResponse(responseCode = "200", description = "Service information.",
          content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE,
                  schema = @Schema(type = "object", example = "{\"message\": \"Secrets Management API with Dynamic Rotation\", \"version\": \"2.0.0\"}")))
  public Map<String, Object> getRoot() {
    Map<String, String> endpoints = new LinkedHashMap<>();
    endpoints.put("health", "/health");
    endpoints.put("all_secrets", "/secrets/all");
    endpoints.put("static_secrets", "/secrets/static");
    endpoints.put("dynamic_secrets", "/secrets/dynamic-all");
    endpoints.put("debug", "/debug/vault");

    Map<String, Object> root = new LinkedHashMap<>();
    root.put("message", SERVICE_MESSAGE);
    root.put("version", SERVICE_VERSION);
    root.put("endpoints", endpoints);
    return root;
  }

  @GetMapping("/health")
  @Operation(
          summary = "Backend health",
          description = "Reports whether Vault accepts the gateway token and whether the database accepts the static account. Always answers 200; a failing backend turns the status to 'degraded'."
  )
  @ApiResponse(responseCode = "200", description = "Health of the gateway and its backends.",
          content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = HealthResponse.class)))
  public HealthResponse getHealth() {
    HealthResponse health = backendStatusService.health();
    log.debug("Controller: Health status is '{}'", health.status());
    return health;
  }

  @GetMapping("/debug/vault")
  @Operation(
          summary = "Vault diagnostics",
          description = "Lists mounted secrets engines, database roles, static secret types and the state of the credential lease cache. Never returns secret values."
  )
  @ApiResponses(value = {
          @ApiResponse(responseCode = "200", description = "Diagnostics collected.",
                  content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = VaultDebugResponse.class))),
          @ApiResponse(responseCode = "502", description = "Vault could not be queried.",
                  content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class)))
  })
  public VaultDebugResponse getVaultDebug() {
    log.info("Controller: Received request for Vault diagnostics");
    VaultDebugResponse debug = backendStatusService.debugVault();
    auditHelper.logHttpEvent(
            "system", "debug_vault", "success", HttpStatus.OK.value(),
            null, Map.of("static_secrets_count", debug.staticSecretsCount())
    );
    return debug;
  }
}
