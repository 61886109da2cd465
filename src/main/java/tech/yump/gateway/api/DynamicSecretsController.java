package tech.yump.gateway.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import tech.yump.gateway.api.dto.DynamicSecretResponse;
import tech.yump.gateway.api.dto.SecretsSnapshotResponse;
import tech.yump.gateway.audit.AuditHelper;
import tech.yump.gateway.lease.ExpiryClock;
import tech.yump.gateway.service.DynamicCredentialService;

import java.util.HashMap;
import java.util.Map;

@RestController
@RequestMapping("/secrets")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Dynamic Secrets", description = "Short-lived database credentials issued by Vault and cached until their lease expires")
public class DynamicSecretsController {

    private final DynamicCredentialService dynamicCredentialService;
    private final ExpiryClock clock;
    private final AuditHelper auditHelper;

    @GetMapping("/dynamic/{role}")
    @Operation(
            summary = "Get dynamic DB credentials",
            description = "Returns credentials for a configured role. Cached credentials are served while their lease is valid; "
                    + "concurrent requests for an expired role share a single issuance."
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "200",
                    description = "Credentials returned.",
                    content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = DynamicSecretResponse.class))
            ),
            @ApiResponse(responseCode = "404", description = "Role not configured on the gateway or in Vault.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class))),
            @ApiResponse(responseCode = "502", description = "Vault failed to issue credentials.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class))),
            @ApiResponse(responseCode = "503", description = "Request was interrupted while waiting for credentials.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class)))
    })
    public ResponseEntity<DynamicSecretResponse> getDynamicCredentials(
            @Parameter(description = "Name of the configured database role.", required = true, example = "readonly")
            @PathVariable String role
    ) {
        log.info("Controller: Received request for dynamic credentials for role: {}", role);
        DynamicSecretResponse response = dynamicCredentialService.getCredentials(role);

        Map<String, Object> data = new HashMap<>();
        data.put("role_name", role);
        data.put("cache_status", response.metadata().cacheStatus());
        data.put("expires_at", String.valueOf(response.metadata().expiresAt()));
        auditHelper.logHttpEvent(
                "dynamic_credentials", "get_credentials", "success", HttpStatus.OK.value(),
                null, data
        );
        return ResponseEntity.ok(response);
    }

    @GetMapping("/dynamic-all")
    @Operation(
            summary = "Get credentials for every configured role",
            description = "Resolves every configured role and returns the credentials keyed by the role's response key (e.g. 'db_readonly')."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Credentials returned.",
                    content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = SecretsSnapshotResponse.class))),
            @ApiResponse(responseCode = "404", description = "A configured role is unknown to Vault.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class))),
            @ApiResponse(responseCode = "502", description = "Vault failed to issue credentials.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class)))
    })
    public SecretsSnapshotResponse getAllDynamicCredentials() {
        log.info("Controller: Received request for credentials of all dynamic roles");
        Map<String, DynamicSecretResponse> secrets = dynamicCredentialService.getAllCredentials();
        auditHelper.logHttpEvent(
                "dynamic_credentials", "get_all_credentials", "success", HttpStatus.OK.value(),
                null, Map.of("roles", String.join(",", dynamicCredentialService.configuredRoles()))
        );
        return SecretsSnapshotResponse.of(clock.now(), secrets);
    }
}
