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
import tech.yump.gateway.api.dto.DynamicSecretResponse;
import tech.yump.gateway.api.dto.SecretsSnapshotResponse;
import tech.yump.gateway.api.dto.StaticSecretView;
import tech.yump.gateway.audit.AuditHelper;
import tech.yump.gateway.lease.ExpiryClock;
import tech.yump.gateway.service.DynamicCredentialService;
import tech.yump.gateway.service.StaticSecretService;

import java.util.Map;

/**
 * Combined view of static and dynamic secrets, as shown on the dashboard.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Secrets", description = "Combined view of static and dynamic secrets")
public class SecretsController {

    private final StaticSecretService staticSecretService;
    private final DynamicCredentialService dynamicCredentialService;
    private final ExpiryClock clock;
    private final AuditHelper auditHelper;

    @GetMapping("/secrets/all")
    @Operation(
            summary = "Get all secrets",
            description = "Returns every static secret and the credentials of every configured dynamic role."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "All secrets returned.",
                    content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = SecretsSnapshotResponse.class))),
            @ApiResponse(responseCode = "404", description = "A configured role is unknown to Vault.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class))),
            @ApiResponse(responseCode = "502", description = "Vault could not be read or failed to issue credentials.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class)))
    })
    public SecretsSnapshotResponse getAllSecrets() {
        log.info("Controller: Received request for all secrets");
        Map<String, StaticSecretView> staticSecrets = staticSecretService.listAll();
        Map<String, DynamicSecretResponse> dynamicSecrets = dynamicCredentialService.getAllCredentials();

        auditHelper.logHttpEvent(
                "secrets", "get_all", "success", HttpStatus.OK.value(),
                null, Map.of("static_count", staticSecrets.size(), "dynamic_count", dynamicSecrets.size())
        );
        return SecretsSnapshotResponse.combined(clock.now(), staticSecrets, dynamicSecrets);
    }
}
