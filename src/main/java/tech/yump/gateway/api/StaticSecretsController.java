package tech.yump.gateway.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
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
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import tech.yump.gateway.api.dto.SecretMutationResponse;
import tech.yump.gateway.api.dto.SecretValueRequest;
import tech.yump.gateway.api.dto.SecretsRequest;
import tech.yump.gateway.api.dto.SecretsSnapshotResponse;
import tech.yump.gateway.api.dto.StaticSecretView;
import tech.yump.gateway.audit.AuditHelper;
import tech.yump.gateway.lease.ExpiryClock;
import tech.yump.gateway.service.StaticSecretService;

import java.util.HashMap;
import java.util.Map;

@RestController
@RequestMapping(value = "/secrets/static", produces = MediaType.APPLICATION_JSON_VALUE)
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Static Secrets", description = "Manually rotated key/value secrets stored in Vault's KV version 2 engine")
public class StaticSecretsController {

    private static final String EVENT_TYPE = "static_secret";

    private final StaticSecretService staticSecretService;
    private final ExpiryClock clock;
    private final AuditHelper auditHelper;

    @GetMapping
    @Operation(summary = "List static secrets", description = "Returns the latest version of every static secret, keyed by name.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Static secrets returned.",
                    content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = SecretsSnapshotResponse.class))),
            @ApiResponse(responseCode = "502", description = "The KV mount could not be listed.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class)))
    })
    public SecretsSnapshotResponse listStaticSecrets() {
        log.info("Controller: Received request to list static secrets");
        Map<String, StaticSecretView> secrets = staticSecretService.listAll();
        auditHelper.logHttpEvent(EVENT_TYPE, "list", "success", HttpStatus.OK.value(),
                null, Map.of("count", secrets.size()));
        return SecretsSnapshotResponse.of(clock.now(), secrets);
    }

    @GetMapping("/{secretType}")
    @Operation(summary = "Read a static secret", description = "Returns the latest version of one static secret.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Secret returned.",
                    content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = StaticSecretView.class))),
            @ApiResponse(responseCode = "400", description = "Invalid secret name.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class))),
            @ApiResponse(responseCode = "404", description = "Secret not found.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class))),
            @ApiResponse(responseCode = "502", description = "Vault error.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class)))
    })
    public StaticSecretView getStaticSecret(
            @Parameter(description = "Name of the static secret.", required = true, example = "api")
            @PathVariable String secretType
    ) {
        log.info("Controller: Received request to read static secret '{}'", secretType);
        StaticSecretView view = staticSecretService.get(secretType);
        auditHelper.logHttpEvent(EVENT_TYPE, "read", "success", HttpStatus.OK.value(),
                null, secretContext(secretType, null));
        return view;
    }

    @PostMapping(value = "/{secretType}", consumes = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Create a static secret", description = "Creates a new static secret from the given key/value pairs.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Secret created.",
                    content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = SecretMutationResponse.class))),
            @ApiResponse(responseCode = "400", description = "Invalid name or empty body.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class))),
            @ApiResponse(responseCode = "409", description = "Secret already exists.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class))),
            @ApiResponse(responseCode = "502", description = "Vault error.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class)))
    })
    public ResponseEntity<SecretMutationResponse> createStaticSecret(
            @Parameter(description = "Name of the new static secret.", required = true, example = "payment")
            @PathVariable String secretType,
            @Valid @RequestBody SecretsRequest request
    ) {
        log.info("Controller: Received request to create static secret '{}' with {} keys", secretType, request.secrets().size());
        SecretMutationResponse response = staticSecretService.createSecret(secretType, request.secrets());

        Map<String, Object> data = secretContext(secretType, null);
        data.put("key_count", request.secrets().size());
        auditHelper.logHttpEvent(EVENT_TYPE, "create_secret", "success", HttpStatus.OK.value(), null, data);
        return ResponseEntity.ok(response);
    }

    @DeleteMapping("/{secretType}")
    @Operation(summary = "Delete a static secret", description = "Permanently deletes a static secret with all of its versions.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Secret deleted.",
                    content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = SecretMutationResponse.class))),
            @ApiResponse(responseCode = "404", description = "Secret not found.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class))),
            @ApiResponse(responseCode = "502", description = "Vault error.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class)))
    })
    public SecretMutationResponse deleteStaticSecret(
            @Parameter(description = "Name of the static secret.", required = true, example = "payment")
            @PathVariable String secretType
    ) {
        log.info("Controller: Received request to delete static secret '{}'", secretType);
        SecretMutationResponse response = staticSecretService.deleteSecret(secretType);
        auditHelper.logHttpEvent(EVENT_TYPE, "delete_secret", "success", HttpStatus.OK.value(),
                null, secretContext(secretType, null));
        return response;
    }

    @PostMapping(value = "/{secretType}/{key}", consumes = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Add a key", description = "Adds a key to a static secret, creating the secret if it does not exist.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Key created.",
                    content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = SecretMutationResponse.class))),
            @ApiResponse(responseCode = "400", description = "Invalid name or missing value.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class))),
            @ApiResponse(responseCode = "409", description = "Key already exists.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class))),
            @ApiResponse(responseCode = "502", description = "Vault error.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class)))
    })
    public ResponseEntity<SecretMutationResponse> createKey(
            @Parameter(description = "Name of the static secret.", required = true, example = "api")
            @PathVariable String secretType,
            @Parameter(description = "Key to add.", required = true, example = "stripe_api")
            @PathVariable String key,
            @Valid @RequestBody SecretValueRequest request
    ) {
        log.info("Controller: Received request to create key '{}' in static secret '{}'", key, secretType);
        SecretMutationResponse response = staticSecretService.createKey(secretType, key, request.value());
        auditHelper.logHttpEvent(EVENT_TYPE, "create_key", "success", HttpStatus.OK.value(),
                null, secretContext(secretType, key));
        return ResponseEntity.ok(response);
    }

    @PutMapping(value = "/{secretType}/{key}", consumes = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Set a key", description = "Creates or replaces a key of a static secret, creating the secret if it does not exist.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Key updated.",
                    content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = SecretMutationResponse.class))),
            @ApiResponse(responseCode = "400", description = "Invalid name or missing value.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class))),
            @ApiResponse(responseCode = "502", description = "Vault error.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class)))
    })
    public SecretMutationResponse updateKey(
            @Parameter(description = "Name of the static secret.", required = true, example = "app")
            @PathVariable String secretType,
            @Parameter(description = "Key to set.", required = true, example = "log_level")
            @PathVariable String key,
            @Valid @RequestBody SecretValueRequest request
    ) {
        log.info("Controller: Received request to update key '{}' in static secret '{}'", key, secretType);
        SecretMutationResponse response = staticSecretService.updateKey(secretType, key, request.value());
        auditHelper.logHttpEvent(EVENT_TYPE, "update_key", "success", HttpStatus.OK.value(),
                null, secretContext(secretType, key));
        return response;
    }

    @DeleteMapping("/{secretType}/{key}")
    @Operation(summary = "Delete a key", description = "Removes a key from a static secret and stores the remaining keys as a new version.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Key deleted.",
                    content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = SecretMutationResponse.class))),
            @ApiResponse(responseCode = "404", description = "Secret or key not found.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class))),
            @ApiResponse(responseCode = "502", description = "Vault error.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class)))
    })
    public SecretMutationResponse deleteKey(
            @Parameter(description = "Name of the static secret.", required = true, example = "app")
            @PathVariable String secretType,
            @Parameter(description = "Key to remove.", required = true, example = "debug_mode")
            @PathVariable String key
    ) {
        log.info("Controller: Received request to delete key '{}' from static secret '{}'", key, secretType);
        SecretMutationResponse response = staticSecretService.deleteKey(secretType, key);
        auditHelper.logHttpEvent(EVENT_TYPE, "delete_key", "success", HttpStatus.OK.value(),
                null, secretContext(secretType, key));
        return response;
    }

    private static Map<String, Object> secretContext(String secretType, String key) {
        Map<String, Object> data = new HashMap<>();
        data.put("secret_type", secretType);
        if (key != null) {
            data.put("key", key);
        }
        return data;
    }
}
