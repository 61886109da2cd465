package tech.yump.gateway.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import tech.yump.gateway.api.dto.SecretMutationResponse;
import tech.yump.gateway.api.dto.StaticSecretView;
import tech.yump.gateway.secrets.kv.KVEngineException;
import tech.yump.gateway.secrets.kv.StaticSecret;
import tech.yump.gateway.secrets.kv.StaticSecretConflictException;
import tech.yump.gateway.secrets.kv.StaticSecretNotFoundException;
import tech.yump.gateway.secrets.kv.StaticSecretStore;
import tech.yump.gateway.secrets.kv.StaticSecretVersion;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * CRUD on static key/value secrets. Key-level changes read the latest version, modify it
 * and write the whole map back as a new version.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StaticSecretService {

    private final StaticSecretStore staticSecretStore;

    /**
     * Reads every top-level secret of the mount. Secrets that cannot be read are logged and skipped;
     * a failure to list the mount is propagated.
     *
     * @return secret name → view, sorted by name.
     */
    public Map<String, StaticSecretView> listAll() {
        Map<String, StaticSecretView> secrets = new TreeMap<>();
        for (String listed : staticSecretStore.list()) {
            String name = listed.endsWith("/") ? listed.substring(0, listed.length() - 1) : listed;
            try {
                staticSecretStore.read(name)
                        .ifPresent(secret -> secrets.put(name, StaticSecretView.from(secret)));
            } catch (KVEngineException | IllegalArgumentException e) {
                log.warn("Error reading secret {}: {}", name, e.getMessage());
            }
        }
        return secrets;
    }

    public StaticSecretView get(String secretName) {
        return StaticSecretView.from(require(secretName));
    }

    /**
     * Creates a new secret with the given key/value pairs.
     *
     * @throws StaticSecretConflictException if a secret with that name exists.
     */
    public SecretMutationResponse createSecret(String secretName, Map<String, Object> data) {
        if (data == null || data.isEmpty()) {
            throw new IllegalArgumentException("Secret '" + secretName + "' must contain at least one key.");
        }
        if (staticSecretStore.read(secretName).isPresent()) {
            throw new StaticSecretConflictException(secretName);
        }

        StaticSecretVersion written = staticSecretStore.write(secretName, data);
        StaticSecret created = staticSecretStore.read(secretName)
                .orElseThrow(() -> new KVEngineException("Secret '" + secretName + "' was not readable after creation"));
        log.info("Created secret type '{}' with {} keys (version {})", secretName, data.size(), written.version());

        return new SecretMutationResponse(
                "success",
                "New secret type '" + secretName + "' created",
                created.data(),
                null,
                new StaticSecretView.VersionMetadata(created.version(), created.createdTime())
        );
    }

    /**
     * Permanently deletes a secret with all its versions.
     *
     * @throws StaticSecretNotFoundException if the secret does not exist.
     */
    public SecretMutationResponse deleteSecret(String secretName) {
        require(secretName);
        staticSecretStore.destroy(secretName);
        log.info("Deleted entire secret '{}'", secretName);
        return SecretMutationResponse.success("Entire secret '" + secretName + "' deleted successfully");
    }

    /**
     * Adds a key to a secret, creating the secret if it does not exist.
     *
     * @throws StaticSecretConflictException if the key already exists.
     */
    public SecretMutationResponse createKey(String secretName, String key, String value) {
        validateKey(key);
        Map<String, Object> data = currentData(secretName);
        if (data.containsKey(key)) {
            throw new StaticSecretConflictException(secretName, key);
        }
        data.put(key, value);
        staticSecretStore.write(secretName, data);
        log.info("Created key '{}' in {}", key, secretName);
        return SecretMutationResponse.withData("Key '" + key + "' created in " + secretName, singleEntry(key, value));
    }

    /**
     * Sets a key of a secret, creating the key and the secret as needed.
     */
    public SecretMutationResponse updateKey(String secretName, String key, String value) {
        validateKey(key);
        Map<String, Object> data = currentData(secretName);
        data.put(key, value);
        staticSecretStore.write(secretName, data);
        log.info("Updated key '{}' in {}", key, secretName);
        return SecretMutationResponse.withData("Key '" + key + "' updated in " + secretName, singleEntry(key, value));
    }

    /**
     * Removes a key from a secret and writes the remaining keys as a new version.
     *
     * @throws StaticSecretNotFoundException if the secret or the key does not exist.
     */
    public SecretMutationResponse deleteKey(String secretName, String key) {
        Map<String, Object> data = new LinkedHashMap<>(require(secretName).data());
        if (!data.containsKey(key)) {
            throw new StaticSecretNotFoundException(secretName, key);
        }
        data.remove(key);
        staticSecretStore.write(secretName, data);
        log.info("Deleted key '{}' from {}", key, secretName);

        List<String> remaining = new ArrayList<>(data.keySet());
        return new SecretMutationResponse(
                "success", "Key '" + key + "' deleted from " + secretName, null, remaining, null);
    }

    private StaticSecret require(String secretName) {
        return staticSecretStore.read(secretName)
                .orElseThrow(() -> new StaticSecretNotFoundException(secretName));
    }

    private Map<String, Object> currentData(String secretName) {
        Optional<StaticSecret> existing = staticSecretStore.read(secretName);
        return existing.<Map<String, Object>>map(secret -> new LinkedHashMap<>(secret.data()))
                .orElseGet(LinkedHashMap::new);
    }

    private static void validateKey(String key) {
        if (!StringUtils.hasText(key)) {
            throw new IllegalArgumentException("Secret key cannot be null or empty.");
        }
    }

    private static Map<String, Object> singleEntry(String key, Object value) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put(key, value);
        return entry;
    }
}
