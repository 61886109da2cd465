package tech.yump.gateway.secrets.kv;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.vault.VaultException;
import org.springframework.vault.core.VaultOperations;
import org.springframework.vault.core.VaultVersionedKeyValueOperations;
import org.springframework.vault.support.Versioned;
import org.springframework.web.client.RestClientException;
import tech.yump.gateway.config.GatewayProperties;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * {@link StaticSecretStore} backed by a Vault KV version 2 mount.
 */
@Slf4j
@Service
public class VaultKvStaticSecretStore implements StaticSecretStore {

    private static final Pattern NAME_PATTERN = Pattern.compile("[A-Za-z0-9_.-]+(/[A-Za-z0-9_.-]+)*");

    private final VaultOperations vaultOperations;
    private final String kvMount;

    public VaultKvStaticSecretStore(VaultOperations vaultOperations, GatewayProperties properties) {
        this.vaultOperations = vaultOperations;
        this.kvMount = properties.vault().kvMount();
    }

    @Override
    public Optional<StaticSecret> read(String name) {
        validateName(name);
        log.debug("Reading static secret '{}' from mount '{}'", name, kvMount);
        try {
            Versioned<Map<String, Object>> versioned = kv().get(name);
            if (versioned == null || !versioned.hasData()) {
                log.debug("No static secret found at {}/{}", kvMount, name);
                return Optional.empty();
            }
            Versioned.Metadata metadata = versioned.getMetadata();
            return Optional.of(new StaticSecret(
                    name,
                    versioned.getData(),
                    versioned.getVersion().getVersion(),
                    metadata != null ? metadata.getCreatedAt() : null
            ));
        } catch (VaultException | RestClientException e) {
            log.error("Vault error reading static secret {}/{}: {}", kvMount, name, e.getMessage(), e);
            throw new KVEngineException("Failed to read secret '" + name + "' from mount '" + kvMount + "'", e);
        }
    }

    @Override
    public List<String> list() {
        log.debug("Listing static secrets in mount '{}'", kvMount);
        try {
            List<String> names = kv().list("");
            return names != null ? names : Collections.emptyList();
        } catch (VaultException | RestClientException e) {
            log.error("Vault error listing static secrets in mount '{}': {}", kvMount, e.getMessage(), e);
            throw new KVEngineException("Failed to list secrets in mount '" + kvMount + "'", e);
        }
    }

    @Override
    public StaticSecretVersion write(String name, Map<String, Object> data) {
        validateName(name);
        if (data == null) {
            throw new IllegalArgumentException("Secret data cannot be null for write operation.");
        }
        log.debug("Writing static secret '{}' ({} keys) to mount '{}'", name, data.size(), kvMount);
        try {
            Versioned.Metadata metadata = kv().put(name, data);
            log.info("Wrote static secret '{}' version {}", name, metadata.getVersion().getVersion());
            return new StaticSecretVersion(metadata.getVersion().getVersion(), metadata.getCreatedAt());
        } catch (VaultException | RestClientException e) {
            log.error("Vault error writing static secret {}/{}: {}", kvMount, name, e.getMessage(), e);
            throw new KVEngineException("Failed to write secret '" + name + "' to mount '" + kvMount + "'", e);
        }
    }

    @Override
    public void destroy(String name) {
        validateName(name);
        log.debug("Deleting static secret '{}' with all versions from mount '{}'", name, kvMount);
        try {
            kv().opsForKeyValueMetadata().delete(name);
            log.info("Deleted static secret '{}' and all of its versions", name);
        } catch (VaultException | RestClientException e) {
            log.error("Vault error deleting static secret {}/{}: {}", kvMount, name, e.getMessage(), e);
            throw new KVEngineException("Failed to delete secret '" + name + "' from mount '" + kvMount + "'", e);
        }
    }

    private VaultVersionedKeyValueOperations kv() {
        return vaultOperations.opsForVersionedKeyValue(kvMount);
    }

    private void validateName(String name) {
        if (!StringUtils.hasText(name)) {
            throw new IllegalArgumentException("Secret name cannot be null or empty.");
        }
        if (!NAME_PATTERN.matcher(name).matches() || name.contains("..")) {
            throw new IllegalArgumentException("Invalid secret name: " + name);
        }
    }
}
