package tech.yump.gateway.probe;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.vault.VaultException;
import org.springframework.vault.core.VaultOperations;
import org.springframework.vault.support.VaultMount;
import org.springframework.web.client.RestClientException;
import tech.yump.gateway.secrets.SecretsEngineException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Read-only checks against Vault used by health, debug and startup code.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class VaultBackendProbe {

    static final String TOKEN_LOOKUP_SELF_PATH = "auth/token/lookup-self";

    private final VaultOperations vaultOperations;

    /**
     * @return true if Vault is reachable and accepts the configured token.
     */
    public boolean isAuthenticated() {
        try {
            return vaultOperations.read(TOKEN_LOOKUP_SELF_PATH) != null;
        } catch (VaultException | RestClientException e) {
            log.debug("Vault authentication check failed: {}", e.getMessage());
            return false;
        }
    }

    /**
     * @return mount paths of all enabled secrets engines (e.g. "database/", "secret/"), sorted.
     * @throws SecretsEngineException if the mounts cannot be listed.
     */
    public List<String> listSecretsEngines() {
        try {
            Map<String, VaultMount> mounts = vaultOperations.opsForSys().getMounts();
            List<String> paths = new ArrayList<>(mounts.keySet());
            Collections.sort(paths);
            return paths;
        } catch (VaultException | RestClientException e) {
            throw new SecretsEngineException("Failed to list Vault secrets engines: " + e.getMessage(), e);
        }
    }

    /**
     * @return role names configured in the given database secrets engine mount.
     * @throws SecretsEngineException if the roles cannot be listed.
     */
    public List<String> listDatabaseRoles(String databaseMount) {
        try {
            List<String> roles = vaultOperations.list(databaseMount + "/roles");
            return roles != null ? roles : Collections.emptyList();
        } catch (VaultException | RestClientException e) {
            throw new SecretsEngineException("Failed to list database roles in '" + databaseMount + "': " + e.getMessage(), e);
        }
    }
}
