package tech.yump.gateway.service;

import tech.yump.gateway.api.dto.DynamicSecretResponse;
import tech.yump.gateway.secrets.CredentialProviderException;
import tech.yump.gateway.secrets.RoleNotFoundException;

import java.util.Map;
import java.util.Set;

/**
 * Service layer for dynamic database credentials served from the lease cache.
 */
public interface DynamicCredentialService {

    /**
     * Returns current credentials for a configured role, issuing new ones when the cached lease expired.
     *
     * @param role The configured role name.
     * @return The credentials and their lease metadata.
     * @throws RoleNotFoundException       If the role is not configured on the gateway or in Vault.
     * @throws CredentialProviderException If Vault failed to issue credentials.
     */
    DynamicSecretResponse getCredentials(String role) throws CredentialProviderException;

    /**
     * Returns credentials for every configured role keyed by the role's response key (e.g. "db_readonly").
     *
     * @throws CredentialProviderException If any role fails.
     */
    Map<String, DynamicSecretResponse> getAllCredentials() throws CredentialProviderException;

    Set<String> configuredRoles();
}
