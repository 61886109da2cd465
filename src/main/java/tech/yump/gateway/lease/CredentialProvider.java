package tech.yump.gateway.lease;

import tech.yump.gateway.secrets.CredentialProviderException;
import tech.yump.gateway.secrets.RoleNotFoundException;

/**
 * Issues dynamic credentials for a role. Implemented by backend adapters;
 * the lease cache makes no assumption about transport or payload shape.
 */
@FunctionalInterface
public interface CredentialProvider {

    /**
     * Issues a fresh set of credentials for the given role.
     *
     * @param role The configured role name (e.g. "readonly").
     * @return The issued credential payload and its lease terms.
     * @throws RoleNotFoundException       If the backend does not know the role.
     * @throws CredentialProviderException If the backend refused or failed to issue credentials.
     */
    IssuedCredential issue(String role) throws CredentialProviderException;
}
