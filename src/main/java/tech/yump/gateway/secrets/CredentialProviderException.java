package tech.yump.gateway.secrets;

import lombok.Getter;

/**
 * Thrown when the backend refuses or fails to issue credentials for a role
 * (network failure, authorization failure, unknown role).
 * All callers waiting on the same refresh round receive the same instance.
 */
@Getter
public class CredentialProviderException extends SecretsEngineException {

    private final String role;

    public CredentialProviderException(String role, String message) {
        super(message);
        this.role = role;
    }

    public CredentialProviderException(String role, String message, Throwable cause) {
        super(message, cause);
        this.role = role;
    }

    public CredentialProviderException(String role, Throwable cause) {
        this(role, "Failed to issue credentials for role '" + role + "': " + cause.getMessage(), cause);
    }
}
