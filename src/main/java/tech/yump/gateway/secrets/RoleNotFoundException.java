package tech.yump.gateway.secrets;

/**
 * Exception thrown when the backend has no configuration for a requested role.
 */
public class RoleNotFoundException extends CredentialProviderException {
    public RoleNotFoundException(String role) {
        super(role, "Role not found or configured: " + role);
    }

    public RoleNotFoundException(String role, Throwable cause) {
        super(role, "Role not found or configured: " + role, cause);
    }
}
