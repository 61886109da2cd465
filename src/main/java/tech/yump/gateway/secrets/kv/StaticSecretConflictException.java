package tech.yump.gateway.secrets.kv;

import tech.yump.gateway.secrets.SecretsEngineException;

/**
 * Exception thrown when creating a static secret or key that already exists.
 */
public class StaticSecretConflictException extends SecretsEngineException {

    public StaticSecretConflictException(String secretName) {
        super("Secret type '" + secretName + "' already exists");
    }

    public StaticSecretConflictException(String secretName, String key) {
        super("Key '" + key + "' already exists in " + secretName);
    }
}
