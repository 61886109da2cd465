package tech.yump.gateway.secrets.kv;

import tech.yump.gateway.secrets.SecretsEngineException;

/**
 * Exception thrown when a static secret, or a key inside it, does not exist.
 */
public class StaticSecretNotFoundException extends SecretsEngineException {

    public StaticSecretNotFoundException(String secretName) {
        super("Secret type '" + secretName + "' not found");
    }

    public StaticSecretNotFoundException(String secretName, String key) {
        super("Key '" + key + "' not found in " + secretName);
    }
}
