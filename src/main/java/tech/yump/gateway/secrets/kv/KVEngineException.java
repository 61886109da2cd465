package tech.yump.gateway.secrets.kv;

import tech.yump.gateway.secrets.SecretsEngineException;

/**
 * Thrown when the KV backend cannot be read from or written to.
 */
public class KVEngineException extends SecretsEngineException {

    public KVEngineException(String message) {
        super(message);
    }

    public KVEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
