package tech.yump.gateway.secrets;

/**
 * Base exception for failures talking to, or reported by, the secret backend.
 */
public class SecretsEngineException extends RuntimeException {
    public SecretsEngineException(String message) {
        super(message);
    }

    public SecretsEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
