package tech.yump.gateway.secrets;

import lombok.Getter;

/**
 * Thrown to a caller whose thread was interrupted while waiting for another caller's refresh of a role.
 * The refresh itself keeps running.
 */
@Getter
public class LeaseWaitInterruptedException extends SecretsEngineException {

    private final String role;

    public LeaseWaitInterruptedException(String role, InterruptedException cause) {
        super("Interrupted while waiting for credentials of role '" + role + "'", cause);
        this.role = role;
    }
}
