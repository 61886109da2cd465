package tech.yump.gateway.audit;

/**
 * Destination for audit events.
 */
public interface AuditBackend {

    /**
     * Records an audit event. Implementations must not throw for serialization problems.
     *
     * @param event The AuditEvent to log. Must not be null.
     */
    void logEvent(AuditEvent event);

}
