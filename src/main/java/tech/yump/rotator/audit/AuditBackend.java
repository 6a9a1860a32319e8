package tech.yump.rotator.audit;

/**
 * Sink for audit events.
 */
public interface AuditBackend {

    /**
     * Records the given event. Implementations decide where it goes (console, file, ...).
     *
     * @param event The event to record. Must not be null.
     */
    void logEvent(AuditEvent event);

}
