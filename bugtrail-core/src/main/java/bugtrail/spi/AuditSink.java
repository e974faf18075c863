package bugtrail.spi;

/**
 * Append-only destination for audit entries.
 */
@FunctionalInterface
public interface AuditSink {

    void append(AuditEntry entry);
}
