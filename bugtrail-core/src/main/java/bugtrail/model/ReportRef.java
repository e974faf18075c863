package bugtrail.model;

/**
 * Identifies a bug report together with its owning project.
 */
public record ReportRef(String id, String projectId) {
}
