package bugtrail.retention;

import java.util.List;

/**
 * Aggregated {@link ProjectPreview}s. Only projects with eligible reports are listed.
 */
public record RetentionPreview(
    List<ProjectPreview> affectedProjects,
    long totalReports,
    long totalStorageBytes,
    long legalHoldCount
) {

  public RetentionPreview {
    affectedProjects = List.copyOf(affectedProjects);
  }
}
