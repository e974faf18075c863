package bugtrail.model;

/**
 * Per-project retention settings.
 *
 * <p>Reports older than {@code bugReportRetentionDays} are soft-deleted by the retention
 * sweep; {@code archiveBeforeDelete} routes their files through the storage archiver
 * first. The per-artifact day counts are informational for compliance validation and
 * default to the report retention when zero.
 */
public record RetentionPolicy(
    int bugReportRetentionDays,
    int screenshotRetentionDays,
    int replayRetentionDays,
    int attachmentRetentionDays,
    int archivedRetentionDays,
    boolean archiveBeforeDelete,
    DataClassification dataClassification,
    ComplianceRegion complianceRegion
) {

  public RetentionPolicy {
    if (bugReportRetentionDays < 1) {
      throw new IllegalArgumentException("bugReportRetentionDays must be >= 1, got: " + bugReportRetentionDays);
    }
    if (screenshotRetentionDays < 0 || replayRetentionDays < 0
        || attachmentRetentionDays < 0 || archivedRetentionDays < 0) {
      throw new IllegalArgumentException("retention days must be >= 0");
    }
    dataClassification = dataClassification == null ? DataClassification.GENERAL : dataClassification;
    complianceRegion = complianceRegion == null ? ComplianceRegion.NONE : complianceRegion;
  }

  /**
   * Policy with only the report retention window set.
   */
  public static RetentionPolicy of(int bugReportRetentionDays, boolean archiveBeforeDelete) {
    return new RetentionPolicy(bugReportRetentionDays, 0, 0, 0, 0, archiveBeforeDelete,
        DataClassification.GENERAL, ComplianceRegion.NONE);
  }

  public RetentionPolicy withCompliance(DataClassification classification, ComplianceRegion region) {
    return new RetentionPolicy(bugReportRetentionDays, screenshotRetentionDays, replayRetentionDays,
        attachmentRetentionDays, archivedRetentionDays, archiveBeforeDelete, classification, region);
  }
}
