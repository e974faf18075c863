package bugtrail.retention;

import bugtrail.model.ComplianceRegion;
import bugtrail.model.DataClassification;

import java.time.Instant;
import java.util.List;

/**
 * Proof that a set of reports was permanently deleted.
 *
 * <p>{@code verificationHash} is computed by {@link DeletionCertificates#computeHash}; use
 * {@link DeletionCertificates#verify(DeletionCertificate)} to check an issued certificate.
 *
 * @param reportIds  deleted report ids, sorted
 * @param deletedBy  acting user id, or {@code system}
 */
public record DeletionCertificate(
    String certificateId,
    String projectId,
    List<String> reportIds,
    Instant deletedAt,
    String deletedBy,
    DeletionReason reason,
    DataClassification dataClassification,
    ComplianceRegion complianceRegion,
    String verificationHash,
    Instant issuedAt
) {

  public DeletionCertificate {
    reportIds = reportIds.stream().sorted().toList();
    dataClassification = dataClassification == null ? DataClassification.GENERAL : dataClassification;
    complianceRegion = complianceRegion == null ? ComplianceRegion.NONE : complianceRegion;
  }
}
