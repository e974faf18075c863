package bugtrail.spi;

import bugtrail.model.ArchivedBugReport;
import bugtrail.model.BugReport;
import bugtrail.model.ReportRef;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Relational operations used by the retention lifecycle.
 *
 * <p>Every mutating method excludes reports on legal hold itself; callers do not rely on
 * having filtered them earlier.
 */
public interface RetentionRepository {

    /**
     * Reports of a project created before {@code cutoff} that are neither soft-deleted nor
     * on legal hold, oldest first.
     */
    List<BugReport> findEligibleForDeletion(String projectId, Instant cutoff);

    /**
     * Loads reports by id, including soft-deleted ones. Unknown ids are skipped.
     */
    List<BugReport> findByIds(Collection<String> reportIds);

    /**
     * Sets {@code deleted_at} and {@code deleted_by} on live reports not on legal hold.
     *
     * @param deletedBy acting user, or {@code null} for policy-driven deletes
     * @return rows updated
     */
    int softDelete(Collection<String> reportIds, String deletedBy);

    /**
     * In one transaction: reads the requested reports that are not on legal hold and
     * deletes exactly those rows.
     *
     * @return the deleted reports; empty when nothing was eligible
     */
    List<ReportRef> hardDeleteInTransaction(Collection<String> reportIds);

    /**
     * Clears {@code deleted_at}/{@code deleted_by} on soft-deleted reports.
     *
     * @return rows updated
     */
    int restore(Collection<String> reportIds);

    /**
     * Sets the legal-hold flag regardless of its current value.
     *
     * @return rows updated
     */
    int setLegalHold(Collection<String> reportIds, boolean hold);

    /**
     * Distinct project ids owning the given reports.
     */
    List<String> findProjectIds(Collection<String> reportIds);

    /**
     * Number of live reports currently on legal hold.
     */
    long countLegalHoldReports();

    /**
     * Inserts archive copies in one transaction, skipping ids that are already archived.
     *
     * @return the rows actually inserted
     */
    List<ArchivedBugReport> insertArchived(List<ArchivedBugReport> reports);
}
