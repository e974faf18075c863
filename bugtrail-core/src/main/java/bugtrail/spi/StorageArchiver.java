package bugtrail.spi;

import java.util.List;

/**
 * Moves or deletes the stored files of reports leaving primary storage.
 *
 * <p>The retention service does not know whether files are deleted or moved to colder
 * storage; it only tallies the result.
 *
 * @see bugtrail.retention.archive.DeletionArchiveStrategy
 */
public interface StorageArchiver {

    /**
     * Archives the files of several reports. Per-file failures are reported in the result,
     * not thrown.
     */
    ArchiveResult archiveBatch(List<ReportFiles> files);

    /**
     * Short strategy name, e.g. {@code "deletion"}.
     */
    String strategyName();
}
