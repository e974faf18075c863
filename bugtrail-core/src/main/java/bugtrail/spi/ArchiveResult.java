package bugtrail.spi;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of archiving report files.
 *
 * @param filesArchived files moved or deleted
 * @param bytesArchived total size of those files
 * @param errors        per-file failures
 */
public record ArchiveResult(int filesArchived, long bytesArchived, List<FileError> errors) {

  public static final ArchiveResult EMPTY = new ArchiveResult(0, 0L, List.of());

  public ArchiveResult {
    errors = List.copyOf(errors);
  }

  public ArchiveResult plus(ArchiveResult other) {
    List<FileError> merged = new ArrayList<>(errors);
    merged.addAll(other.errors);
    return new ArchiveResult(filesArchived + other.filesArchived,
        bytesArchived + other.bytesArchived, merged);
  }

  /**
   * A file that could not be archived.
   */
  public record FileError(String key, String error) {
  }
}
