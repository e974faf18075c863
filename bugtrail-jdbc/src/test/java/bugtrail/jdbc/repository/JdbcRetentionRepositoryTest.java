package bugtrail.jdbc.repository;

import bugtrail.jdbc.H2Database;
import bugtrail.model.ArchivedBugReport;
import bugtrail.model.BugReport;
import bugtrail.model.ReportRef;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class JdbcRetentionRepositoryTest {
  private static final Instant NOW = Instant.now();
  private static final Instant OLD = NOW.minus(Duration.ofDays(100));

  private H2Database db;
  private JdbcRetentionRepository repository;

  @BeforeEach
  void setUp() {
    db = H2Database.create();
    repository = new JdbcRetentionRepository(db.connectionProvider());
    db.insertProject("p1", "Web", null);
    db.insertProject("p2", "Mobile", null);
    db.insertReport("old-1", "p1", OLD.plusSeconds(1), "https://cdn/s/1.png", null, false);
    db.insertReport("old-2", "p1", OLD, null, "https://cdn/r/2.json", false);
    db.insertReport("held", "p1", OLD, null, null, true);
    db.insertReport("new", "p1", NOW.minus(Duration.ofDays(1)));
    db.insertReport("other", "p2", OLD);
  }

  private BugReport find(String id) {
    List<BugReport> found = repository.findByIds(List.of(id));
    return found.isEmpty() ? null : found.get(0);
  }

  @Test
  void eligibleExcludesHeldNewAndOtherProjects() {
    List<BugReport> eligible = repository.findEligibleForDeletion("p1", NOW.minus(Duration.ofDays(30)));

    assertEquals(List.of("old-2", "old-1"), eligible.stream().map(BugReport::id).toList());
    BugReport first = eligible.get(0);
    assertEquals("https://cdn/r/2.json", first.replayUrl());
    assertEquals("firefox", first.metadata().get("browser"));
    assertEquals("high", first.priority());
    assertFalse(first.legalHold());
  }

  @Test
  void softDeleteSkipsHeldAndAlreadyDeleted() {
    assertEquals(2, repository.softDelete(List.of("old-1", "held", "new"), "user-1"));
    assertEquals(0, repository.softDelete(List.of("old-1"), "user-2"));

    BugReport deleted = find("old-1");
    assertNotNull(deleted.deletedAt());
    assertEquals("user-1", deleted.deletedBy());
    assertNull(find("held").deletedAt());
    assertTrue(repository.findEligibleForDeletion("p1", NOW).stream().noneMatch(r -> r.id().equals("old-1")));
  }

  @Test
  void restoreOnlyTouchesDeletedReports() {
    repository.softDelete(List.of("old-1"), null);

    assertEquals(1, repository.restore(List.of("old-1", "old-2")));
    assertNull(find("old-1").deletedAt());
    assertNull(find("old-1").deletedBy());
  }

  @Test
  void hardDeleteNeverRemovesHeldReports() {
    List<ReportRef> deleted = repository.hardDeleteInTransaction(List.of("old-1", "held", "other", "missing"));

    assertEquals(2, deleted.size());
    assertTrue(deleted.contains(new ReportRef("old-1", "p1")));
    assertTrue(deleted.contains(new ReportRef("other", "p2")));
    assertNull(find("old-1"));
    assertNotNull(find("held"));
    assertTrue(repository.hardDeleteInTransaction(List.of("held")).isEmpty());
  }

  @Test
  void legalHoldToggles() {
    assertEquals(2, repository.setLegalHold(List.of("old-1", "other"), true));
    assertEquals(3, repository.countLegalHoldReports());
    assertTrue(find("other").legalHold());

    assertEquals(1, repository.setLegalHold(List.of("held"), false));
    assertEquals(2, repository.countLegalHoldReports());
  }

  @Test
  void countLegalHoldIgnoresDeletedReports() {
    repository.setLegalHold(List.of("old-1"), true);
    db.update("UPDATE bug_reports SET deleted_at=? WHERE id=?", NOW, "old-1");

    assertEquals(1, repository.countLegalHoldReports());
  }

  @Test
  void projectIdsAreDistinctAndSorted() {
    assertEquals(List.of("p1", "p2"), repository.findProjectIds(List.of("other", "old-1", "old-2")));
    assertTrue(repository.findProjectIds(List.of()).isEmpty());
  }

  @Test
  void insertArchivedSkipsExistingAndDuplicateIds() {
    BugReport report = find("old-1");
    Instant deletedAt = NOW.minusSeconds(60);
    ArchivedBugReport row = ArchivedBugReport.of(report, "retention_policy", null, deletedAt, NOW);

    List<ArchivedBugReport> inserted = repository.insertArchived(List.of(row, row));
    assertEquals(1, inserted.size());
    assertTrue(repository.insertArchived(List.of(row)).isEmpty());
    assertEquals(1, db.count("archived_bug_reports"));

    String reason = db.queryOne("SELECT archived_reason FROM archived_bug_reports WHERE id=?",
        rs -> rs.getString("archived_reason"), "old-1");
    assertEquals("retention_policy", reason);
    String metadata = db.queryOne("SELECT metadata FROM archived_bug_reports WHERE id=?",
        rs -> rs.getString("metadata"), "old-1");
    assertTrue(metadata.contains("firefox"));
  }

  @Test
  void insertArchivedSkipsRowCommittedByConcurrentSweep() throws Exception {
    Instant deletedAt = NOW.minusSeconds(60);
    ArchivedBugReport first = ArchivedBugReport.of(find("old-1"), "retention_policy", null, deletedAt, NOW);
    ArchivedBugReport second = ArchivedBugReport.of(find("old-2"), "retention_policy", null, deletedAt, NOW);

    try (Connection other = db.dataSource().getConnection()) {
      other.setAutoCommit(false);
      try (PreparedStatement ps = other.prepareStatement(
          "INSERT INTO archived_bug_reports (id, project_id, title, status, priority, original_created_at,"
              + " original_updated_at, deleted_at, archived_at, archived_reason) VALUES (?,?,?,?,?,?,?,?,?,?)")) {
        ps.setString(1, "old-1");
        ps.setString(2, "p1");
        ps.setString(3, "Other sweep");
        ps.setString(4, "open");
        ps.setString(5, "medium");
        ps.setTimestamp(6, Timestamp.from(OLD));
        ps.setTimestamp(7, Timestamp.from(OLD));
        ps.setTimestamp(8, Timestamp.from(deletedAt));
        ps.setTimestamp(9, Timestamp.from(NOW));
        ps.setString(10, "retention_policy");
        ps.executeUpdate();
      }

      CompletableFuture<List<ArchivedBugReport>> archiving =
          CompletableFuture.supplyAsync(() -> repository.insertArchived(List.of(first, second)));
      Thread.sleep(200);
      other.commit();

      List<ArchivedBugReport> inserted = archiving.get(10, TimeUnit.SECONDS);
      assertEquals(List.of("old-2"), inserted.stream().map(ArchivedBugReport::id).toList());
    }

    assertEquals(2, db.count("archived_bug_reports"));
    String title = db.queryOne("SELECT title FROM archived_bug_reports WHERE id=?",
        rs -> rs.getString("title"), "old-1");
    assertEquals("Other sweep", title);
  }

  @Test
  void emptyInputsShortCircuit() {
    assertTrue(repository.findByIds(List.of()).isEmpty());
    assertEquals(0, repository.softDelete(List.of(), null));
    assertEquals(0, repository.restore(List.of()));
    assertEquals(0, repository.setLegalHold(List.of(), true));
    assertTrue(repository.insertArchived(List.of()).isEmpty());
  }
}
