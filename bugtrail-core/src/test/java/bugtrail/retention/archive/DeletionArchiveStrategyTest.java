package bugtrail.retention.archive;

import bugtrail.spi.ArchiveResult;
import bugtrail.spi.ReportFiles;
import bugtrail.spi.StorageArchiver;
import bugtrail.testing.InMemoryStorageService;
import org.junit.jupiter.api.Test;

import java.util.List;

import static bugtrail.testing.InMemoryStorageService.url;
import static org.junit.jupiter.api.Assertions.*;

class DeletionArchiveStrategyTest {
  private final InMemoryStorageService storage = new InMemoryStorageService();
  private final DeletionArchiveStrategy strategy = new DeletionArchiveStrategy(storage);

  @Test
  void deletesFilesAndSumsSizes() {
    storage.put("s/1.png", 100).put("r/1.json", 50);

    ArchiveResult result = strategy.archiveBatch(List.of(
        new ReportFiles("1", url("s/1.png"), url("r/1.json")),
        new ReportFiles("2", null, null)));

    assertEquals(2, result.filesArchived());
    assertEquals(150, result.bytesArchived());
    assertTrue(result.errors().isEmpty());
    assertTrue(storage.objects.isEmpty());
  }

  @Test
  void missingObjectCountsWithZeroBytes() {
    ArchiveResult result = strategy.archiveBatch(List.of(new ReportFiles("1", url("gone.png"), null)));

    assertEquals(1, result.filesArchived());
    assertEquals(0, result.bytesArchived());
  }

  @Test
  void failingFileIsRecordedAndOthersContinue() {
    storage.put("bad.png", 10).put("good.json", 20);
    storage.failing.add("bad.png");

    ArchiveResult result = strategy.archiveBatch(List.of(
        new ReportFiles("1", url("bad.png"), url("good.json"))));

    assertEquals(1, result.filesArchived());
    assertEquals(20, result.bytesArchived());
    assertEquals(1, result.errors().size());
    assertEquals("bad.png", result.errors().get(0).key());
    assertTrue(storage.objects.containsKey("bad.png"));
  }

  @Test
  void registryCreatesByNameCaseInsensitively() {
    StorageArchivers archivers = new StorageArchivers();

    StorageArchiver created = archivers.create(" Deletion ", storage);

    assertEquals(DeletionArchiveStrategy.NAME, created.strategyName());
  }

  @Test
  void registryRejectsUnknownName() {
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
        () -> new StorageArchivers().create("glacier", storage));
    assertTrue(e.getMessage().contains("Unknown archive strategy: glacier"));
  }

  @Test
  void customStrategyCanBeRegistered() {
    StorageArchivers archivers = new StorageArchivers().register("noop", s -> new StorageArchiver() {
      @Override
      public ArchiveResult archiveBatch(List<ReportFiles> files) {
        return new ArchiveResult(0, 0, List.of());
      }

      @Override
      public String strategyName() {
        return "noop";
      }
    });

    assertEquals("noop", archivers.create("NOOP", storage).strategyName());
  }

  @Test
  void keysFromUrls() {
    assertEquals("screenshots/p1/a.png", StorageKeys.fromUrl("https://cdn.example.com/screenshots/p1/a.png"));
    assertEquals("screenshots/a b.png", StorageKeys.fromUrl("https://cdn.example.com/screenshots/a%20b.png"));
    assertEquals("plain/key.png", StorageKeys.fromUrl("plain/key.png"));
    assertNull(StorageKeys.fromUrl(null));
    assertNull(StorageKeys.fromUrl("  "));
  }
}
