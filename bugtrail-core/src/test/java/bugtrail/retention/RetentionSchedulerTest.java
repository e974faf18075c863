package bugtrail.retention;

import bugtrail.model.Project;
import bugtrail.model.RetentionPolicy;
import bugtrail.testing.InMemoryRetentionStore;
import bugtrail.testing.InMemoryStorageService;
import bugtrail.testing.RecordingAuditSink;
import bugtrail.testing.Reports;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RetentionSchedulerTest {
  private static final Instant NOW = Instant.parse("2024-06-01T10:00:00Z");

  private final InMemoryRetentionStore store = new InMemoryRetentionStore();
  private final RecordingNotifier notifier = new RecordingNotifier();

  private RetentionService service(InMemoryRetentionStore projects) {
    return RetentionService.builder()
        .projectRepository(projects)
        .retentionRepository(store)
        .storageService(new InMemoryStorageService())
        .auditSink(new RecordingAuditSink())
        .sleeper(millis -> { })
        .clock(Clock.fixed(NOW, ZoneOffset.UTC))
        .build();
  }

  private RetentionScheduler.Builder scheduler() {
    return RetentionScheduler.builder()
        .retentionService(service(store))
        .options(RetentionOptions.builder().delayMs(0).build())
        .notifier(notifier);
  }

  @Test
  void nextRunLaterToday() {
    RetentionScheduler scheduler = scheduler().runTime(LocalTime.of(14, 30)).build();

    assertEquals(Instant.parse("2024-06-01T14:30:00Z"), scheduler.computeNextRun(NOW));
  }

  @Test
  void nextRunTomorrowWhenTimeHasPassed() {
    RetentionScheduler scheduler = scheduler().runTime(LocalTime.of(2, 0)).build();

    assertEquals(Instant.parse("2024-06-02T02:00:00Z"), scheduler.computeNextRun(NOW));
    assertEquals(Instant.parse("2024-06-02T02:00:00Z"),
        scheduler.computeNextRun(Instant.parse("2024-06-01T02:00:00Z")));
  }

  @Test
  void nextRunHonoursZone() {
    RetentionScheduler scheduler = scheduler()
        .runTime(LocalTime.of(2, 0))
        .zone(ZoneId.of("Asia/Almaty"))
        .build();

    Instant next = scheduler.computeNextRun(NOW);

    assertEquals(LocalTime.of(2, 0), next.atZone(ZoneId.of("Asia/Almaty")).toLocalTime());
    assertTrue(next.isAfter(NOW));
    assertTrue(Duration.between(NOW, next).compareTo(Duration.ofDays(1)) <= 0);
  }

  @Test
  void runOnceNotifiesResult() {
    store.project(new Project("p1", "One", NOW, RetentionPolicy.of(30, false)))
        .report(Reports.report("r1", "p1", NOW.minus(Duration.ofDays(40))));
    RetentionScheduler scheduler = scheduler().build();

    RetentionResult result = scheduler.runOnce();

    assertNotNull(result);
    assertEquals(1, result.totalDeleted());
    assertEquals(List.of(result), notifier.completed);
    assertFalse(scheduler.isRunning());
  }

  @Test
  void failedSweepIsReportedAndSwallowed() {
    InMemoryRetentionStore broken = new InMemoryRetentionStore() {
      @Override
      public synchronized List<Project> findAll() {
        throw new IllegalStateException("projects table missing");
      }
    };
    RetentionScheduler scheduler = RetentionScheduler.builder()
        .retentionService(service(broken))
        .notifier(notifier)
        .build();

    assertNull(scheduler.runOnce());
    assertEquals(1, notifier.failed.size());
    assertEquals("projects table missing", notifier.failed.get(0).getMessage());
    assertFalse(scheduler.isRunning());
  }

  @Test
  void overlappingRunIsSkipped() {
    List<RetentionResult> nested = new ArrayList<>();
    List<Boolean> manual = new ArrayList<>();
    RetentionScheduler[] holder = new RetentionScheduler[1];
    holder[0] = scheduler().notifier(new RetentionNotifier() {
      @Override
      public void onCompleted(RetentionResult result, long durationMs) {
        nested.add(holder[0].runOnce());
        manual.add(holder[0].triggerManual());
      }

      @Override
      public void onFailed(Throwable error) {
        fail(error);
      }
    }).build();

    assertTrue(holder[0].triggerManual());
    assertEquals(1, nested.size());
    assertNull(nested.get(0));
    assertEquals(List.of(false), manual);
  }

  @Test
  void notifierFailureDoesNotFailRun() {
    RetentionScheduler scheduler = scheduler().notifier(new RetentionNotifier() {
      @Override
      public void onCompleted(RetentionResult result, long durationMs) {
        throw new IllegalStateException("mail server down");
      }

      @Override
      public void onFailed(Throwable error) {
      }
    }).build();

    assertNotNull(scheduler.runOnce());
  }

  @Test
  void startSchedulesAndCloseStops() {
    RetentionScheduler scheduler = scheduler()
        .runTime(LocalTime.of(3, 0))
        .clock(Clock.fixed(NOW, ZoneOffset.UTC))
        .build();
    assertNull(scheduler.nextRunTime());

    scheduler.start();
    assertEquals(Instant.parse("2024-06-02T03:00:00Z"), scheduler.nextRunTime());

    scheduler.close();
    assertNull(scheduler.nextRunTime());
    assertNull(scheduler.runOnce());
    assertThrows(IllegalStateException.class, scheduler::start);
  }

  private static final class RecordingNotifier implements RetentionNotifier {
    private final List<RetentionResult> completed = new ArrayList<>();
    private final List<Throwable> failed = new ArrayList<>();

    @Override
    public void onCompleted(RetentionResult result, long durationMs) {
      completed.add(result);
    }

    @Override
    public void onFailed(Throwable error) {
      failed.add(error);
    }
  }
}
