package bugtrail.jdbc.worker;

import bugtrail.jdbc.H2Database;
import bugtrail.jdbc.store.H2JobStore;
import bugtrail.model.JobRecord;
import bugtrail.model.JobState;
import bugtrail.queue.Backoff;
import bugtrail.queue.JobOptions;
import bugtrail.queue.JobQueue;
import bugtrail.queue.QueueName;
import bugtrail.queue.QueueSettings;
import bugtrail.worker.JobHandler;
import bugtrail.worker.QueueWorker;
import bugtrail.worker.WorkerListener;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

class QueueWorkerIntegrationTest {
  private JobQueue queue;
  private QueueWorker<Ping, Map<String, Object>> worker;
  private final List<String> completed = new CopyOnWriteArrayList<>();
  private final List<String> failed = new CopyOnWriteArrayList<>();

  record Ping(String id, boolean fail) {
  }

  private final WorkerListener listener = new WorkerListener() {
    @Override
    public void onCompleted(String workerName, JobRecord job, long processingTimeMs) {
      completed.add(job.jobId());
    }

    @Override
    public void onFailed(String workerName, JobRecord job, Throwable error) {
      failed.add(error.getMessage());
    }
  };

  @BeforeEach
  void setUp() {
    queue = JobQueue.builder()
        .connectionProvider(H2Database.create().connectionProvider())
        .jobStore(new H2JobStore())
        .settings(QueueSettings.defaults())
        .shutdownTimeoutMs(0)
        .build();
  }

  @AfterEach
  void tearDown() {
    if (worker != null) {
      worker.close();
    }
    queue.shutdown();
  }

  private QueueWorker<Ping, Map<String, Object>> worker(int concurrency,
      JobHandler<Ping, Map<String, Object>> handler) {
    return QueueWorker.<Ping, Map<String, Object>>builder()
        .name("notification")
        .queue(QueueName.NOTIFICATIONS)
        .jobQueue(queue)
        .payloadType(Ping.class)
        .handler(handler)
        .concurrency(concurrency)
        .pollIntervalMs(20)
        .drainTimeoutMs(2000)
        .listener(listener)
        .build();
  }

  private String enqueue(String id, boolean fail) {
    return queue.addJob("notifications", "ping", new Ping(id, fail),
        JobOptions.builder().attempts(1).backoff(Backoff.fixed(0)).build());
  }

  private static void await(BooleanSupplier condition) throws InterruptedException {
    long deadline = System.currentTimeMillis() + 10_000;
    while (!condition.getAsBoolean()) {
      if (System.currentTimeMillis() > deadline) {
        fail("condition not met within 10s");
      }
      Thread.sleep(20);
    }
  }

  @Test
  void processesJobsWithinConcurrencyLimit() throws Exception {
    AtomicInteger running = new AtomicInteger();
    AtomicInteger maxRunning = new AtomicInteger();
    worker = worker(2, ctx -> {
      int now = running.incrementAndGet();
      maxRunning.accumulateAndGet(now, Math::max);
      Thread.sleep(50);
      running.decrementAndGet();
      ctx.progress(1).complete("done");
      return Map.of("id", ctx.data().id());
    });
    for (int i = 0; i < 6; i++) {
      enqueue("p" + i, false);
    }

    worker.start();
    await(() -> completed.size() == 6);

    assertTrue(maxRunning.get() <= 2);
    assertEquals(6, queue.getQueueMetrics("notifications").completed());
    String jobId = completed.get(0);
    assertTrue(queue.getJobStatus("notifications", jobId).result().contains("\"id\":\"p"));
    assertTrue(queue.getJobStatus("notifications", jobId).progress().contains("\"percentage\":100"));
  }

  @Test
  void handlerFailureFailsTheJobAndNotifiesListener() throws Exception {
    worker = worker(1, ctx -> {
      if (ctx.data().fail()) {
        throw new IllegalStateException("boom " + ctx.data().id());
      }
      return Map.of();
    });
    String jobId = enqueue("x", true);

    worker.start();
    await(() -> !failed.isEmpty());
    await(() -> queue.getJobStatus("notifications", jobId).state() == JobState.FAILED);

    assertEquals(List.of("boom x"), failed);
    assertEquals("boom x", queue.getJobStatus("notifications", jobId).failedReason());
    assertTrue(completed.isEmpty());
  }

  @Test
  void handlerErrorFailsTheJobInsteadOfLeavingItInFlight() throws Exception {
    worker = worker(1, ctx -> {
      throw new NoClassDefFoundError("javax/imageio/ImageIO");
    });
    String jobId = enqueue("img", false);

    worker.start();
    await(() -> queue.getJobStatus("notifications", jobId).state() == JobState.FAILED);
    await(() -> !failed.isEmpty());

    assertEquals(List.of("javax/imageio/ImageIO"), failed);
    assertEquals("javax/imageio/ImageIO", queue.getJobStatus("notifications", jobId).failedReason());
    assertEquals(0, queue.inFlightCount());
    assertTrue(worker.isRunning());
  }

  @Test
  void pausedWorkerClaimsNothing() throws Exception {
    worker = worker(1, ctx -> Map.of());
    worker.start();
    worker.pause();
    String jobId = enqueue("later", false);

    Thread.sleep(200);
    assertEquals(JobState.WAITING, queue.getJobStatus("notifications", jobId).state());
    assertTrue(worker.isRunning());

    worker.resume();
    await(() -> completed.contains(jobId));
  }

  @Test
  void closedWorkerCannotRestart() {
    worker = worker(1, ctx -> Map.of());
    worker.start();
    assertTrue(worker.isRunning());

    worker.close();

    assertFalse(worker.isRunning());
    assertThrows(IllegalStateException.class, () -> worker.start());
  }

  @Test
  void builderValidatesLimits() {
    assertThrows(IllegalArgumentException.class, () -> worker(0, ctx -> Map.of()));
    assertThrows(NullPointerException.class, () -> QueueWorker.<Ping, Object>builder().name("x").build());
  }
}
