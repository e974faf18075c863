package bugtrail.jdbc;

import bugtrail.jdbc.store.H2JobStore;
import bugtrail.model.JobRecord;
import bugtrail.model.JobState;
import bugtrail.queue.Backoff;
import bugtrail.queue.JobOptions;
import bugtrail.queue.JobQueue;
import bugtrail.queue.JobReaper;
import bugtrail.queue.JobStatus;
import bugtrail.queue.QueueMetrics;
import bugtrail.queue.QueueSettings;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JobQueueTest {
  private H2Database db;
  private CountingMetrics metrics;
  private JobQueue queue;

  @BeforeEach
  void setUp() {
    db = H2Database.create();
    metrics = new CountingMetrics();
    queue = newQueue(QueueSettings.defaults());
  }

  @AfterEach
  void tearDown() {
    queue.shutdown();
  }

  private JobQueue newQueue(QueueSettings settings) {
    return JobQueue.builder()
        .connectionProvider(db.connectionProvider())
        .jobStore(new H2JobStore())
        .settings(settings)
        .metrics(metrics)
        .shutdownTimeoutMs(0)
        .build();
  }

  private static JobOptions noBackoff(int attempts) {
    return JobOptions.builder().attempts(attempts).backoff(Backoff.fixed(0)).build();
  }

  private static void pause(long millis) throws InterruptedException {
    Thread.sleep(millis);
  }

  @Test
  void initializeAndHealthCheck() {
    queue.initialize();
    assertTrue(queue.healthCheck());
  }

  @Test
  void addJobAssignsPrefixedIdAndWaitingState() {
    String jobId = queue.addJob("screenshots", "process-screenshot", Map.of("bugReportId", "r1"), null);

    assertTrue(jobId.startsWith("screenshot-"));
    JobStatus status = queue.getJobStatus("screenshots", jobId);
    assertEquals(JobState.WAITING, status.state());
    assertEquals("process-screenshot", status.name());
    assertTrue(status.data().contains("\"bugReportId\":\"r1\""));
    assertEquals(0, status.attemptsMade());
    assertEquals(1, metrics.get("enqueued", "screenshots"));
  }

  @Test
  void duplicateJobIdIsIgnored() {
    JobOptions options = JobOptions.builder().jobId("replay-r1").build();

    assertEquals("replay-r1", queue.addJob("replays", "process-replay", Map.of("n", 1), options));
    assertEquals("replay-r1", queue.addJob("replays", "process-replay", Map.of("n", 2), options));

    assertEquals(1, queue.getQueueMetrics("replays").waiting());
    assertTrue(queue.getJobStatus("replays", "replay-r1").data().contains("1"));
    assertEquals(1, metrics.get("enqueued", "replays"));
  }

  @Test
  void unknownQueueIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> queue.addJob("videos", "x", Map.of(), null));
    assertThrows(IllegalArgumentException.class, () -> queue.getJobStatus("videos", "x"));
    assertThrows(IllegalArgumentException.class, () -> queue.getQueueMetrics("videos"));
  }

  @Test
  void missingJobHasNoStatus() {
    assertNull(queue.getJobStatus("screenshots", "screenshot-missing"));
  }

  @Test
  void delayedJobIsNotClaimable() {
    String jobId = queue.addJob("notifications", "send", Map.of(),
        JobOptions.builder().delayMs(60_000).build());

    assertEquals(JobState.DELAYED, queue.getJobStatus("notifications", jobId).state());
    assertTrue(queue.claimJobs("notifications", "w1", 10).isEmpty());
    assertEquals(1, queue.getQueueMetrics("notifications").delayed());
  }

  @Test
  void claimOrdersUnprioritizedFirstThenByPriority() throws Exception {
    queue.addJob("integrations", "sync", Map.of(), JobOptions.builder().jobId("a").priority(2).build());
    pause(2);
    queue.addJob("integrations", "sync", Map.of(), JobOptions.builder().jobId("b").build());
    pause(2);
    queue.addJob("integrations", "sync", Map.of(), JobOptions.builder().jobId("c").priority(1).build());
    pause(5);

    List<JobRecord> claimed = queue.claimJobs("integrations", "w1", 10);

    assertEquals(List.of("b", "c", "a"), claimed.stream().map(JobRecord::jobId).toList());
    assertEquals(3, queue.inFlightCount());
    assertEquals(3, queue.getQueueMetrics("integrations").active());
  }

  @Test
  void claimRespectsLimit() throws Exception {
    for (int i = 0; i < 5; i++) {
      queue.addJob("screenshots", "process", Map.of("i", i), null);
    }
    pause(5);

    assertEquals(2, queue.claimJobs("screenshots", "w1", 2).size());
    assertEquals(3, queue.claimJobs("screenshots", "w2", 10).size());
    assertTrue(queue.claimJobs("screenshots", "w3", 10).isEmpty());
  }

  @Test
  void completeStoresResult() throws Exception {
    String jobId = queue.addJob("screenshots", "process", Map.of("bugReportId", "r1"), null);
    pause(5);
    JobRecord job = queue.claimJobs("screenshots", "w1", 1).get(0);

    queue.updateProgress(job, Map.of("percent", 50));
    assertTrue(queue.getJobStatus("screenshots", jobId).progress().contains("50"));

    assertTrue(queue.completeJob(job, Map.of("originalUrl", "https://cdn/x.png")));

    JobStatus status = queue.getJobStatus("screenshots", jobId);
    assertEquals(JobState.COMPLETED, status.state());
    assertTrue(status.result().contains("originalUrl"));
    assertNotNull(status.processedOn());
    assertNotNull(status.finishedOn());
    assertEquals(0, queue.inFlightCount());
    assertEquals(1, metrics.get("completed", "screenshots"));
  }

  @Test
  void completingUnclaimedJobIsIgnored() throws Exception {
    queue.addJob("screenshots", "process", Map.of(), JobOptions.builder().jobId("j1").build());
    pause(5);
    JobRecord job = queue.claimJobs("screenshots", "w1", 1).get(0);
    assertTrue(queue.completeJob(job, null));

    assertFalse(queue.completeJob(job, null));
    assertEquals(1, metrics.get("completed", "screenshots"));
  }

  @Test
  void removeOnCompleteDeletesRow() throws Exception {
    String jobId = queue.addJob("notifications", "send", Map.of(),
        JobOptions.builder().removeOnComplete(true).build());
    pause(5);
    JobRecord job = queue.claimJobs("notifications", "w1", 1).get(0);

    assertTrue(queue.completeJob(job, Map.of()));
    assertNull(queue.getJobStatus("notifications", jobId));
  }

  @Test
  void failureRetriesThenFails() throws Exception {
    String jobId = queue.addJob("replays", "process", Map.of(), noBackoff(2));
    pause(5);

    JobRecord first = queue.claimJobs("replays", "w1", 1).get(0);
    assertEquals(JobState.DELAYED, queue.failJob(first, new IllegalStateException("chunk upload failed")));
    JobStatus afterFirst = queue.getJobStatus("replays", jobId);
    assertEquals(1, afterFirst.attemptsMade());
    assertEquals("chunk upload failed", afterFirst.failedReason());
    assertTrue(afterFirst.stacktrace().contains("IllegalStateException"));
    pause(5);

    JobRecord second = queue.claimJobs("replays", "w1", 1).get(0);
    assertEquals(1, second.attemptsMade());
    assertEquals(JobState.FAILED, queue.failJob(second, new IllegalStateException("again")));

    JobStatus status = queue.getJobStatus("replays", jobId);
    assertEquals(JobState.FAILED, status.state());
    assertEquals(2, status.attemptsMade());
    assertEquals(1, metrics.get("retried", "replays"));
    assertEquals(1, metrics.get("failed", "replays"));
    assertTrue(queue.claimJobs("replays", "w1", 1).isEmpty());
  }

  @Test
  void retryIsDelayedByBackoff() throws Exception {
    String jobId = queue.addJob("replays", "process", Map.of(),
        JobOptions.builder().attempts(3).backoff(Backoff.fixed(60_000)).build());
    pause(5);
    JobRecord job = queue.claimJobs("replays", "w1", 1).get(0);

    assertEquals(JobState.DELAYED, queue.failJob(job, new RuntimeException("boom")));
    assertEquals(JobState.DELAYED, queue.getJobStatus("replays", jobId).state());
    assertTrue(queue.claimJobs("replays", "w1", 1).isEmpty());
  }

  @Test
  void removeOnFailDeletesRow() throws Exception {
    String jobId = queue.addJob("integrations", "sync", Map.of(),
        JobOptions.builder().attempts(1).removeOnFail(true).build());
    pause(5);
    JobRecord job = queue.claimJobs("integrations", "w1", 1).get(0);

    assertEquals(JobState.FAILED, queue.failJob(job, new RuntimeException("bad token")));
    assertNull(queue.getJobStatus("integrations", jobId));
  }

  @Test
  void pausedQueueHandsOutNothing() throws Exception {
    queue.addJob("screenshots", "process", Map.of(), null);
    pause(5);

    queue.pauseQueue("screenshots");
    assertTrue(queue.isPaused("screenshots"));
    assertTrue(queue.getQueueMetrics("screenshots").paused());
    assertTrue(queue.claimJobs("screenshots", "w1", 1).isEmpty());
    assertFalse(queue.isPaused("replays"));

    queue.resumeQueue("screenshots");
    assertFalse(queue.isPaused("screenshots"));
    assertEquals(1, queue.claimJobs("screenshots", "w1", 1).size());
  }

  @Test
  void expiredLockIsReclaimedByAnotherInstance() throws Exception {
    QueueSettings shortLock = QueueSettings.builder().jobTimeoutMs(1000).build();
    JobQueue first = newQueue(shortLock);
    JobQueue second = newQueue(shortLock);
    first.addJob("screenshots", "process", Map.of(), JobOptions.builder().jobId("j1").build());
    pause(5);

    JobRecord claimedByFirst = first.claimJobs("screenshots", "w1", 1).get(0);
    assertTrue(second.claimJobs("screenshots", "w2", 1).isEmpty());

    pause(1200);
    JobRecord claimedBySecond = second.claimJobs("screenshots", "w2", 1).get(0);
    assertEquals("j1", claimedBySecond.jobId());

    assertFalse(first.completeJob(claimedByFirst, Map.of()));
    assertTrue(second.completeJob(claimedBySecond, Map.of()));
  }

  @Test
  void shutdownStopsIntake() {
    queue.shutdown();

    assertTrue(queue.isShutdown());
    assertThrows(IllegalStateException.class, () -> queue.addJob("screenshots", "process", Map.of(), null));
    assertTrue(queue.claimJobs("screenshots", "w1", 1).isEmpty());
  }

  @Test
  void reapRemovesFinishedJobsPastRetention() throws Exception {
    JobQueue reaping = newQueue(QueueSettings.builder().retention(Duration.ZERO).build());
    for (int i = 0; i < 3; i++) {
      reaping.addJob("notifications", "send", Map.of("i", i), null);
    }
    reaping.addJob("notifications", "send", Map.of("pending", true),
        JobOptions.builder().delayMs(60_000).build());
    pause(5);
    for (JobRecord job : reaping.claimJobs("notifications", "w1", 10)) {
      reaping.completeJob(job, Map.of());
    }
    pause(5);

    assertEquals(3, reaping.reapFinished());
    assertEquals(1, db.count("bugtrail_job"));
  }

  @Test
  void reapKeepsNewestFinishedJobs() throws Exception {
    JobQueue reaping = newQueue(QueueSettings.builder().completedKeep(1).build());
    for (int i = 0; i < 3; i++) {
      reaping.addJob("screenshots", "process", Map.of("i", i), null);
    }
    pause(5);
    for (JobRecord job : reaping.claimJobs("screenshots", "w1", 10)) {
      reaping.completeJob(job, Map.of());
      pause(3);
    }

    JobReaper reaper = JobReaper.builder().jobQueue(reaping).build();
    assertEquals(2, reaper.runOnce());
    assertEquals(1, reaping.getQueueMetrics("screenshots").completed());
    reaper.close();
    assertEquals(0, reaper.runOnce());

    reaping.shutdown();
    assertEquals(0, JobReaper.builder().jobQueue(reaping).build().runOnce());
  }
}
