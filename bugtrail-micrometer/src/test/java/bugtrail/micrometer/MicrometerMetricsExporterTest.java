package bugtrail.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsExporterTest {

  private SimpleMeterRegistry registry;
  private MicrometerMetricsExporter exporter;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    exporter = new MicrometerMetricsExporter(registry);
  }

  @Test
  void jobCountersAreTaggedByQueue() {
    exporter.incrementJobEnqueued("screenshots");
    exporter.incrementJobEnqueued("screenshots");
    exporter.incrementJobEnqueued("replays");

    assertEquals(2.0, counter("bugtrail.jobs.enqueued", "screenshots").count());
    assertEquals(1.0, counter("bugtrail.jobs.enqueued", "replays").count());
  }

  @Test
  void outcomeCounters() {
    exporter.incrementJobCompleted("integrations");
    exporter.incrementJobRetried("integrations");
    exporter.incrementJobRetried("integrations");
    exporter.incrementJobFailed("integrations");

    assertEquals(1.0, counter("bugtrail.jobs.completed", "integrations").count());
    assertEquals(2.0, counter("bugtrail.jobs.retried", "integrations").count());
    assertEquals(1.0, counter("bugtrail.jobs.failed", "integrations").count());
  }

  @Test
  void recordJobDuration() {
    exporter.recordJobDurationMs("notifications", 250);
    exporter.recordJobDurationMs("notifications", 750);

    Timer timer = registry.get("bugtrail.jobs.duration").tag("queue", "notifications").timer();
    assertEquals(2, timer.count());
    assertEquals(1000.0, timer.totalTime(TimeUnit.MILLISECONDS), 0.001);
  }

  @Test
  void recordRetentionSweepAccumulates() {
    exporter.recordRetentionSweep(10, 4, 2048, 1);
    exporter.recordRetentionSweep(5, 0, 1024, 0);

    assertEquals(15.0, registry.get("bugtrail.retention.deleted").counter().count());
    assertEquals(4.0, registry.get("bugtrail.retention.archived").counter().count());
    assertEquals(3072.0, registry.get("bugtrail.retention.bytes.freed").counter().count());
    assertEquals(1.0, registry.get("bugtrail.retention.errors").counter().count());
  }

  @Test
  void customPrefix() {
    MicrometerMetricsExporter custom = new MicrometerMetricsExporter(registry, "intake");
    custom.incrementJobCompleted("replays");

    assertEquals(1.0, registry.get("intake.jobs.completed").tag("queue", "replays").counter().count());
  }

  @Test
  void rejectsInvalidPrefix() {
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, ""));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, "bugtrail."));
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(null));
  }

  @Test
  void closeRemovesMetersAndStopsRecording() {
    exporter.incrementJobEnqueued("screenshots");
    exporter.recordJobDurationMs("screenshots", 5);

    exporter.close();

    assertNull(registry.find("bugtrail.jobs.enqueued").counter());
    assertNull(registry.find("bugtrail.jobs.duration").timer());
    assertNull(registry.find("bugtrail.retention.deleted").counter());

    exporter.incrementJobEnqueued("screenshots");
    assertNull(registry.find("bugtrail.jobs.enqueued").counter());
  }

  private Counter counter(String name, String queue) {
    return registry.get(name).tag("queue", queue).counter();
  }
}
