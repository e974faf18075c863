package bugtrail.queue;

import bugtrail.retry.BackoffType;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class QueueValuesTest {

  @Test
  void queueNamesAndPrefixes() {
    assertEquals(QueueName.REPLAYS, QueueName.of("replays"));
    assertEquals("notification-", QueueName.NOTIFICATIONS.jobIdPrefix());
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> QueueName.of("emails"));
    assertEquals("Queue emails not found", e.getMessage());
  }

  @Test
  void exponentialBackoffDoublesWithoutJitter() {
    Backoff backoff = Backoff.exponential(1000);

    assertEquals(1000, backoff.delayFor(1));
    assertEquals(2000, backoff.delayFor(2));
    assertEquals(8000, backoff.delayFor(4));
    assertEquals(Backoff.MAX_DELAY_MS, backoff.delayFor(40));
  }

  @Test
  void fixedBackoffIsConstant() {
    Backoff backoff = Backoff.fixed(750);

    assertEquals(BackoffType.FIXED, backoff.type());
    assertEquals(750, backoff.delayFor(1));
    assertEquals(750, backoff.delayFor(5));
    assertThrows(IllegalArgumentException.class, () -> Backoff.fixed(-1));
  }

  @Test
  void jobOptionsValidation() {
    JobOptions defaults = JobOptions.defaults();
    assertEquals(0, defaults.priority());
    assertNull(defaults.attempts());
    assertNull(defaults.backoff());

    assertThrows(IllegalArgumentException.class, () -> JobOptions.builder().priority(-1).build());
    assertThrows(IllegalArgumentException.class, () -> JobOptions.builder().attempts(0).build());
    assertThrows(IllegalArgumentException.class, () -> JobOptions.builder().jobId(" ").build());
    assertThrows(IllegalArgumentException.class, () -> JobOptions.builder().delayMs(-5).build());
  }

  @Test
  void queueSettingsDefaultsAndLimits() {
    QueueSettings settings = QueueSettings.defaults();
    assertEquals(3, settings.maxRetries());
    assertEquals(5000, settings.backoffDelayMs());
    assertEquals(300_000, settings.jobTimeoutMs());
    assertEquals(Duration.ofDays(7), settings.retention());
    assertEquals(1000, settings.completedKeep());
    assertEquals(5000, settings.failedKeep());
    assertEquals(1, QueueSettings.builder().maxRetries(0).build().defaultAttempts());

    assertThrows(IllegalArgumentException.class, () -> QueueSettings.builder().jobTimeoutMs(999).build());
    assertThrows(IllegalArgumentException.class,
        () -> QueueSettings.builder().retention(Duration.ofSeconds(-1)).build());
  }
}
