package bugtrail.worker;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class WorkerSettingsTest {

  @Test
  void defaultsEnableEveryWorker() {
    WorkerSettings settings = WorkerSettings.defaults();

    for (WorkerName name : WorkerName.values()) {
      assertTrue(settings.isEnabled(name));
      assertEquals(name.defaultConcurrency(), settings.concurrency(name));
    }
    assertEquals(5, settings.concurrency(WorkerName.SCREENSHOT));
    assertEquals(10, settings.concurrency(WorkerName.INTEGRATION));
    assertEquals(1000, settings.pollIntervalMs());
  }

  @Test
  void overridesApplyPerWorker() {
    WorkerSettings settings = WorkerSettings.builder()
        .enabled(WorkerName.REPLAY, false)
        .concurrency(WorkerName.NOTIFICATION, 2)
        .build();

    assertFalse(settings.isEnabled(WorkerName.REPLAY));
    assertEquals(2, settings.concurrency(WorkerName.NOTIFICATION));
    assertEquals(3, settings.concurrency(WorkerName.REPLAY));
  }

  @Test
  void invalidValuesAreRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> WorkerSettings.builder().concurrency(WorkerName.SCREENSHOT, 0).build());
    assertThrows(IllegalArgumentException.class, () -> WorkerSettings.builder().pollIntervalMs(0).build());
  }

  @Test
  void workerNamesResolve() {
    assertEquals(WorkerName.NOTIFICATION, WorkerName.find("notification"));
    assertNull(WorkerName.find("notifications"));
    assertEquals("screenshots", WorkerName.SCREENSHOT.queue().value());
  }
}
