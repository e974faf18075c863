package bugtrail.worker;

import bugtrail.queue.QueueName;

/**
 * The built-in workers, the queue each consumes and its default concurrency.
 */
public enum WorkerName {
  SCREENSHOT("screenshot", QueueName.SCREENSHOTS, 5),
  REPLAY("replay", QueueName.REPLAYS, 3),
  INTEGRATION("integration", QueueName.INTEGRATIONS, 10),
  NOTIFICATION("notification", QueueName.NOTIFICATIONS, 5);

  private final String value;
  private final QueueName queue;
  private final int defaultConcurrency;

  WorkerName(String value, QueueName queue, int defaultConcurrency) {
    this.value = value;
    this.queue = queue;
    this.defaultConcurrency = defaultConcurrency;
  }

  public String value() {
    return value;
  }

  public QueueName queue() {
    return queue;
  }

  public int defaultConcurrency() {
    return defaultConcurrency;
  }

  /**
   * Resolves a worker name, or returns {@code null} if there is no such worker.
   */
  public static WorkerName find(String value) {
    for (WorkerName name : values()) {
      if (name.value.equals(value)) {
        return name;
      }
    }
    return null;
  }

  @Override
  public String toString() {
    return value;
  }
}
