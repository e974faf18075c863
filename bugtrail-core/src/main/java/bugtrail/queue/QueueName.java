package bugtrail.queue;

/**
 * The fixed set of job queues and the prefixes of their generated job ids.
 */
public enum QueueName {
  SCREENSHOTS("screenshots", "screenshot-"),
  REPLAYS("replays", "replay-"),
  INTEGRATIONS("integrations", "integration-"),
  NOTIFICATIONS("notifications", "notification-");

  private final String value;
  private final String jobIdPrefix;

  QueueName(String value, String jobIdPrefix) {
    this.value = value;
    this.jobIdPrefix = jobIdPrefix;
  }

  /**
   * Name as stored in the job table, e.g. {@code "screenshots"}.
   */
  public String value() {
    return value;
  }

  public String jobIdPrefix() {
    return jobIdPrefix;
  }

  /**
   * Resolves a stored queue name.
   *
   * @throws IllegalArgumentException {@code "Queue <name> not found"} for unknown names
   */
  public static QueueName of(String value) {
    for (QueueName queue : values()) {
      if (queue.value.equals(value)) {
        return queue;
      }
    }
    throw new IllegalArgumentException("Queue " + value + " not found");
  }

  @Override
  public String toString() {
    return value;
  }
}
