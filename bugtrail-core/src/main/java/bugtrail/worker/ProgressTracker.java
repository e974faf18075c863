package bugtrail.worker;

import java.util.Objects;

/**
 * Reports progress through a fixed number of steps.
 *
 * <p>Each update publishes {@code {step, totalSteps, percentage, message}}, with the
 * percentage clamped to 0-100.
 */
public final class ProgressTracker {
  private final ProgressSink sink;
  private final int totalSteps;
  private int currentStep;

  /**
   * @param sink       where progress is published
   * @param totalSteps number of steps, &gt; 0
   * @throws IllegalArgumentException if {@code totalSteps <= 0}
   */
  public ProgressTracker(ProgressSink sink, int totalSteps) {
    this.sink = Objects.requireNonNull(sink, "sink");
    if (totalSteps <= 0) {
      throw new IllegalArgumentException("totalSteps must be > 0");
    }
    this.totalSteps = totalSteps;
  }

  /**
   * Publishes progress at {@code step}.
   *
   * @throws IllegalArgumentException if {@code step < 0}
   */
  public void update(int step, String message) {
    if (step < 0) {
      throw new IllegalArgumentException("step must be >= 0");
    }
    currentStep = step;
    int percentage = (int) Math.round(step * 100.0 / totalSteps);
    sink.publish(new Progress(step, totalSteps, Math.max(0, Math.min(100, percentage)), message));
  }

  /**
   * Publishes the final step. A null message is reported as {@code "Complete"}.
   */
  public void complete(String message) {
    update(totalSteps, message != null ? message : "Complete");
  }

  public int currentStep() {
    return currentStep;
  }

  public int totalSteps() {
    return totalSteps;
  }

  /**
   * One progress report.
   */
  public record Progress(int step, int totalSteps, int percentage, String message) {
  }

  /**
   * Destination for progress reports.
   */
  @FunctionalInterface
  public interface ProgressSink {
    void publish(Progress progress);
  }
}
