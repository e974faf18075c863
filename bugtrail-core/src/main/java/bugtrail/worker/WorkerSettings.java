package bugtrail.worker;

import bugtrail.worker.replay.ReplaySettings;
import bugtrail.worker.screenshot.ScreenshotSettings;

import java.util.EnumMap;
import java.util.Map;

/**
 * Which workers run, how many jobs each processes at once, and their polling and media
 * settings.
 *
 * <p>Create instances via {@link #builder()} or use {@link #defaults()}.
 */
public final class WorkerSettings {
  private final Map<WorkerName, Boolean> enabled;
  private final Map<WorkerName, Integer> concurrency;
  private final long pollIntervalMs;
  private final long drainTimeoutMs;
  private final ScreenshotSettings screenshot;
  private final ReplaySettings replay;

  private WorkerSettings(Builder builder) {
    for (Map.Entry<WorkerName, Integer> entry : builder.concurrency.entrySet()) {
      if (entry.getValue() <= 0) {
        throw new IllegalArgumentException("concurrency of " + entry.getKey() + " must be > 0");
      }
    }
    if (builder.pollIntervalMs <= 0L) {
      throw new IllegalArgumentException("pollIntervalMs must be > 0");
    }
    if (builder.drainTimeoutMs < 0L) {
      throw new IllegalArgumentException("drainTimeoutMs must be >= 0");
    }
    this.enabled = new EnumMap<>(builder.enabled);
    this.concurrency = new EnumMap<>(builder.concurrency);
    this.pollIntervalMs = builder.pollIntervalMs;
    this.drainTimeoutMs = builder.drainTimeoutMs;
    this.screenshot = builder.screenshot != null ? builder.screenshot : ScreenshotSettings.defaults();
    this.replay = builder.replay != null ? builder.replay : ReplaySettings.defaults();
  }

  public static WorkerSettings defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public boolean isEnabled(WorkerName name) {
    return enabled.getOrDefault(name, Boolean.TRUE);
  }

  public int concurrency(WorkerName name) {
    return concurrency.getOrDefault(name, name.defaultConcurrency());
  }

  public long pollIntervalMs() {
    return pollIntervalMs;
  }

  public long drainTimeoutMs() {
    return drainTimeoutMs;
  }

  public ScreenshotSettings screenshot() {
    return screenshot;
  }

  public ReplaySettings replay() {
    return replay;
  }

  /** Builder for {@link WorkerSettings}. */
  public static final class Builder {
    private final Map<WorkerName, Boolean> enabled = new EnumMap<>(WorkerName.class);
    private final Map<WorkerName, Integer> concurrency = new EnumMap<>(WorkerName.class);
    private long pollIntervalMs = 1000;
    private long drainTimeoutMs = 30_000;
    private ScreenshotSettings screenshot;
    private ReplaySettings replay;

    private Builder() {}

    /**
     * <p>Optional. All workers are enabled by default.
     */
    public Builder enabled(WorkerName name, boolean value) {
      enabled.put(name, value);
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link WorkerName#defaultConcurrency()}. Must be &gt; 0.
     */
    public Builder concurrency(WorkerName name, int value) {
      concurrency.put(name, value);
      return this;
    }

    /**
     * <p>Optional. Defaults to {@code 1000} ms.
     */
    public Builder pollIntervalMs(long pollIntervalMs) {
      this.pollIntervalMs = pollIntervalMs;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@code 30000} ms.
     */
    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    public Builder screenshot(ScreenshotSettings screenshot) {
      this.screenshot = screenshot;
      return this;
    }

    public Builder replay(ReplaySettings replay) {
      this.replay = replay;
      return this;
    }

    public WorkerSettings build() {
      return new WorkerSettings(this);
    }
  }
}
