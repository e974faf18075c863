package bugtrail.micrometer;

import bugtrail.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Job counters (tagged {@code queue})</h3>
 * <ul>
 *   <li>{@code bugtrail.jobs.enqueued}: jobs added to a queue</li>
 *   <li>{@code bugtrail.jobs.completed}: jobs completed successfully</li>
 *   <li>{@code bugtrail.jobs.retried}: failed attempts re-queued with backoff</li>
 *   <li>{@code bugtrail.jobs.failed}: jobs that exhausted their attempts</li>
 * </ul>
 *
 * <h3>Timers (tagged {@code queue})</h3>
 * <ul>
 *   <li>{@code bugtrail.jobs.duration}: time a worker spent on one job</li>
 * </ul>
 *
 * <h3>Retention counters</h3>
 * <ul>
 *   <li>{@code bugtrail.retention.deleted}: reports soft-deleted by sweeps</li>
 *   <li>{@code bugtrail.retention.archived}: reports copied to the archive</li>
 *   <li>{@code bugtrail.retention.bytes.freed}: storage bytes released</li>
 *   <li>{@code bugtrail.retention.errors}: per-project sweep errors</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

    public static final String DEFAULT_PREFIX = "bugtrail";
    static final String QUEUE_TAG = "queue";

    private final MeterRegistry registry;
    private final String namePrefix;
    private final Map<String, Counter> enqueued = new ConcurrentHashMap<>();
    private final Map<String, Counter> completed = new ConcurrentHashMap<>();
    private final Map<String, Counter> retried = new ConcurrentHashMap<>();
    private final Map<String, Counter> failed = new ConcurrentHashMap<>();
    private final Map<String, Timer> durations = new ConcurrentHashMap<>();
    private final Counter retentionDeleted;
    private final Counter retentionArchived;
    private final Counter retentionBytesFreed;
    private final Counter retentionErrors;
    private volatile boolean closed;

    /**
     * Creates an exporter with the default metric name prefix {@code "bugtrail"}.
     *
     * @param registry the Micrometer meter registry
     */
    public MicrometerMetricsExporter(MeterRegistry registry) {
        this(registry, DEFAULT_PREFIX);
    }

    /**
     * Creates an exporter with a custom metric name prefix for multi-instance use.
     *
     * @param registry   the Micrometer meter registry
     * @param namePrefix prefix for all meter names (e.g. {@code "intake.bugtrail"})
     */
    public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(namePrefix, "namePrefix");
        if (namePrefix.isEmpty()) {
            throw new IllegalArgumentException("namePrefix must not be empty");
        }
        if (namePrefix.endsWith(".")) {
            throw new IllegalArgumentException("namePrefix must not end with '.'");
        }

        this.registry = registry;
        this.namePrefix = namePrefix;
        this.retentionDeleted = Counter.builder(namePrefix + ".retention.deleted")
                .description("Bug reports soft-deleted by retention sweeps")
                .register(registry);
        this.retentionArchived = Counter.builder(namePrefix + ".retention.archived")
                .description("Bug reports archived by retention sweeps")
                .register(registry);
        this.retentionBytesFreed = Counter.builder(namePrefix + ".retention.bytes.freed")
                .description("Storage bytes freed by retention sweeps")
                .baseUnit("bytes")
                .register(registry);
        this.retentionErrors = Counter.builder(namePrefix + ".retention.errors")
                .description("Per-project errors during retention sweeps")
                .register(registry);
    }

    @Override
    public void incrementJobEnqueued(String queueName) {
        if (closed) return;
        counter(enqueued, "jobs.enqueued", "Jobs added to a queue", queueName).increment();
    }

    @Override
    public void incrementJobCompleted(String queueName) {
        if (closed) return;
        counter(completed, "jobs.completed", "Jobs completed successfully", queueName).increment();
    }

    @Override
    public void incrementJobRetried(String queueName) {
        if (closed) return;
        counter(retried, "jobs.retried", "Failed attempts re-queued for retry", queueName).increment();
    }

    @Override
    public void incrementJobFailed(String queueName) {
        if (closed) return;
        counter(failed, "jobs.failed", "Jobs failed permanently", queueName).increment();
    }

    @Override
    public void recordJobDurationMs(String queueName, long durationMs) {
        if (closed) return;
        Timer timer = durations.computeIfAbsent(queueName, q -> Timer.builder(namePrefix + ".jobs.duration")
                .description("Time a worker spent processing one job")
                .tag(QUEUE_TAG, q)
                .register(registry));
        timer.record(Math.max(0L, durationMs), TimeUnit.MILLISECONDS);
    }

    @Override
    public void recordRetentionSweep(long reportsDeleted, long reportsArchived, long bytesFreed, int errors) {
        if (closed) return;
        retentionDeleted.increment(reportsDeleted);
        retentionArchived.increment(reportsArchived);
        retentionBytesFreed.increment(bytesFreed);
        retentionErrors.increment(errors);
    }

    private Counter counter(Map<String, Counter> cache, String suffix, String description, String queueName) {
        Function<String, Counter> factory = q -> Counter.builder(namePrefix + "." + suffix)
                .description(description)
                .tag(QUEUE_TAG, q)
                .register(registry);
        return cache.computeIfAbsent(queueName, factory);
    }

    /**
     * Removes all meters registered by this exporter from the registry.
     */
    @Override
    public void close() {
        closed = true;
        List<Meter> meters = new ArrayList<>();
        meters.addAll(enqueued.values());
        meters.addAll(completed.values());
        meters.addAll(retried.values());
        meters.addAll(failed.values());
        meters.addAll(durations.values());
        meters.add(retentionDeleted);
        meters.add(retentionArchived);
        meters.add(retentionBytesFreed);
        meters.add(retentionErrors);
        RuntimeException first = null;
        for (Meter meter : meters) {
            try {
                registry.remove(meter);
            } catch (RuntimeException e) {
                if (first == null) first = e;
                else first.addSuppressed(e);
            }
        }
        if (first != null) throw first;
    }
}
