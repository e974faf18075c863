package bugtrail.spring.boot;

import bugtrail.jdbc.TableNames;
import bugtrail.retention.RetentionOptions;
import bugtrail.retention.archive.DeletionArchiveStrategy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for bugtrail.
 *
 * @see BugtrailAutoConfiguration
 */
@ConfigurationProperties(prefix = "bugtrail")
public class BugtrailProperties {

    /**
     * Table holding the jobs of every queue.
     */
    private String jobTable = TableNames.JOB_TABLE;

    /**
     * Table holding per-queue pause flags.
     */
    private String queueTable = TableNames.QUEUE_TABLE;

    private final Queue queue = new Queue();
    private final Reaper reaper = new Reaper();
    private final Workers workers = new Workers();
    private final Retention retention = new Retention();
    private final Metrics metrics = new Metrics();

    public String getJobTable() {
        return jobTable;
    }

    public void setJobTable(String jobTable) {
        this.jobTable = jobTable;
    }

    public String getQueueTable() {
        return queueTable;
    }

    public void setQueueTable(String queueTable) {
        this.queueTable = queueTable;
    }

    public Queue getQueue() {
        return queue;
    }

    public Reaper getReaper() {
        return reaper;
    }

    public Workers getWorkers() {
        return workers;
    }

    public Retention getRetention() {
        return retention;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Queue {
        private int maxRetries = 3;
        private long backoffDelayMs = 5000;
        private long jobTimeoutMs = 300_000;
        private Duration retention = Duration.ofDays(7);
        private int completedKeep = 1000;
        private int failedKeep = 5000;
        private long shutdownTimeoutMs = 30_000;

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public long getBackoffDelayMs() {
            return backoffDelayMs;
        }

        public void setBackoffDelayMs(long backoffDelayMs) {
            this.backoffDelayMs = backoffDelayMs;
        }

        public long getJobTimeoutMs() {
            return jobTimeoutMs;
        }

        public void setJobTimeoutMs(long jobTimeoutMs) {
            this.jobTimeoutMs = jobTimeoutMs;
        }

        public Duration getRetention() {
            return retention;
        }

        public void setRetention(Duration retention) {
            this.retention = retention;
        }

        public int getCompletedKeep() {
            return completedKeep;
        }

        public void setCompletedKeep(int completedKeep) {
            this.completedKeep = completedKeep;
        }

        public int getFailedKeep() {
            return failedKeep;
        }

        public void setFailedKeep(int failedKeep) {
            this.failedKeep = failedKeep;
        }

        public long getShutdownTimeoutMs() {
            return shutdownTimeoutMs;
        }

        public void setShutdownTimeoutMs(long shutdownTimeoutMs) {
            this.shutdownTimeoutMs = shutdownTimeoutMs;
        }
    }

    public static class Reaper {
        private boolean enabled = true;
        private long intervalSeconds = 3600;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getIntervalSeconds() {
            return intervalSeconds;
        }

        public void setIntervalSeconds(long intervalSeconds) {
            this.intervalSeconds = intervalSeconds;
        }
    }

    public static class Workers {
        /**
         * Whether a worker manager is created and started.
         */
        private boolean enabled = true;
        private long pollIntervalMs = 1000;
        private long drainTimeoutMs = 30_000;
        private final Worker screenshot = new Worker();
        private final Worker replay = new Worker();
        private final Worker integration = new Worker();
        private final Worker notification = new Worker();

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getPollIntervalMs() {
            return pollIntervalMs;
        }

        public void setPollIntervalMs(long pollIntervalMs) {
            this.pollIntervalMs = pollIntervalMs;
        }

        public long getDrainTimeoutMs() {
            return drainTimeoutMs;
        }

        public void setDrainTimeoutMs(long drainTimeoutMs) {
            this.drainTimeoutMs = drainTimeoutMs;
        }

        public Worker getScreenshot() {
            return screenshot;
        }

        public Worker getReplay() {
            return replay;
        }

        public Worker getIntegration() {
            return integration;
        }

        public Worker getNotification() {
            return notification;
        }
    }

    public static class Worker {
        private boolean enabled = true;

        /**
         * Jobs processed at once. Zero keeps the worker's default.
         */
        private int concurrency;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getConcurrency() {
            return concurrency;
        }

        public void setConcurrency(int concurrency) {
            this.concurrency = concurrency;
        }
    }

    public static class Retention {
        private String archiveStrategy = DeletionArchiveStrategy.NAME;
        private boolean dryRun;
        private int batchSize = RetentionOptions.DEFAULT_BATCH_SIZE;
        private double maxErrorRate = RetentionOptions.DEFAULT_MAX_ERROR_RATE;
        private long delayMs = RetentionOptions.DEFAULT_DELAY_MS;
        private final Scheduler scheduler = new Scheduler();

        public String getArchiveStrategy() {
            return archiveStrategy;
        }

        public void setArchiveStrategy(String archiveStrategy) {
            this.archiveStrategy = archiveStrategy;
        }

        public boolean isDryRun() {
            return dryRun;
        }

        public void setDryRun(boolean dryRun) {
            this.dryRun = dryRun;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public double getMaxErrorRate() {
            return maxErrorRate;
        }

        public void setMaxErrorRate(double maxErrorRate) {
            this.maxErrorRate = maxErrorRate;
        }

        public long getDelayMs() {
            return delayMs;
        }

        public void setDelayMs(long delayMs) {
            this.delayMs = delayMs;
        }

        public Scheduler getScheduler() {
            return scheduler;
        }
    }

    public static class Scheduler {
        private boolean enabled = true;

        /**
         * Daily run time, {@code HH:mm}.
         */
        private String runTime = "02:00";

        /**
         * Time zone of the run time.
         */
        private String zone = "UTC";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getRunTime() {
            return runTime;
        }

        public void setRunTime(String runTime) {
            this.runTime = runTime;
        }

        public String getZone() {
            return zone;
        }

        public void setZone(String zone) {
            this.zone = zone;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "bugtrail";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
