package bugtrail.spring.boot;

import bugtrail.jdbc.DataSourceConnectionProvider;
import bugtrail.jdbc.TableNames;
import bugtrail.jdbc.repository.JdbcAuditSink;
import bugtrail.jdbc.repository.JdbcBugReportRepository;
import bugtrail.jdbc.repository.JdbcProjectRepository;
import bugtrail.jdbc.repository.JdbcRetentionRepository;
import bugtrail.jdbc.store.AbstractJdbcJobStore;
import bugtrail.jdbc.store.JdbcJobStores;
import bugtrail.queue.JobQueue;
import bugtrail.queue.JobReaper;
import bugtrail.queue.QueueSettings;
import bugtrail.retention.RetentionNotifier;
import bugtrail.retention.RetentionOptions;
import bugtrail.retention.RetentionScheduler;
import bugtrail.retention.RetentionService;
import bugtrail.retention.archive.StorageArchivers;
import bugtrail.spi.AuditSink;
import bugtrail.spi.BugReportRepository;
import bugtrail.spi.ConnectionProvider;
import bugtrail.spi.MetricsExporter;
import bugtrail.spi.ProjectRepository;
import bugtrail.spi.RetentionRepository;
import bugtrail.spi.StorageArchiver;
import bugtrail.spi.StorageService;
import bugtrail.worker.WorkerDependencies;
import bugtrail.worker.WorkerManager;
import bugtrail.worker.WorkerName;
import bugtrail.worker.WorkerSettings;
import bugtrail.worker.integration.PluginRegistry;
import bugtrail.worker.notification.NotifierRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Auto-configuration for bugtrail.
 *
 * <p>Wires the job queue, the JDBC repositories and the audit sink from a {@link DataSource}
 * and {@link BugtrailProperties}. The worker manager, retention service and retention
 * scheduler additionally need a {@link StorageService} bean from the application.
 *
 * @see BugtrailProperties
 * @see BugtrailMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(JobQueue.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(BugtrailProperties.class)
public class BugtrailAutoConfiguration {
    private static final Logger logger = Logger.getLogger(BugtrailAutoConfiguration.class.getName());

    @Bean
    @ConditionalOnMissingBean
    public AbstractJdbcJobStore jobStore(DataSource dataSource, BugtrailProperties props) {
        AbstractJdbcJobStore detected = JdbcJobStores.detect(dataSource);
        if (!TableNames.JOB_TABLE.equals(props.getJobTable())
                || !TableNames.QUEUE_TABLE.equals(props.getQueueTable())) {
            return detected.withTables(props.getJobTable(), props.getQueueTable());
        }
        return detected;
    }

    @Bean
    @ConditionalOnMissingBean(ConnectionProvider.class)
    public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
        return new DataSourceConnectionProvider(dataSource);
    }

    /**
     * The worker manager shuts the queue down together with its workers, so no destroy
     * method is registered here.
     */
    @Bean(destroyMethod = "")
    @ConditionalOnMissingBean
    public JobQueue jobQueue(BugtrailProperties props,
                             ConnectionProvider connectionProvider,
                             AbstractJdbcJobStore jobStore,
                             ObjectProvider<MetricsExporter> metricsProvider) {
        BugtrailProperties.Queue q = props.getQueue();
        QueueSettings settings = QueueSettings.builder()
                .maxRetries(q.getMaxRetries())
                .backoffDelayMs(q.getBackoffDelayMs())
                .jobTimeoutMs(q.getJobTimeoutMs())
                .retention(q.getRetention())
                .completedKeep(q.getCompletedKeep())
                .failedKeep(q.getFailedKeep())
                .build();
        JobQueue.Builder builder = JobQueue.builder()
                .connectionProvider(connectionProvider)
                .jobStore(jobStore)
                .settings(settings)
                .shutdownTimeoutMs(q.getShutdownTimeoutMs());
        MetricsExporter metrics = metricsProvider.getIfAvailable();
        if (metrics != null) {
            builder.metrics(metrics);
        }
        return builder.build();
    }

    @Bean(initMethod = "start", destroyMethod = "close")
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "bugtrail.reaper", name = "enabled", matchIfMissing = true)
    public JobReaper jobReaper(JobQueue jobQueue, BugtrailProperties props) {
        return JobReaper.builder()
                .jobQueue(jobQueue)
                .intervalSeconds(props.getReaper().getIntervalSeconds())
                .build();
    }

    @Bean
    @ConditionalOnMissingBean(ProjectRepository.class)
    public JdbcProjectRepository projectRepository(ConnectionProvider connectionProvider) {
        return new JdbcProjectRepository(connectionProvider);
    }

    @Bean
    @ConditionalOnMissingBean(BugReportRepository.class)
    public JdbcBugReportRepository bugReportRepository(ConnectionProvider connectionProvider) {
        return new JdbcBugReportRepository(connectionProvider);
    }

    @Bean
    @ConditionalOnMissingBean(RetentionRepository.class)
    public JdbcRetentionRepository retentionRepository(ConnectionProvider connectionProvider) {
        return new JdbcRetentionRepository(connectionProvider);
    }

    @Bean
    @ConditionalOnMissingBean(AuditSink.class)
    public JdbcAuditSink auditSink(ConnectionProvider connectionProvider) {
        return new JdbcAuditSink(connectionProvider);
    }

    @Bean(initMethod = "start", destroyMethod = "shutdown")
    @ConditionalOnMissingBean
    @ConditionalOnBean(StorageService.class)
    @ConditionalOnProperty(prefix = "bugtrail.workers", name = "enabled", matchIfMissing = true)
    public WorkerManager workerManager(BugtrailProperties props,
                                       JobQueue jobQueue,
                                       BugReportRepository bugReportRepository,
                                       StorageService storageService,
                                       ObjectProvider<PluginRegistry> pluginRegistryProvider,
                                       ObjectProvider<NotifierRegistry> notifierRegistryProvider,
                                       ObjectProvider<MetricsExporter> metricsProvider) {
        PluginRegistry pluginRegistry = pluginRegistryProvider.getIfAvailable();
        WorkerDependencies.Builder deps = WorkerDependencies.builder()
                .bugReportRepository(bugReportRepository)
                .storageService(storageService)
                .pluginRegistry(pluginRegistry)
                .notifierRegistry(notifierRegistryProvider.getIfAvailable());
        MetricsExporter metrics = metricsProvider.getIfAvailable();
        if (metrics != null) {
            deps.metrics(metrics);
        }

        BugtrailProperties.Workers w = props.getWorkers();
        WorkerSettings.Builder settings = WorkerSettings.builder()
                .pollIntervalMs(w.getPollIntervalMs())
                .drainTimeoutMs(w.getDrainTimeoutMs());
        configure(settings, WorkerName.SCREENSHOT, w.getScreenshot());
        configure(settings, WorkerName.REPLAY, w.getReplay());
        configure(settings, WorkerName.INTEGRATION, w.getIntegration());
        configure(settings, WorkerName.NOTIFICATION, w.getNotification());
        if (pluginRegistry == null && w.getIntegration().isEnabled()) {
            logger.log(Level.INFO, "No PluginRegistry bean; integration worker disabled");
            settings.enabled(WorkerName.INTEGRATION, false);
        }

        return WorkerManager.builder()
                .jobQueue(jobQueue)
                .dependencies(deps.build())
                .settings(settings.build())
                .build();
    }

    private static void configure(WorkerSettings.Builder settings, WorkerName name, BugtrailProperties.Worker worker) {
        settings.enabled(name, worker.isEnabled());
        if (worker.getConcurrency() > 0) {
            settings.concurrency(name, worker.getConcurrency());
        }
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(StorageService.class)
    public RetentionService retentionService(BugtrailProperties props,
                                             ProjectRepository projectRepository,
                                             RetentionRepository retentionRepository,
                                             StorageService storageService,
                                             AuditSink auditSink,
                                             ObjectProvider<StorageArchiver> archiverProvider,
                                             ObjectProvider<MetricsExporter> metricsProvider) {
        StorageArchiver archiver = archiverProvider.getIfAvailable(
                () -> new StorageArchivers().create(props.getRetention().getArchiveStrategy(), storageService));
        RetentionService.Builder builder = RetentionService.builder()
                .projectRepository(projectRepository)
                .retentionRepository(retentionRepository)
                .storageService(storageService)
                .auditSink(auditSink)
                .archiver(archiver);
        MetricsExporter metrics = metricsProvider.getIfAvailable();
        if (metrics != null) {
            builder.metrics(metrics);
        }
        return builder.build();
    }

    @Bean(initMethod = "start", destroyMethod = "close")
    @ConditionalOnMissingBean
    @ConditionalOnBean(RetentionService.class)
    @ConditionalOnProperty(prefix = "bugtrail.retention.scheduler", name = "enabled", matchIfMissing = true)
    public RetentionScheduler retentionScheduler(BugtrailProperties props,
                                                 RetentionService retentionService,
                                                 ObjectProvider<RetentionNotifier> notifierProvider) {
        BugtrailProperties.Retention r = props.getRetention();
        RetentionOptions options = RetentionOptions.builder()
                .dryRun(r.isDryRun())
                .batchSize(r.getBatchSize())
                .maxErrorRate(r.getMaxErrorRate())
                .delayMs(r.getDelayMs())
                .build();
        return RetentionScheduler.builder()
                .retentionService(retentionService)
                .options(options)
                .runTime(LocalTime.parse(r.getScheduler().getRunTime()))
                .zone(ZoneId.of(r.getScheduler().getZone()))
                .notifier(notifierProvider.getIfAvailable())
                .build();
    }
}
