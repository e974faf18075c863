package bugtrail.spring.boot;

import bugtrail.jdbc.DataSourceConnectionProvider;
import bugtrail.jdbc.repository.JdbcAuditSink;
import bugtrail.jdbc.repository.JdbcBugReportRepository;
import bugtrail.jdbc.repository.JdbcProjectRepository;
import bugtrail.jdbc.repository.JdbcRetentionRepository;
import bugtrail.jdbc.store.AbstractJdbcJobStore;
import bugtrail.jdbc.store.H2JobStore;
import bugtrail.queue.JobQueue;
import bugtrail.queue.JobReaper;
import bugtrail.retention.RetentionScheduler;
import bugtrail.retention.RetentionService;
import bugtrail.spi.ConnectionProvider;
import bugtrail.spi.ObjectHead;
import bugtrail.spi.StorageService;
import bugtrail.spi.StoredObject;
import bugtrail.worker.WorkerManager;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.sql.init.SqlInitializationAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class BugtrailAutoConfigurationTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(
          DataSourceAutoConfiguration.class,
          SqlInitializationAutoConfiguration.class,
          BugtrailAutoConfiguration.class))
      .withPropertyValues(
          "spring.datasource.url=jdbc:h2:mem:bugtrail_auto_" + UUID.randomUUID() + ";MODE=PostgreSQL;DB_CLOSE_DELAY=-1",
          "spring.datasource.driver-class-name=org.h2.Driver",
          "spring.sql.init.schema-locations=classpath:bugtrail/jdbc/schema-h2.sql",
          "bugtrail.workers.poll-interval-ms=50");

  @Test
  void createsJdbcBeansWithoutStorage() {
    runner.run(ctx -> {
      assertInstanceOf(H2JobStore.class, ctx.getBean(AbstractJdbcJobStore.class));
      assertInstanceOf(DataSourceConnectionProvider.class, ctx.getBean(ConnectionProvider.class));
      assertNotNull(ctx.getBean(JobQueue.class));
      assertNotNull(ctx.getBean(JobReaper.class));
      assertNotNull(ctx.getBean(JdbcProjectRepository.class));
      assertNotNull(ctx.getBean(JdbcBugReportRepository.class));
      assertNotNull(ctx.getBean(JdbcRetentionRepository.class));
      assertNotNull(ctx.getBean(JdbcAuditSink.class));

      assertFalse(ctx.containsBean("workerManager"));
      assertFalse(ctx.containsBean("retentionService"));
      assertFalse(ctx.containsBean("retentionScheduler"));
    });
  }

  @Test
  void startsWorkersAndSchedulerWhenStoragePresent() {
    runner.withUserConfiguration(StorageConfig.class).run(ctx -> {
      WorkerManager manager = ctx.getBean(WorkerManager.class);
      assertEquals(WorkerManager.State.STARTED, manager.state());
      // no PluginRegistry bean: the integration worker stays off
      assertNull(manager.getWorkerMetrics("integration"));
      assertNotNull(manager.getWorkerMetrics("screenshot"));

      assertNotNull(ctx.getBean(RetentionService.class));
      assertNotNull(ctx.getBean(RetentionScheduler.class).nextRunTime());
    });
  }

  @Test
  void workersCanBeDisabled() {
    runner.withUserConfiguration(StorageConfig.class)
        .withPropertyValues("bugtrail.workers.enabled=false",
            "bugtrail.retention.scheduler.enabled=false")
        .run(ctx -> {
          assertFalse(ctx.containsBean("workerManager"));
          assertFalse(ctx.containsBean("retentionScheduler"));
          assertTrue(ctx.containsBean("retentionService"));
        });
  }

  @Test
  void individualWorkerDisabledByProperty() {
    runner.withUserConfiguration(StorageConfig.class)
        .withPropertyValues("bugtrail.workers.replay.enabled=false",
            "bugtrail.workers.screenshot.concurrency=2")
        .run(ctx -> {
          WorkerManager manager = ctx.getBean(WorkerManager.class);
          assertNull(manager.getWorkerMetrics("replay"));
          assertNotNull(manager.getWorkerMetrics("notification"));
        });
  }

  @Test
  void reaperCanBeDisabled() {
    runner.withPropertyValues("bugtrail.reaper.enabled=false").run(ctx -> {
      assertFalse(ctx.containsBean("jobReaper"));
      assertTrue(ctx.containsBean("jobQueue"));
    });
  }

  @Test
  void unknownArchiveStrategyFailsStartup() {
    runner.withUserConfiguration(StorageConfig.class)
        .withPropertyValues("bugtrail.retention.archive-strategy=glacier")
        .run(ctx -> assertNotNull(ctx.getStartupFailure()));
  }

  @Configuration
  static class StorageConfig {
    @Bean
    StorageService storageService() {
      return new StorageService() {
        @Override
        public StoredObject upload(String key, byte[] data, String contentType) {
          return new StoredObject(key, "https://cdn.example.com/" + key, data.length);
        }

        @Override
        public ObjectHead headObject(String key) {
          return null;
        }

        @Override
        public void deleteObject(String key) {
        }
      };
    }
  }
}
