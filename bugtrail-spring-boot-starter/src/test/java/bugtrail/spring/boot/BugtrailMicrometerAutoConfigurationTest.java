package bugtrail.spring.boot;

import bugtrail.micrometer.MicrometerMetricsExporter;
import bugtrail.spi.MetricsExporter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class BugtrailMicrometerAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(BugtrailMicrometerAutoConfiguration.class));

    @Test
    void exportsQueueAndRetentionMetersToTheRegistry() {
        runner.withUserConfiguration(RegistryConfig.class).run(ctx -> {
            MetricsExporter exporter = ctx.getBean(MetricsExporter.class);
            assertInstanceOf(MicrometerMetricsExporter.class, exporter);

            exporter.incrementJobEnqueued("replays");
            exporter.incrementJobFailed("replays");
            exporter.recordJobDurationMs("replays", 250);
            exporter.recordRetentionSweep(12, 3, 4096, 1);

            MeterRegistry registry = ctx.getBean(MeterRegistry.class);
            assertEquals(1.0, registry.get("bugtrail.jobs.enqueued").tag("queue", "replays").counter().count());
            assertEquals(1.0, registry.get("bugtrail.jobs.failed").tag("queue", "replays").counter().count());
            assertEquals(250.0, registry.get("bugtrail.jobs.duration").tag("queue", "replays").timer()
                    .totalTime(TimeUnit.MILLISECONDS));
            assertEquals(12.0, registry.get("bugtrail.retention.deleted").counter().count());
            assertEquals(4096.0, registry.get("bugtrail.retention.bytes.freed").counter().count());
        });
    }

    @Test
    void meterNamesFollowConfiguredPrefix() {
        runner.withUserConfiguration(RegistryConfig.class)
                .withPropertyValues("bugtrail.metrics.name-prefix=intake")
                .run(ctx -> {
                    ctx.getBean(MetricsExporter.class).incrementJobCompleted("integrations");
                    MeterRegistry registry = ctx.getBean(MeterRegistry.class);
                    assertNotNull(registry.find("intake.jobs.completed").tag("queue", "integrations").counter());
                    assertNotNull(registry.find("intake.retention.archived").counter());
                    assertNull(registry.find("bugtrail.jobs.completed").counter());
                });
    }

    @Test
    void noExporterWithoutMeterRegistry() {
        runner.run(ctx -> assertTrue(ctx.getBeansOfType(MetricsExporter.class).isEmpty()));
    }

    @Test
    void metricsCanBeSwitchedOff() {
        runner.withUserConfiguration(RegistryConfig.class)
                .withPropertyValues("bugtrail.metrics.enabled=false")
                .run(ctx -> assertTrue(ctx.getBeansOfType(MetricsExporter.class).isEmpty()));
    }

    @Test
    void applicationExporterWins() {
        runner.withUserConfiguration(RegistryConfig.class, NoopExporterConfig.class).run(ctx -> {
            assertSame(MetricsExporter.NOOP, ctx.getBean(MetricsExporter.class));
            assertFalse(ctx.containsBean("micrometerMetricsExporter"));
        });
    }

    @Configuration
    static class RegistryConfig {
        @Bean
        MeterRegistry meterRegistry() {
            return new SimpleMeterRegistry();
        }
    }

    @Configuration
    static class NoopExporterConfig {
        @Bean
        MetricsExporter noopMetricsExporter() {
            return MetricsExporter.NOOP;
        }
    }
}
