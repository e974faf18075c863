package bugtrail.worker;

import bugtrail.worker.integration.IntegrationJobData;
import bugtrail.worker.integration.IntegrationJobHandler;
import bugtrail.worker.integration.IntegrationJobResult;
import bugtrail.worker.notification.NotificationJobData;
import bugtrail.worker.notification.NotificationJobHandler;
import bugtrail.worker.notification.NotificationJobResult;
import bugtrail.worker.replay.ReplayJobData;
import bugtrail.worker.replay.ReplayJobHandler;
import bugtrail.worker.replay.ReplayJobResult;
import bugtrail.worker.screenshot.ScreenshotJobData;
import bugtrail.worker.screenshot.ScreenshotJobHandler;
import bugtrail.worker.screenshot.ScreenshotJobResult;

import java.util.EnumMap;
import java.util.Map;

/**
 * Factories of the built-in workers.
 */
public final class WorkerFactories {

  private WorkerFactories() {}

  /**
   * Returns a mutable map with a factory for every {@link WorkerName}.
   */
  public static Map<WorkerName, WorkerFactory> defaults() {
    Map<WorkerName, WorkerFactory> factories = new EnumMap<>(WorkerName.class);
    factories.put(WorkerName.SCREENSHOT, WorkerFactories::screenshot);
    factories.put(WorkerName.REPLAY, WorkerFactories::replay);
    factories.put(WorkerName.INTEGRATION, WorkerFactories::integration);
    factories.put(WorkerName.NOTIFICATION, WorkerFactories::notification);
    return factories;
  }

  static Worker screenshot(WorkerContext ctx) {
    WorkerDependencies deps = ctx.dependencies();
    return WorkerFactories.<ScreenshotJobData, ScreenshotJobResult>queueWorker(ctx, ScreenshotJobData.class)
        .handler(new ScreenshotJobHandler(deps.bugReportRepository(), deps.storageService(),
            ctx.settings().screenshot()))
        .build();
  }

  static Worker replay(WorkerContext ctx) {
    WorkerDependencies deps = ctx.dependencies();
    return WorkerFactories.<ReplayJobData, ReplayJobResult>queueWorker(ctx, ReplayJobData.class)
        .handler(new ReplayJobHandler(deps.bugReportRepository(), deps.storageService(),
            ctx.jobQueue().jsonCodec(), ctx.settings().replay()))
        .build();
  }

  static Worker integration(WorkerContext ctx) {
    WorkerDependencies deps = ctx.dependencies();
    if (deps.pluginRegistry() == null) {
      throw new IllegalStateException("PluginRegistry required for integration worker but not provided");
    }
    return WorkerFactories.<IntegrationJobData, IntegrationJobResult>queueWorker(ctx, IntegrationJobData.class)
        .handler(new IntegrationJobHandler(deps.bugReportRepository(), deps.pluginRegistry()))
        .build();
  }

  static Worker notification(WorkerContext ctx) {
    WorkerDependencies deps = ctx.dependencies();
    return WorkerFactories.<NotificationJobData, NotificationJobResult>queueWorker(ctx, NotificationJobData.class)
        .handler(new NotificationJobHandler(deps.bugReportRepository(), deps.notifierRegistry()))
        .build();
  }

  private static <D, R> QueueWorker.Builder<D, R> queueWorker(WorkerContext ctx, Class<D> payloadType) {
    return QueueWorker.<D, R>builder()
        .name(ctx.name().value())
        .queue(ctx.name().queue())
        .jobQueue(ctx.jobQueue())
        .payloadType(payloadType)
        .concurrency(ctx.concurrency())
        .pollIntervalMs(ctx.settings().pollIntervalMs())
        .drainTimeoutMs(ctx.settings().drainTimeoutMs())
        .listener(ctx.listener())
        .metrics(ctx.dependencies().metrics());
  }
}
