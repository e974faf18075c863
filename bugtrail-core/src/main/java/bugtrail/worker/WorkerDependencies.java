package bugtrail.worker;

import bugtrail.spi.BugReportRepository;
import bugtrail.spi.MetricsExporter;
import bugtrail.spi.StorageService;
import bugtrail.worker.integration.PluginRegistry;
import bugtrail.worker.notification.NotifierRegistry;
import bugtrail.worker.notification.WebhookNotifier;

import java.util.Objects;

/**
 * Collaborators shared by the built-in workers.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class WorkerDependencies {
  private final BugReportRepository bugReportRepository;
  private final StorageService storageService;
  private final PluginRegistry pluginRegistry;
  private final NotifierRegistry notifierRegistry;
  private final MetricsExporter metrics;

  private WorkerDependencies(Builder builder) {
    this.bugReportRepository = Objects.requireNonNull(builder.bugReportRepository, "bugReportRepository");
    this.storageService = Objects.requireNonNull(builder.storageService, "storageService");
    this.pluginRegistry = builder.pluginRegistry;
    this.notifierRegistry = builder.notifierRegistry != null
        ? builder.notifierRegistry : new NotifierRegistry().register(new WebhookNotifier());
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
  }

  public static Builder builder() {
    return new Builder();
  }

  public BugReportRepository bugReportRepository() {
    return bugReportRepository;
  }

  public StorageService storageService() {
    return storageService;
  }

  /**
   * Plugin registry, or {@code null} when integrations are not configured.
   */
  public PluginRegistry pluginRegistry() {
    return pluginRegistry;
  }

  public NotifierRegistry notifierRegistry() {
    return notifierRegistry;
  }

  public MetricsExporter metrics() {
    return metrics;
  }

  /** Builder for {@link WorkerDependencies}. */
  public static final class Builder {
    private BugReportRepository bugReportRepository;
    private StorageService storageService;
    private PluginRegistry pluginRegistry;
    private NotifierRegistry notifierRegistry;
    private MetricsExporter metrics;

    private Builder() {}

    /**
     * <p><b>Required.</b>
     */
    public Builder bugReportRepository(BugReportRepository bugReportRepository) {
      this.bugReportRepository = bugReportRepository;
      return this;
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder storageService(StorageService storageService) {
      this.storageService = storageService;
      return this;
    }

    /**
     * <p>Required only when the integration worker is enabled.
     */
    public Builder pluginRegistry(PluginRegistry pluginRegistry) {
      this.pluginRegistry = pluginRegistry;
      return this;
    }

    /**
     * <p>Optional. Defaults to a registry with a {@link WebhookNotifier}.
     */
    public Builder notifierRegistry(NotifierRegistry notifierRegistry) {
      this.notifierRegistry = notifierRegistry;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public WorkerDependencies build() {
      return new WorkerDependencies(this);
    }
  }
}
