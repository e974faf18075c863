package bugtrail.retention;

import bugtrail.model.ArchivedBugReport;
import bugtrail.model.BugReport;
import bugtrail.model.ComplianceRegion;
import bugtrail.model.DataClassification;
import bugtrail.model.Project;
import bugtrail.model.ReportRef;
import bugtrail.model.RetentionPolicy;
import bugtrail.retention.archive.DeletionArchiveStrategy;
import bugtrail.retention.archive.StorageKeys;
import bugtrail.retry.RetryConfig;
import bugtrail.retry.RetryExecutor;
import bugtrail.retry.RetryPredicates;
import bugtrail.retry.Sleeper;
import bugtrail.spi.ArchiveResult;
import bugtrail.spi.AuditEntry;
import bugtrail.spi.AuditSink;
import bugtrail.spi.MetricsExporter;
import bugtrail.spi.ObjectHead;
import bugtrail.spi.ProjectRepository;
import bugtrail.spi.ReportFiles;
import bugtrail.spi.RetentionRepository;
import bugtrail.spi.StorageArchiver;
import bugtrail.spi.StorageService;
import bugtrail.util.JsonCodec;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Policy-driven report lifecycle: soft delete, archive, certified hard delete, restore and
 * legal hold.
 *
 * <p>Reports on legal hold are never deleted; the repository excludes them on every
 * mutating call. Reads against the repositories are retried on transient database errors,
 * writes are not.
 *
 * <pre>{@code
 * RetentionService retention = RetentionService.builder()
 *     .projectRepository(projects)
 *     .retentionRepository(reports)
 *     .storageService(storage)
 *     .auditSink(audit)
 *     .build();
 *
 * RetentionResult result = retention.applyRetentionPolicies(RetentionOptions.defaults());
 * }</pre>
 */
public final class RetentionService {
  private static final Logger logger = Logger.getLogger(RetentionService.class.getName());

  static final String RESOURCE_BUG_REPORT = "bug_report";
  static final int ERROR_RATE_MIN_SAMPLES = 10;

  private final ProjectRepository projectRepository;
  private final RetentionRepository retentionRepository;
  private final StorageService storageService;
  private final StorageArchiver archiver;
  private final AuditSink auditSink;
  private final MetricsExporter metrics;
  private final JsonCodec jsonCodec;
  private final RetryExecutor readRetry;
  private final Sleeper sleeper;
  private final Clock clock;

  private RetentionService(Builder builder) {
    this.projectRepository = Objects.requireNonNull(builder.projectRepository, "projectRepository");
    this.retentionRepository = Objects.requireNonNull(builder.retentionRepository, "retentionRepository");
    this.storageService = Objects.requireNonNull(builder.storageService, "storageService");
    this.auditSink = Objects.requireNonNull(builder.auditSink, "auditSink");
    this.archiver = builder.archiver != null ? builder.archiver : new DeletionArchiveStrategy(storageService);
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.jsonCodec = builder.jsonCodec != null ? builder.jsonCodec : JsonCodec.getDefault();
    this.sleeper = builder.sleeper != null ? builder.sleeper : Sleeper.THREAD_SLEEP;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    RetryConfig readRetryConfig = builder.readRetryConfig != null
        ? builder.readRetryConfig
        : RetryConfig.builder()
            .retryable(RetryPredicates.transientDatabaseError())
            .sleeper(this.sleeper)
            .build();
    this.readRetry = new RetryExecutor(readRetryConfig);
  }

  public static Builder builder() {
    return new Builder();
  }

  public StorageArchiver archiver() {
    return archiver;
  }

  // ── Sweep ──────────────────────────────────────────────────────────

  /**
   * Applies every project's retention policy.
   *
   * <p>Failures of a single project are logged and recorded in the result. After every
   * project the error rate {@code errors / (deleted + errors)} is checked; once more than ten
   * reports and errors have been counted and the rate exceeds
   * {@link RetentionOptions#maxErrorRate()}, the sweep stops and keeps its totals.
   *
   * @throws RuntimeException if the project list cannot be loaded
   */
  public RetentionResult applyRetentionPolicies(RetentionOptions options) {
    Objects.requireNonNull(options, "options");
    Instant startedAt = clock.instant();
    logger.log(Level.INFO, "Starting retention sweep (dryRun={0}, batchSize={1})",
        new Object[]{options.dryRun(), options.batchSize()});

    List<Project> projects = readRetry.execute(projectRepository::findAll);

    Tally totals = new Tally();
    List<RetentionError> errors = new ArrayList<>();
    int projectsProcessed = 0;
    boolean aborted = false;

    for (int i = 0; i < projects.size(); i++) {
      Project project = projects.get(i);
      // Committed batches stay counted when a later batch or the audit entry fails
      Tally tally = new Tally();
      try {
        applyToProject(project, options, startedAt, tally);
        projectsProcessed++;
      } catch (RuntimeException e) {
        logger.log(Level.SEVERE, "Retention failed for project " + project.id(), e);
        errors.add(new RetentionError(project.id(), String.valueOf(e.getMessage()), clock.instant()));
      } finally {
        totals.add(tally);
      }

      if (errorRateExceeded(totals.deleted, errors.size(), options.maxErrorRate())) {
        logger.log(Level.SEVERE, "Aborting retention sweep: error rate exceeded {0}% ({1} errors, {2} deleted)",
            new Object[]{options.maxErrorRate(), errors.size(), totals.deleted});
        aborted = true;
        break;
      }

      if (options.delayMs() > 0 && i < projects.size() - 1) {
        try {
          sleeper.sleep(options.delayMs());
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          logger.log(Level.WARNING, "Retention sweep interrupted after {0} projects", projectsProcessed);
          aborted = true;
          break;
        }
      }
    }

    Instant completedAt = clock.instant();
    long durationMs = Duration.between(startedAt, completedAt).toMillis();
    if (!options.dryRun()) {
      metrics.recordRetentionSweep(totals.deleted, totals.archived, totals.bytesFreed, errors.size());
    }
    logger.log(Level.INFO,
        "Retention sweep finished: {0} deleted, {1} archived, {2} bytes freed, {3} errors in {4} ms",
        new Object[]{totals.deleted, totals.archived, totals.bytesFreed, errors.size(), durationMs});

    return new RetentionResult(
        totals.deleted,
        totals.archived,
        totals.bytesFreed,
        totals.screenshots,
        totals.replays,
        projectsProcessed,
        errors,
        durationMs,
        startedAt,
        completedAt,
        options.dryRun(),
        aborted);
  }

  static boolean errorRateExceeded(long deleted, int errors, double maxErrorRate) {
    long attempts = deleted + errors;
    if (attempts <= ERROR_RATE_MIN_SAMPLES) {
      return false;
    }
    return errors * 100.0 / attempts > maxErrorRate;
  }

  private void applyToProject(Project project, RetentionOptions options, Instant now, Tally tally) {
    RetentionPolicy policy = project.retentionPolicy();
    if (policy == null) {
      logger.log(Level.FINE, "Project {0} has no retention policy, skipping", project.id());
      return;
    }
    int retentionDays = policy.bugReportRetentionDays();
    Instant cutoff = now.minus(Duration.ofDays(retentionDays));
    List<BugReport> eligible = readRetry.execute(
        () -> retentionRepository.findEligibleForDeletion(project.id(), cutoff));
    if (eligible.isEmpty()) {
      return;
    }
    if (options.dryRun()) {
      tally.deleted = eligible.size();
      logger.log(Level.INFO, "Dry run: {0} reports of project {1} would be deleted",
          new Object[]{eligible.size(), project.id()});
      return;
    }

    for (int from = 0; from < eligible.size(); from += options.batchSize()) {
      List<BugReport> batch = eligible.subList(from, Math.min(from + options.batchSize(), eligible.size()));
      if (policy.archiveBeforeDelete()) {
        ArchiveOutcome outcome = archive(batch, DeletionReason.RETENTION_POLICY);
        tally.archived += outcome.rows.size();
        tally.bytesFreed += outcome.storage.bytesArchived();
      } else {
        for (BugReport report : batch) {
          deleteReportStorage(report, tally);
        }
      }
      tally.deleted += retentionRepository.softDelete(ids(batch), null);
    }

    Map<String, Object> details = new LinkedHashMap<>();
    details.put("bugReportIds", ids(eligible));
    details.put("reason", DeletionReason.RETENTION_POLICY.value());
    details.put("retentionDays", retentionDays);
    details.put("storageFreed", tally.bytesFreed);
    audit(AuditAction.SOFT_DELETE, project.id(), null, details);

    logger.log(Level.INFO, "Applied retention to project {0}: {1} deleted, {2} archived",
        new Object[]{project.id(), tally.deleted, tally.archived});
  }

  private void deleteReportStorage(BugReport report, Tally tally) {
    String screenshotKey = StorageKeys.fromUrl(report.screenshotUrl());
    if (screenshotKey != null && deleteFile(report, screenshotKey, tally)) {
      tally.screenshots++;
    }
    String replayKey = StorageKeys.fromUrl(report.replayUrl());
    if (replayKey != null && deleteFile(report, replayKey, tally)) {
      tally.replays++;
    }
  }

  private boolean deleteFile(BugReport report, String key, Tally tally) {
    try {
      long size = fileSize(key);
      storageService.deleteObject(key);
      tally.bytesFreed += size;
      return true;
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Failed to delete file {0} of report {1}: {2}",
          new Object[]{key, report.id(), e.getMessage()});
      return false;
    }
  }

  private long fileSize(String key) {
    try {
      ObjectHead head = storageService.headObject(key);
      return head == null ? 0L : head.size();
    } catch (RuntimeException e) {
      logger.log(Level.FINE, "Could not size " + key, e);
      return 0L;
    }
  }

  // ── Archive ────────────────────────────────────────────────────────

  /**
   * Archives the reports' files, then inserts archive copies of the reports. Reports that
   * are already archived are skipped.
   *
   * @return only the rows inserted by this call
   */
  public List<ArchivedBugReport> archiveReports(List<BugReport> reports, DeletionReason reason) {
    Objects.requireNonNull(reports, "reports");
    Objects.requireNonNull(reason, "reason");
    if (reports.isEmpty()) {
      return List.of();
    }
    return archive(reports, reason).rows;
  }

  private ArchiveOutcome archive(List<BugReport> reports, DeletionReason reason) {
    List<ReportFiles> files = new ArrayList<>(reports.size());
    for (BugReport report : reports) {
      files.add(new ReportFiles(report.id(), report.screenshotUrl(), report.replayUrl()));
    }
    ArchiveResult storage = archiver.archiveBatch(files);
    if (!storage.errors().isEmpty()) {
      logger.log(Level.WARNING, "Archiver {0} reported {1} file errors",
          new Object[]{archiver.strategyName(), storage.errors().size()});
    }

    Instant now = clock.instant();
    List<ArchivedBugReport> copies = new ArrayList<>(reports.size());
    for (BugReport report : reports) {
      Instant deletedAt = report.deletedAt() != null ? report.deletedAt() : now;
      Instant archivedAt = now.isBefore(deletedAt) ? deletedAt : now;
      copies.add(ArchivedBugReport.of(report, reason.value(), report.deletedBy(), deletedAt, archivedAt));
    }
    List<ArchivedBugReport> inserted = retentionRepository.insertArchived(copies);
    logger.log(Level.INFO, "Archived {0} bug reports (reason={1})",
        new Object[]{inserted.size(), reason.value()});
    return new ArchiveOutcome(inserted, storage);
  }

  // ── Hard delete ────────────────────────────────────────────────────

  /**
   * Same as {@code hardDeleteReports(reportIds, userId, true, DeletionReason.MANUAL)}.
   */
  public DeletionCertificate hardDeleteReports(Collection<String> reportIds, String userId) {
    return hardDeleteReports(reportIds, userId, true, DeletionReason.MANUAL);
  }

  /**
   * Permanently deletes reports that are not on legal hold.
   *
   * <p>The certificate is issued for the project of the first deleted report and covers
   * every deleted id. It is always issued when that project's region requires one, even
   * if {@code generateCertificate} is false.
   *
   * @return the certificate, or {@code null} when nothing was deleted or none was requested
   */
  public DeletionCertificate hardDeleteReports(Collection<String> reportIds, String userId,
      boolean generateCertificate, DeletionReason reason) {
    Objects.requireNonNull(reportIds, "reportIds");
    DeletionReason effectiveReason = reason == null ? DeletionReason.MANUAL : reason;
    if (reportIds.isEmpty()) {
      return null;
    }
    List<ReportRef> deleted = retentionRepository.hardDeleteInTransaction(reportIds);
    if (deleted.isEmpty()) {
      logger.log(Level.INFO, "Hard delete found no eligible reports among {0} ids", reportIds.size());
      return null;
    }
    Instant deletedAt = clock.instant();

    Map<String, List<String>> byProject = new LinkedHashMap<>();
    for (ReportRef ref : deleted) {
      byProject.computeIfAbsent(ref.projectId(), p -> new ArrayList<>()).add(ref.id());
    }
    for (Map.Entry<String, List<String>> entry : byProject.entrySet()) {
      Map<String, Object> details = new LinkedHashMap<>();
      details.put("bugReportIds", entry.getValue());
      details.put("reason", effectiveReason.value());
      details.put("count", entry.getValue().size());
      audit(AuditAction.HARD_DELETE, entry.getKey(), userId, details);
    }

    String certificateProject = deleted.get(0).projectId();
    RetentionPolicy policy = policyOf(certificateProject);
    DataClassification classification = policy != null ? policy.dataClassification() : DataClassification.GENERAL;
    ComplianceRegion region = policy != null ? policy.complianceRegion() : ComplianceRegion.NONE;

    DeletionCertificate certificate = null;
    if (generateCertificate || ComplianceRules.requiresCertificate(region)) {
      List<String> ids = new ArrayList<>(deleted.size());
      for (ReportRef ref : deleted) {
        ids.add(ref.id());
      }
      certificate = DeletionCertificates.issue(certificateProject, ids, deletedAt, userId,
          effectiveReason, classification, region, jsonCodec);
    }
    logger.log(Level.INFO, "Hard deleted {0} bug reports (userId={1}, certificate={2})",
        new Object[]{deleted.size(), userId, certificate != null ? certificate.certificateId() : "none"});
    return certificate;
  }

  private RetentionPolicy policyOf(String projectId) {
    try {
      Project project = readRetry.execute(() -> projectRepository.findById(projectId));
      return project == null ? null : project.retentionPolicy();
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Could not load policy of project " + projectId
          + ", certificate uses defaults", e);
      return null;
    }
  }

  // ── Restore ────────────────────────────────────────────────────────

  /**
   * Restores soft-deleted reports. Archive copies are not restored.
   *
   * @return number of reports restored
   */
  public int restoreReports(Collection<String> reportIds) {
    return restoreReports(reportIds, null);
  }

  /**
   * Restores soft-deleted reports and writes a {@code restore} audit entry per project when
   * anything was restored.
   */
  public int restoreReports(Collection<String> reportIds, String userId) {
    Objects.requireNonNull(reportIds, "reportIds");
    if (reportIds.isEmpty()) {
      return 0;
    }
    int restored = retentionRepository.restore(reportIds);
    logger.log(Level.INFO, "Restored {0} bug reports", restored);
    if (restored > 0) {
      List<String> ids = new ArrayList<>(reportIds);
      for (String projectId : readRetry.execute(() -> retentionRepository.findProjectIds(ids))) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("bugReportIds", ids);
        details.put("restoredCount", restored);
        audit(AuditAction.RESTORE, projectId, userId, details);
      }
    }
    return restored;
  }

  // ── Preview ────────────────────────────────────────────────────────

  /**
   * Reports what a sweep would delete, without changing anything.
   *
   * @param projectId a single project, or {@code null} for all projects
   */
  public RetentionPreview previewRetentionPolicy(String projectId) {
    Instant now = clock.instant();
    List<Project> projects;
    if (projectId != null) {
      Project project = readRetry.execute(() -> projectRepository.findById(projectId));
      projects = project == null ? List.of() : List.of(project);
    } else {
      projects = readRetry.execute(projectRepository::findAll);
    }

    List<ProjectPreview> affected = new ArrayList<>();
    long totalReports = 0;
    long totalBytes = 0;
    for (Project project : projects) {
      RetentionPolicy policy = project.retentionPolicy();
      if (policy == null) {
        continue;
      }
      Instant cutoff = now.minus(Duration.ofDays(policy.bugReportRetentionDays()));
      List<BugReport> eligible = readRetry.execute(
          () -> retentionRepository.findEligibleForDeletion(project.id(), cutoff));
      if (eligible.isEmpty()) {
        continue;
      }
      long bytes = 0;
      Instant oldest = null;
      for (BugReport report : eligible) {
        bytes += sizeOf(report.screenshotUrl()) + sizeOf(report.replayUrl());
        if (report.createdAt() != null && (oldest == null || report.createdAt().isBefore(oldest))) {
          oldest = report.createdAt();
        }
      }
      affected.add(new ProjectPreview(project.id(), project.name(), eligible.size(), bytes, oldest));
      totalReports += eligible.size();
      totalBytes += bytes;
    }
    long legalHoldCount = readRetry.execute(retentionRepository::countLegalHoldReports);
    return new RetentionPreview(affected, totalReports, totalBytes, legalHoldCount);
  }

  private long sizeOf(String url) {
    String key = StorageKeys.fromUrl(url);
    return key == null ? 0L : fileSize(key);
  }

  // ── Legal hold ─────────────────────────────────────────────────────

  /**
   * Applies or releases legal hold on reports, whatever their current flag.
   *
   * @return number of reports updated
   */
  public int setLegalHold(Collection<String> reportIds, boolean hold, String userId) {
    Objects.requireNonNull(reportIds, "reportIds");
    if (reportIds.isEmpty()) {
      return 0;
    }
    List<String> ids = new ArrayList<>(reportIds);
    int updated = retentionRepository.setLegalHold(ids, hold);
    List<String> projectIds = readRetry.execute(() -> retentionRepository.findProjectIds(ids));
    if (!projectIds.isEmpty()) {
      Map<String, Object> details = new LinkedHashMap<>();
      details.put("bugReportIds", ids);
      details.put("reason", DeletionReason.MANUAL.value());
      details.put("allProjectIds", projectIds);
      details.put("projectCount", projectIds.size());
      audit(hold ? AuditAction.LEGAL_HOLD_APPLIED : AuditAction.LEGAL_HOLD_RELEASED,
          projectIds.get(0), userId, details);
    }
    logger.log(Level.INFO, "Legal hold {0} for {1} bug reports",
        new Object[]{hold ? "applied" : "released", updated});
    return updated;
  }

  // ── Helpers ────────────────────────────────────────────────────────

  private void audit(AuditAction action, String projectId, String userId, Map<String, Object> details) {
    auditSink.append(new AuditEntry(action.value(), RESOURCE_BUG_REPORT, projectId, userId, details,
        clock.instant()));
  }

  private static List<String> ids(List<BugReport> reports) {
    Set<String> ids = new LinkedHashSet<>();
    for (BugReport report : reports) {
      ids.add(report.id());
    }
    return new ArrayList<>(ids);
  }

  private static final class Tally {
    private long deleted;
    private long archived;
    private long bytesFreed;
    private long screenshots;
    private long replays;

    private void add(Tally other) {
      deleted += other.deleted;
      archived += other.archived;
      bytesFreed += other.bytesFreed;
      screenshots += other.screenshots;
      replays += other.replays;
    }
  }

  private static final class ArchiveOutcome {
    private final List<ArchivedBugReport> rows;
    private final ArchiveResult storage;

    private ArchiveOutcome(List<ArchivedBugReport> rows, ArchiveResult storage) {
      this.rows = rows;
      this.storage = storage;
    }
  }

  /** Builder for {@link RetentionService}. */
  public static final class Builder {
    private ProjectRepository projectRepository;
    private RetentionRepository retentionRepository;
    private StorageService storageService;
    private StorageArchiver archiver;
    private AuditSink auditSink;
    private MetricsExporter metrics;
    private JsonCodec jsonCodec;
    private RetryConfig readRetryConfig;
    private Sleeper sleeper;
    private Clock clock;

    private Builder() {}

    /**
     * <p><b>Required.</b>
     */
    public Builder projectRepository(ProjectRepository projectRepository) {
      this.projectRepository = projectRepository;
      return this;
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder retentionRepository(RetentionRepository retentionRepository) {
      this.retentionRepository = retentionRepository;
      return this;
    }

    /**
     * <p><b>Required.</b> Used to size and delete report files.
     */
    public Builder storageService(StorageService storageService) {
      this.storageService = storageService;
      return this;
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder auditSink(AuditSink auditSink) {
      this.auditSink = auditSink;
      return this;
    }

    /**
     * Sets the strategy applied to report files when archiving.
     *
     * <p>Optional. Defaults to {@link DeletionArchiveStrategy} over the storage service.
     */
    public Builder archiver(StorageArchiver archiver) {
      this.archiver = archiver;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Codec used for the certificate hash.
     *
     * <p>Optional. Defaults to {@link JsonCodec#getDefault()}.
     */
    public Builder jsonCodec(JsonCodec jsonCodec) {
      this.jsonCodec = jsonCodec;
      return this;
    }

    /**
     * Retry settings for repository reads.
     *
     * <p>Optional. Defaults to three attempts with exponential backoff on
     * {@link RetryPredicates#transientDatabaseError()}.
     */
    public Builder readRetryConfig(RetryConfig readRetryConfig) {
      this.readRetryConfig = readRetryConfig;
      return this;
    }

    /**
     * Pause between projects and between read retries.
     *
     * <p>Optional. Defaults to {@link Sleeper#THREAD_SLEEP}.
     */
    public Builder sleeper(Sleeper sleeper) {
      this.sleeper = sleeper;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link Clock#systemUTC()}.
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public RetentionService build() {
      return new RetentionService(this);
    }
  }
}
