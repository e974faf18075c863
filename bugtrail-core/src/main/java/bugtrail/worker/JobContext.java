package bugtrail.worker;

import bugtrail.model.JobRecord;

import java.util.Objects;

/**
 * What a {@link JobHandler} sees of the job it processes.
 *
 * @param <D> payload type
 */
public final class JobContext<D> {
  private final JobRecord job;
  private final D data;
  private final ProgressTracker.ProgressSink progressSink;

  public JobContext(JobRecord job, D data, ProgressTracker.ProgressSink progressSink) {
    this.job = Objects.requireNonNull(job, "job");
    this.data = data;
    this.progressSink = Objects.requireNonNull(progressSink, "progressSink");
  }

  public JobRecord job() {
    return job;
  }

  public String jobId() {
    return job.jobId();
  }

  public D data() {
    return data;
  }

  /**
   * Creates a tracker that publishes to this job's progress.
   */
  public ProgressTracker progress(int totalSteps) {
    return new ProgressTracker(progressSink, totalSteps);
  }
}
