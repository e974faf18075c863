package bugtrail.model;

/**
 * Job lifecycle states as stored in the job table.
 *
 * <p>Status codes: {@code 0} WAITING, {@code 1} ACTIVE, {@code 2} COMPLETED, {@code 3} FAILED,
 * {@code 4} DELAYED, {@code 5} WAITING_CHILDREN, {@code 6} PRIORITIZED.
 * {@link #UNKNOWN} is reported for codes this version does not recognise and is never stored.
 */
public enum JobState {
  WAITING(0, "waiting"),
  ACTIVE(1, "active"),
  COMPLETED(2, "completed"),
  FAILED(3, "failed"),
  DELAYED(4, "delayed"),
  WAITING_CHILDREN(5, "waiting-children"),
  PRIORITIZED(6, "prioritized"),
  UNKNOWN(-1, "unknown");

  private final int code;
  private final String label;

  JobState(int code, String label) {
    this.code = code;
    this.label = label;
  }

  public int code() {
    return code;
  }

  /**
   * Lower-case external name, e.g. {@code "waiting-children"}.
   */
  public String label() {
    return label;
  }

  /**
   * Whether a job in this state can be handed to a worker once its available time passes.
   */
  public boolean isPending() {
    return this == WAITING || this == DELAYED || this == PRIORITIZED;
  }

  public boolean isFinished() {
    return this == COMPLETED || this == FAILED;
  }

  public static JobState fromCode(int code) {
    for (JobState state : values()) {
      if (state.code == code) {
        return state;
      }
    }
    return UNKNOWN;
  }
}
