package bugtrail.queue;

/**
 * Thrown when the job store cannot be reached or rejects an operation whose caller needs
 * to know (enqueue, status lookups, initialization).
 */
public class JobQueueException extends RuntimeException {

  public JobQueueException(String message, Throwable cause) {
    super(message, cause);
  }
}
