package bugtrail.retry;

/**
 * Blocking pause between retry attempts. Replaced in tests to avoid real waits.
 */
@FunctionalInterface
public interface Sleeper {

  Sleeper THREAD_SLEEP = Thread::sleep;

  void sleep(long millis) throws InterruptedException;
}
