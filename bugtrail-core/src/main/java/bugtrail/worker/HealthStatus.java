package bugtrail.worker;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Worker health: {@code healthy} is true iff every started worker is running.
 */
public record HealthStatus(boolean healthy, Map<String, Boolean> workers) {

  public HealthStatus {
    workers = Collections.unmodifiableMap(new LinkedHashMap<>(workers));
  }
}
