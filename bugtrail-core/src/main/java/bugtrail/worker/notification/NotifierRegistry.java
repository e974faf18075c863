package bugtrail.worker.notification;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Maps channels to their {@link Notifier}. Registration is expected during wiring; lookups
 * are thread-safe afterwards.
 */
public final class NotifierRegistry {
  private final Map<NotificationChannel, Notifier> notifiers = new EnumMap<>(NotificationChannel.class);

  /**
   * Registers a notifier, replacing any earlier one for the same channel.
   */
  public synchronized NotifierRegistry register(Notifier notifier) {
    Objects.requireNonNull(notifier, "notifier");
    notifiers.put(Objects.requireNonNull(notifier.channel(), "channel"), notifier);
    return this;
  }

  /**
   * Returns the notifier for a channel, or {@code null} if none is registered.
   */
  public synchronized Notifier get(NotificationChannel channel) {
    return notifiers.get(channel);
  }
}
