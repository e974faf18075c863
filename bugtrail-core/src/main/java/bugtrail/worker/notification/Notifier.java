package bugtrail.worker.notification;

import java.util.Map;

/**
 * Delivers notifications over one channel.
 */
public interface Notifier {

    NotificationChannel channel();

    /**
     * Delivers one notification to one recipient.
     *
     * @throws Exception if delivery failed; recorded for this recipient only
     */
    void send(String recipient, NotificationContext context, NotificationEvent event,
        Map<String, Object> metadata) throws Exception;
}
