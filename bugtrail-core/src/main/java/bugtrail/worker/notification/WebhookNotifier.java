package bugtrail.worker.notification;

import bugtrail.util.JsonCodec;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Posts notifications as JSON to webhook URLs.
 *
 * <p>Body: {@code {event, bugReport{id, projectId, title, description, status, priority,
 * screenshotUrl, replayUrl, externalUrl}, timestamp}}. Any non-2xx response is a failure.
 */
public final class WebhookNotifier implements Notifier {
  private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

  private final HttpClient httpClient;
  private final JsonCodec jsonCodec;
  private final Duration timeout;

  public WebhookNotifier() {
    this(HttpClient.newBuilder().connectTimeout(DEFAULT_TIMEOUT).build(), JsonCodec.getDefault(), DEFAULT_TIMEOUT);
  }

  public WebhookNotifier(HttpClient httpClient, JsonCodec jsonCodec, Duration timeout) {
    this.httpClient = httpClient;
    this.jsonCodec = jsonCodec;
    this.timeout = timeout;
  }

  @Override
  public NotificationChannel channel() {
    return NotificationChannel.WEBHOOK;
  }

  @Override
  public void send(String recipient, NotificationContext context, NotificationEvent event,
      Map<String, Object> metadata) throws IOException, InterruptedException {
    HttpRequest request = HttpRequest.newBuilder(URI.create(recipient))
        .timeout(timeout)
        .header("Content-Type", "application/json")
        .POST(HttpRequest.BodyPublishers.ofString(jsonCodec.toJson(body(context, event)), StandardCharsets.UTF_8))
        .build();
    HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    int status = response.statusCode();
    if (status < 200 || status >= 300) {
      throw new IOException("Webhook " + recipient + " returned HTTP " + status);
    }
  }

  static Map<String, Object> body(NotificationContext context, NotificationEvent event) {
    Map<String, Object> report = new LinkedHashMap<>();
    report.put("id", context.bugReportId());
    report.put("projectId", context.projectId());
    report.put("title", context.title());
    report.put("description", context.description());
    report.put("status", context.status());
    report.put("priority", context.priority());
    report.put("screenshotUrl", context.screenshotUrl());
    report.put("replayUrl", context.replayUrl());
    report.put("externalUrl", context.externalUrl());

    Map<String, Object> body = new LinkedHashMap<>();
    body.put("event", "bug_report_" + event.value());
    body.put("bugReport", report);
    body.put("timestamp", Instant.now().toString());
    return body;
  }
}
