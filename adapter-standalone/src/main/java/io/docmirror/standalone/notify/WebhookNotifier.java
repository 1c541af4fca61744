package io.docmirror.standalone.notify;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.docmirror.standalone.config.MirrorConfig;
import io.docmirror.standalone.runner.RunSummary;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JDK {@link HttpClient}-based notifier that posts chat-style messages to an incoming webhook.
 *
 * <p>
 * Each message is sent as {@code POST} with body {@code {"text": "..."}} and
 * {@code Content-Type: application/json}, the payload accepted by Slack-compatible incoming
 * webhooks. Any non-2xx response is a delivery failure.
 *
 * <p>
 * This class is thread-safe: the underlying {@link HttpClient} is designed for concurrent use.
 */
public final class WebhookNotifier implements LifecycleNotifier {

    private static final Logger LOG = LoggerFactory.getLogger(WebhookNotifier.class);
    private static final ObjectMapper JSON = new ObjectMapper();

    private final HttpClient httpClient;
    private final URI webhookUri;
    private final Duration readTimeout;

    /**
     * Creates a notifier for the webhook configured in {@code config}.
     *
     * @param config mirror configuration holding the webhook URL and timeouts
     */
    public WebhookNotifier(MirrorConfig config) {
        this.webhookUri = URI.create(config.notifierWebhookUrl());
        this.readTimeout = Duration.ofMillis(config.notifierReadTimeoutMs());
        this.httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofMillis(config.notifierConnectTimeoutMs()))
                .followRedirects(HttpClient.Redirect.NEVER)
                .build();

        LOG.info("Initialized webhook notifier: host={}", webhookUri.getHost());
    }

    @Override
    public void start(String description) throws NotificationException, InterruptedException {
        send(":arrow_forward: Started mirror execution: " + description);
    }

    @Override
    public void complete(RunSummary summary) throws NotificationException, InterruptedException {
        send(":white_check_mark: Completed mirror execution: " + summary.describe());
    }

    @Override
    public void error(String message) throws NotificationException, InterruptedException {
        send(":x: Mirror execution failed: " + message);
    }

    /**
     * Posts one message to the webhook.
     *
     * @throws NotificationException if the webhook is unreachable, times out or answers non-2xx
     * @throws InterruptedException  if the thread is interrupted while waiting
     */
    void send(String text) throws NotificationException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(webhookUri)
                .timeout(readTimeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(payload(text)))
                .build();

        LOG.info("Sending message to webhook");
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpConnectTimeoutException e) {
            throw new NotificationException("Connect timeout to webhook " + webhookUri.getHost(), e);
        } catch (HttpTimeoutException e) {
            throw new NotificationException("Read timeout from webhook " + webhookUri.getHost(), e);
        } catch (IOException e) {
            throw new NotificationException("Failed to reach webhook " + webhookUri.getHost(), e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new NotificationException("Webhook responded with status " + status + ": " + response.body());
        }
        LOG.info("Sent message to webhook");
    }

    private static String payload(String text) throws NotificationException {
        ObjectNode body = JSON.createObjectNode();
        body.put("text", text);
        try {
            return JSON.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new NotificationException("Failed to serialize webhook payload", e);
        }
    }
}
