package io.docmirror.standalone.notify;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import io.docmirror.standalone.config.MirrorConfig;
import io.docmirror.standalone.runner.RunSummary;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

/**
 * Tests for {@link WebhookNotifier}.
 *
 * <p>
 * Uses JDK's built-in {@code com.sun.net.httpserver.HttpServer} as the webhook stub.
 */
@DisplayName("WebhookNotifier")
class WebhookNotifierTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    private static HttpServer webhook;
    private static int port;
    private static final List<String> receivedBodies = new CopyOnWriteArrayList<>();
    private static final List<String> receivedContentTypes = new CopyOnWriteArrayList<>();

    private ListAppender<ILoggingEvent> logAppender;
    private Logger notifierLogger;
    private Level previousLevel;

    @BeforeAll
    static void startWebhook() throws IOException {
        webhook = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        port = webhook.getAddress().getPort();

        // POST /hook → 200 "ok", records the body
        webhook.createContext("/hook", exchange -> {
            receivedBodies.add(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            receivedContentTypes.add(exchange.getRequestHeaders().getFirst("Content-Type"));
            byte[] bytes = "ok".getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        });

        // POST /gone → 404
        webhook.createContext("/gone", exchange -> {
            exchange.getRequestBody().readAllBytes();
            byte[] bytes = "no_service".getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(404, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        });

        webhook.start();
    }

    @AfterAll
    static void stopWebhook() {
        if (webhook != null) {
            webhook.stop(0);
        }
    }

    @BeforeEach
    void setUp() {
        receivedBodies.clear();
        receivedContentTypes.clear();

        notifierLogger = (Logger) LoggerFactory.getLogger(WebhookNotifier.class);
        previousLevel = notifierLogger.getLevel();
        notifierLogger.setLevel(Level.INFO);
        logAppender = new ListAppender<>();
        logAppender.start();
        notifierLogger.addAppender(logAppender);
    }

    @AfterEach
    void tearDown() {
        notifierLogger.detachAppender(logAppender);
        notifierLogger.setLevel(previousLevel);
        logAppender.stop();
    }

    private static WebhookNotifier notifierFor(String url) {
        return new WebhookNotifier(MirrorConfig.builder()
                .inputPath("in.ndjson")
                .notifierEnabled(true)
                .notifierWebhookUrl(url)
                .notifierConnectTimeoutMs(2000)
                .notifierReadTimeoutMs(2000)
                .build());
    }

    @Test
    @DisplayName("start → POST {\"text\"} with JSON content type")
    void startPostsTextPayload() throws Exception {
        notifierFor("http://127.0.0.1:" + port + "/hook").start("schema=s.yaml input=in.ndjson");

        assertThat(receivedBodies).hasSize(1);
        JsonNode body = JSON.readTree(receivedBodies.get(0));
        assertThat(body.size()).isEqualTo(1);
        assertThat(body.get("text").asText())
                .contains("Started mirror execution")
                .contains("schema=s.yaml input=in.ndjson");
        assertThat(receivedContentTypes).containsExactly("application/json");
    }

    @Test
    @DisplayName("complete → message carries the run counts")
    void completeCarriesCounts() throws Exception {
        notifierFor("http://127.0.0.1:" + port + "/hook").complete(new RunSummary(10, 9, 1, 4));

        assertThat(JSON.readTree(receivedBodies.get(0)).get("text").asText())
                .contains("Completed mirror execution")
                .contains("records=10 rows=9 rejected=1 warnings=4");
    }

    @Test
    @DisplayName("error → message carries the failure text")
    void errorCarriesMessage() throws Exception {
        notifierFor("http://127.0.0.1:" + port + "/hook").error("unknown type 'currency'");

        assertThat(JSON.readTree(receivedBodies.get(0)).get("text").asText())
                .contains("failed")
                .contains("unknown type 'currency'");
    }

    @Test
    @DisplayName("Each send logs before and after delivery")
    void sendLogsLifecycle() throws Exception {
        notifierFor("http://127.0.0.1:" + port + "/hook").start("run");

        assertThat(logAppender.list)
                .extracting(ILoggingEvent::getFormattedMessage)
                .containsSubsequence("Sending message to webhook", "Sent message to webhook");
    }

    @Test
    @DisplayName("Non-2xx response → NotificationException with status")
    void non2xxFails() {
        WebhookNotifier notifier = notifierFor("http://127.0.0.1:" + port + "/gone");

        assertThatThrownBy(() -> notifier.start("run"))
                .isInstanceOf(NotificationException.class)
                .hasMessageContaining("status 404")
                .hasMessageContaining("no_service");
        assertThat(logAppender.list)
                .extracting(ILoggingEvent::getFormattedMessage)
                .doesNotContain("Sent message to webhook");
    }

    @Test
    @DisplayName("Unreachable webhook → NotificationException")
    void unreachableFails() throws Exception {
        int closedPort;
        try (ServerSocket socket = new ServerSocket(0)) {
            closedPort = socket.getLocalPort();
        }
        WebhookNotifier notifier = notifierFor("http://127.0.0.1:" + closedPort + "/hook");

        assertThatThrownBy(() -> notifier.error("boom"))
                .isInstanceOf(NotificationException.class)
                .hasCauseInstanceOf(IOException.class);
    }
}
