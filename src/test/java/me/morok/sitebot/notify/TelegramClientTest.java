package me.morok.sitebot.notify;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.handlers.BlockingHandler;
import io.undertow.util.Headers;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Deque;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Клиент против локального Undertow, который отвечает заданным статусом и запоминает запрос.
 */
class TelegramClientTest {

    private static final String TOKEN = "123:abc";

    private final ObjectMapper json = new ObjectMapper();

    private Undertow stub;
    private TelegramClient client;

    private volatile int status = 200;
    private volatile String reply = "{\"ok\":true,\"result\":[]}";

    private volatile String method;
    private volatile String path;
    private volatile String contentType;
    private volatile String body;
    private volatile Map<String, Deque<String>> query;

    @BeforeEach
    void setUp() {
        stub = Undertow.builder()
                .addHttpListener(0, "127.0.0.1")
                .setHandler(new BlockingHandler(this::record))
                .build();
        stub.start();

        InetSocketAddress addr = (InetSocketAddress) stub.getListenerInfo().get(0).getAddress();
        client = new TelegramClient("http://127.0.0.1:" + addr.getPort() + "/", TOKEN, Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() {
        stub.stop();
    }

    private void record(HttpServerExchange exchange) throws Exception {
        method = exchange.getRequestMethod().toString();
        path = exchange.getRequestPath();
        contentType = exchange.getRequestHeaders().getFirst(Headers.CONTENT_TYPE);
        query = exchange.getQueryParameters();
        body = new String(exchange.getInputStream().readAllBytes(), StandardCharsets.UTF_8);

        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
        exchange.getResponseSender().send(reply);
    }

    @Test
    @DisplayName("sendMessage posts chat_id and text as JSON to the bot method URL")
    void sendMessage_postsJson() throws Exception {
        reply = "{\"ok\":true}";

        TelegramClient.Response res = client.sendMessage(1001L, "📌 Новая заявка");

        assertThat(res.ok()).isTrue();
        assertThat(method).isEqualTo("POST");
        assertThat(path).isEqualTo("/bot" + TOKEN + "/sendMessage");
        assertThat(contentType).startsWith("application/json");

        JsonNode sent = json.readTree(body);
        assertThat(sent.path("chat_id").asLong()).isEqualTo(1001L);
        assertThat(sent.path("text").asText()).isEqualTo("📌 Новая заявка");
    }

    @Test
    @DisplayName("Non-200 answer is not ok and keeps status and body")
    void sendMessage_forbidden_notOk() throws Exception {
        status = 403;
        reply = "{\"ok\":false,\"description\":\"bot was blocked by the user\"}";

        TelegramClient.Response res = client.sendMessage(1001L, "hello");

        assertThat(res.ok()).isFalse();
        assertThat(res.status).isEqualTo(403);
        assertThat(res.body).contains("blocked");
    }

    @Test
    @DisplayName("getUpdates sends timeout, offset and the message-only filter")
    void getUpdates_query() throws Exception {
        JsonNode res = client.getUpdates(42L, 1);

        assertThat(res.path("ok").asBoolean()).isTrue();
        assertThat(method).isEqualTo("GET");
        assertThat(path).isEqualTo("/bot" + TOKEN + "/getUpdates");
        assertThat(query.get("timeout").getFirst()).isEqualTo("1");
        assertThat(query.get("offset").getFirst()).isEqualTo("42");
        assertThat(query.get("allowed_updates").getFirst()).isEqualTo("[\"message\"]");
    }

    @Test
    @DisplayName("First getUpdates call goes without offset")
    void getUpdates_zeroOffset_omitted() throws Exception {
        client.getUpdates(0L, 1);

        assertThat(query).containsKey("timeout").doesNotContainKey("offset");
    }

    @Test
    @DisplayName("getMe returns the parsed body on 200")
    void getMe_ok() throws Exception {
        reply = "{\"ok\":true,\"result\":{\"username\":\"site_notify_bot\"}}";

        JsonNode me = client.getMe();

        assertThat(path).isEqualTo("/bot" + TOKEN + "/getMe");
        assertThat(me.path("result").path("username").asText()).isEqualTo("site_notify_bot");
    }

    @Test
    @DisplayName("Non-200 answer to a GET method gives null")
    void getJson_non200_null() throws Exception {
        status = 401;
        reply = "{\"ok\":false,\"description\":\"Unauthorized\"}";

        assertThat(client.getMe()).isNull();
        assertThat(client.getUpdates(0L, 1)).isNull();
    }
}
