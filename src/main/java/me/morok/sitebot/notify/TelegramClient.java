package me.morok.sitebot.notify;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Обёртка над вызовами Bot API, которые нужны нотификатору.
 */
public class TelegramClient {

    String baseUrl;
    String token;

    Duration sendTimeout;

    ObjectMapper json = new ObjectMapper();
    HttpClient http;

    public TelegramClient(String baseUrl, String token, Duration sendTimeout) {
        this.baseUrl = trimSlash(baseUrl);
        this.token = token;
        this.sendTimeout = sendTimeout;

        http = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build();
    }

    public Response sendMessage(long chatId, String text) throws IOException, InterruptedException {
        ObjectNode payload = json.createObjectNode();
        payload.put("chat_id", chatId);
        payload.put("text", text);

        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(method("sendMessage")))
                .timeout(sendTimeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(payload.toString()))
                .build();

        HttpResponse<String> res = http.send(req, HttpResponse.BodyHandlers.ofString());
        return new Response(res.statusCode(), res.body());
    }

    /**
     * @return разобранный ответ или null, если ответ не 200
     */
    public JsonNode getMe() throws IOException, InterruptedException {
        return getJson(method("getMe"), Duration.ofSeconds(20));
    }

    public JsonNode getUpdates(long offset, int timeoutSec) throws IOException, InterruptedException {
        String url = method("getUpdates") + "?timeout=" + timeoutSec + "&allowed_updates=%5B%22message%22%5D";
        if (offset > 0) url += "&offset=" + offset;

        // long-poll держит соединение timeoutSec, запас сверху на сеть
        return getJson(url, Duration.ofSeconds(timeoutSec + 10L));
    }

    JsonNode getJson(String url, Duration timeout) throws IOException, InterruptedException {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(timeout)
                .GET()
                .build();

        HttpResponse<String> res = http.send(req, HttpResponse.BodyHandlers.ofString());
        if (res.statusCode() != 200) return null;

        return json.readTree(res.body());
    }

    String method(String name) {
        return baseUrl + "/bot" + token + "/" + name;
    }

    static String trimSlash(String s) {
        if (s == null) return "https://api.telegram.org";
        while (s.endsWith("/")) s = s.substring(0, s.length() - 1);
        return s;
    }

    public static class Response {

        public final int status;
        public final String body;

        public Response(int status, String body) {
            this.status = status;
            this.body = body;
        }

        public boolean ok() {
            return status == 200;
        }
    }
}
