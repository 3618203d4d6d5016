package me.morok.sitebot.web;

import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.LinkedHashMap;
import java.util.Map;

public class ResponseUtil {

    static final Logger log = LoggerFactory.getLogger(ResponseUtil.class);

    private ResponseUtil() {
    }

    public static void sendJson(HttpServerExchange exchange, int status, Map<String, Object> body) {
        try {
            exchange.setStatusCode(status);
            exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=UTF-8");
            String json = JsonUtil.mapper().writeValueAsString(body);
            exchange.getResponseSender().send(json);

            log.debug("Ответ отправлен. Статус: {}, тело: {}", status, json);
        } catch (Exception e) {
            log.error("Не удалось отправить JSON-ответ. Статус: {}, тело: {}", status, body, e);
        }
    }

    /**
     * {"success": true} для форм.
     */
    public static void sendSuccess(HttpServerExchange exchange) {
        Map<String, Object> res = new LinkedHashMap<>();
        res.put("success", true);
        sendJson(exchange, StatusCodes.OK, res);
    }

    /**
     * {"error": message} для форм.
     */
    public static void sendError(HttpServerExchange exchange, int status, String message) {
        Map<String, Object> res = new LinkedHashMap<>();
        res.put("error", message);
        sendJson(exchange, status, res);
    }

    /**
     * {"status": ..., "message": ...} для админского эндпоинта.
     */
    public static void sendStatus(HttpServerExchange exchange, int status, String state, String message) {
        Map<String, Object> res = new LinkedHashMap<>();
        res.put("status", state);
        res.put("message", message);
        sendJson(exchange, status, res);
    }

    public static String clientKey(HttpServerExchange exchange) {
        InetSocketAddress addr = exchange.getSourceAddress();
        if (addr == null) return "unknown";
        if (addr.getAddress() == null) return addr.getHostString();
        return addr.getAddress().getHostAddress();
    }
}
