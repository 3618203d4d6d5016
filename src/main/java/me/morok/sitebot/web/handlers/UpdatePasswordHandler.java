package me.morok.sitebot.web.handlers;

import com.fasterxml.jackson.databind.JsonNode;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import me.morok.sitebot.notify.Notifier;
import me.morok.sitebot.web.JsonUtil;
import me.morok.sitebot.web.ResponseUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * POST /admin/update_password. В заголовке Authorization передаётся ключ администратора как есть.
 */
public class UpdatePasswordHandler implements HttpHandler {

    static final Logger log = LoggerFactory.getLogger(UpdatePasswordHandler.class);

    static final String BAD_REQUEST = "Неверные данные";
    static final String UPDATED = "Пароль успешно обновлен. Все пользователи деавторизованы.";

    Notifier notifier;
    String adminKey;

    public UpdatePasswordHandler(Notifier notifier, String adminKey) {
        this.notifier = notifier;
        this.adminKey = adminKey;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        if (!authorized(exchange.getRequestHeaders().getFirst(Headers.AUTHORIZATION))) {
            log.warn("Попытка смены пароля без ключа с {}", ResponseUtil.clientKey(exchange));
            ResponseUtil.sendStatus(exchange, StatusCodes.UNAUTHORIZED, "error", "Unauthorized");
            return;
        }

        String newPassword = readNewPassword(exchange);
        if (newPassword == null) {
            ResponseUtil.sendStatus(exchange, StatusCodes.BAD_REQUEST, "error", BAD_REQUEST);
            return;
        }

        try {
            notifier.updatePassword(newPassword);
            ResponseUtil.sendStatus(exchange, StatusCodes.OK, "success", UPDATED);
        } catch (IllegalArgumentException e) {
            ResponseUtil.sendStatus(exchange, StatusCodes.BAD_REQUEST, "error", BAD_REQUEST);
        } catch (Exception e) {
            log.error("Ошибка при смене пароля: {}", e.getMessage(), e);
            ResponseUtil.sendStatus(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "error", e.getMessage());
        }
    }

    String readNewPassword(HttpServerExchange exchange) {
        try (InputStream is = exchange.getInputStream()) {
            JsonNode body = JsonUtil.mapper().readTree(is);
            JsonNode node = body == null ? null : body.get("new_password");
            if (node == null || node.isNull() || !node.isValueNode()) return null;
            return node.asText();
        } catch (Exception e) {
            log.debug("Не удалось прочитать тело запроса смены пароля: {}", e.getMessage());
            return null;
        }
    }

    boolean authorized(String header) {
        if (adminKey == null || adminKey.isBlank() || header == null) return false;
        return MessageDigest.isEqual(
                header.getBytes(StandardCharsets.UTF_8),
                adminKey.getBytes(StandardCharsets.UTF_8));
    }
}
