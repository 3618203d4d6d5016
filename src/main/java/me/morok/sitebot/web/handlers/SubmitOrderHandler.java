package me.morok.sitebot.web.handlers;

import com.fasterxml.jackson.databind.JsonNode;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.StatusCodes;
import me.morok.sitebot.form.FormValidator;
import me.morok.sitebot.form.OrderForm;
import me.morok.sitebot.notify.Notifier;
import me.morok.sitebot.ui.SubmissionFormatter;
import me.morok.sitebot.util.RateLimitGuard;
import me.morok.sitebot.web.JsonUtil;
import me.morok.sitebot.web.ResponseUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;

/**
 * POST /submit-order, JSON из корзины каталога.
 */
public class SubmitOrderHandler implements HttpHandler {

    static final Logger log = LoggerFactory.getLogger(SubmitOrderHandler.class);

    static final String INTERNAL_ERROR = "Внутренняя ошибка сервера";

    Notifier notifier;
    SubmissionFormatter fmt;
    RateLimitGuard limiter;
    FormValidator validator = new FormValidator();

    public SubmitOrderHandler(Notifier notifier, SubmissionFormatter fmt, RateLimitGuard limiter) {
        this.notifier = notifier;
        this.fmt = fmt;
        this.limiter = limiter;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        String client = ResponseUtil.clientKey(exchange);
        if (!limiter.tryAcquire(client)) {
            log.warn("Превышен лимит запросов для {}", client);
            ResponseUtil.sendError(exchange, StatusCodes.TOO_MANY_REQUESTS, FormValidator.RATE_LIMIT);
            return;
        }

        try {
            JsonNode body;
            try (InputStream is = exchange.getInputStream()) {
                body = JsonUtil.mapper().readTree(is);
            }

            OrderForm order = OrderForm.fromJson(body);

            String error = validator.validateOrder(order);
            if (error != null) {
                ResponseUtil.sendError(exchange, StatusCodes.BAD_REQUEST, error);
                return;
            }

            if (notifier.sendMessage(fmt.formatOrder(order))) {
                ResponseUtil.sendSuccess(exchange);
            } else {
                ResponseUtil.sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, FormValidator.ORDER_SUBMIT_ERROR);
            }
        } catch (Exception e) {
            log.error("Ошибка при обработке заказа: {}", e.getMessage(), e);
            ResponseUtil.sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, INTERNAL_ERROR);
        }
    }
}
