package me.morok.sitebot.web.handlers;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.handlers.form.FormData;
import io.undertow.server.handlers.form.FormDataParser;
import io.undertow.server.handlers.form.FormParserFactory;
import io.undertow.util.StatusCodes;
import me.morok.sitebot.form.FeedbackForm;
import me.morok.sitebot.form.FormValidator;
import me.morok.sitebot.notify.Notifier;
import me.morok.sitebot.ui.SubmissionFormatter;
import me.morok.sitebot.util.RateLimitGuard;
import me.morok.sitebot.web.ResponseUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * POST /submit-feedback, тело form-urlencoded.
 */
public class SubmitFeedbackHandler implements HttpHandler {

    static final Logger log = LoggerFactory.getLogger(SubmitFeedbackHandler.class);

    Notifier notifier;
    SubmissionFormatter fmt;
    RateLimitGuard limiter;
    FormValidator validator = new FormValidator();
    FormParserFactory parsers = FormParserFactory.builder().withDefaultCharset("UTF-8").build();

    public SubmitFeedbackHandler(Notifier notifier, SubmissionFormatter fmt, RateLimitGuard limiter) {
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
            FeedbackForm form = readForm(exchange);

            if (!form.privacyAccepted) {
                ResponseUtil.sendError(exchange, StatusCodes.BAD_REQUEST, FormValidator.PRIVACY_REQUIRED);
                return;
            }

            List<String> errors = validator.validateFeedback(form);
            if (!errors.isEmpty()) {
                ResponseUtil.sendError(exchange, StatusCodes.BAD_REQUEST, String.join(" ", errors));
                return;
            }

            if (notifier.sendMessage(fmt.formatFeedback(form))) {
                ResponseUtil.sendSuccess(exchange);
            } else {
                ResponseUtil.sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, FormValidator.SUBMIT_ERROR);
            }
        } catch (Exception e) {
            log.error("Ошибка при обработке формы: {}", e.getMessage(), e);
            ResponseUtil.sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, FormValidator.SUBMIT_ERROR);
        }
    }

    FeedbackForm readForm(HttpServerExchange exchange) throws Exception {
        FeedbackForm form = new FeedbackForm();

        try (FormDataParser parser = parsers.createParser(exchange)) {
            // не form-urlencoded: считаем форму пустой, дальше отсечёт privacy
            if (parser == null) return form;

            FormData data = parser.parseBlocking();
            form.firstname = field(data, "firstname").trim();
            form.lastname = field(data, "lastname").trim();
            form.patronymic = field(data, "patronymic").trim();
            form.phone = FormValidator.normalizePhone(field(data, "phone"));
            form.message = field(data, "message").trim();
            form.privacyAccepted = !field(data, "privacy").isEmpty();
        }

        return form;
    }

    static String field(FormData data, String name) {
        FormData.FormValue v = data.getFirst(name);
        if (v == null || v.isFileItem()) return "";
        String s = v.getValue();
        return s == null ? "" : s;
    }
}
