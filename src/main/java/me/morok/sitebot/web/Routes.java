package me.morok.sitebot.web;

import io.undertow.Handlers;
import io.undertow.server.HttpHandler;
import io.undertow.server.RoutingHandler;
import io.undertow.server.handlers.BlockingHandler;
import me.morok.sitebot.config.ServerConfig;
import me.morok.sitebot.notify.Notifier;
import me.morok.sitebot.ui.SubmissionFormatter;
import me.morok.sitebot.util.RateLimitGuard;
import me.morok.sitebot.web.base.Dispatcher;
import me.morok.sitebot.web.base.FallBack;
import me.morok.sitebot.web.base.InvalidMethod;
import me.morok.sitebot.web.handlers.SubmitFeedbackHandler;
import me.morok.sitebot.web.handlers.SubmitOrderHandler;
import me.morok.sitebot.web.handlers.UpdatePasswordHandler;

public class Routes {

    private Routes() {
    }

    public static RoutingHandler site(ServerConfig cfg, Notifier notifier, SubmissionFormatter fmt, RateLimitGuard limiter) {
        return Handlers.routing()
                .post("/submit-feedback", blocking(new SubmitFeedbackHandler(notifier, fmt, limiter)))
                .post("/submit-order", blocking(new SubmitOrderHandler(notifier, fmt, limiter)))
                .post("/admin/update_password", blocking(new UpdatePasswordHandler(notifier, cfg.adminKey)))
                .setInvalidMethodHandler(new Dispatcher(new InvalidMethod()))
                .setFallbackHandler(new Dispatcher(new FallBack()));
    }

    /**
     * Рабочий поток и блокирующее чтение тела.
     */
    static HttpHandler blocking(HttpHandler handler) {
        return new Dispatcher(new BlockingHandler(handler));
    }
}
