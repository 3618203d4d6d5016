package me.morok.sitebot.web;

import io.undertow.Undertow;
import io.undertow.UndertowOptions;
import me.morok.sitebot.config.ServerConfig;
import me.morok.sitebot.notify.Notifier;
import me.morok.sitebot.ui.SubmissionFormatter;
import me.morok.sitebot.util.RateLimitGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;

/**
 * Undertow с эндпоинтами форм.
 */
public class WebServer {

    static final Logger log = LoggerFactory.getLogger(WebServer.class);

    ServerConfig cfg;
    Undertow server;

    public WebServer(ServerConfig cfg, Notifier notifier, SubmissionFormatter fmt, RateLimitGuard limiter) {
        if (cfg == null) throw new IllegalArgumentException("Invalid configuration: missing server section.");
        this.cfg = cfg;

        server = Undertow.builder()
                .setServerOption(UndertowOptions.DECODE_URL, true)
                .setServerOption(UndertowOptions.URL_CHARSET, StandardCharsets.UTF_8.name())
                .addHttpListener(cfg.port, cfg.host)
                .setHandler(Routes.site(cfg, notifier, fmt, limiter))
                .build();
    }

    public void start() {
        server.start();
        log.info("Undertow запущен на http://{}:{}", cfg.host, port());

        if (cfg.adminKey == null || cfg.adminKey.isBlank()) {
            log.warn("server.admin-key не задан, смена пароля через /admin/update_password отключена");
        }
    }

    public void stop() {
        server.stop();
        log.info("Undertow остановлен");
    }

    /**
     * Фактический порт, отличается от настроенного, если там был 0.
     */
    public int port() {
        return ((InetSocketAddress) server.getListenerInfo().get(0).getAddress()).getPort();
    }
}
