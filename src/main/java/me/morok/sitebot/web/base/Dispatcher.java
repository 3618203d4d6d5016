package me.morok.sitebot.web.base;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;

/**
 * Уводит запрос с IO-потока: все обработчики ходят в Telegram или пишут файлы.
 */
public class Dispatcher implements HttpHandler {

    HttpHandler handler;

    public Dispatcher(HttpHandler handler) {
        this.handler = handler;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) throws Exception {
        exchange.dispatch(this.handler);
    }
}
