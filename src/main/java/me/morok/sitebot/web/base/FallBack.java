package me.morok.sitebot.web.base;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.StatusCodes;
import me.morok.sitebot.web.ResponseUtil;

public class FallBack implements HttpHandler {

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        ResponseUtil.sendError(exchange, StatusCodes.NOT_FOUND, "URI " + exchange.getRequestURI() + " not found on server");
    }
}
