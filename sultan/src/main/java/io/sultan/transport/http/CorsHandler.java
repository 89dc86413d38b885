package io.sultan.transport.http;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.HttpString;
import io.undertow.util.Methods;
import io.undertow.util.StatusCodes;

/**
 * CORS for the single browser origin that calls the API. Credentials are allowed, so the origin
 * is never a wildcard. Preflight requests are answered here and do not reach the routes.
 */
public final class CorsHandler implements HttpHandler {

    private static final HttpString ALLOW_ORIGIN = HttpString.tryFromString("Access-Control-Allow-Origin");
    private static final HttpString ALLOW_CREDENTIALS = HttpString.tryFromString("Access-Control-Allow-Credentials");
    private static final HttpString ALLOW_METHODS = HttpString.tryFromString("Access-Control-Allow-Methods");
    private static final HttpString ALLOW_HEADERS = HttpString.tryFromString("Access-Control-Allow-Headers");
    private static final HttpString MAX_AGE = HttpString.tryFromString("Access-Control-Max-Age");
    private static final HttpString VARY = HttpString.tryFromString("Vary");

    private final String allowedOrigin;
    private final HttpHandler next;

    public CorsHandler(String allowedOrigin, HttpHandler next) {
        this.allowedOrigin = allowedOrigin;
        this.next = next;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) throws Exception {
        exchange.getResponseHeaders()
            .put(ALLOW_ORIGIN, allowedOrigin)
            .put(ALLOW_CREDENTIALS, "true")
            .put(ALLOW_METHODS, "GET, POST, OPTIONS")
            .put(ALLOW_HEADERS, "Content-Type, Authorization")
            .put(MAX_AGE, "3600")
            .put(VARY, "Origin");

        if (Methods.OPTIONS.equals(exchange.getRequestMethod())) {
            exchange.setStatusCode(StatusCodes.OK);
            exchange.endExchange();
        } else {
            next.handleRequest(exchange);
        }
    }
}
