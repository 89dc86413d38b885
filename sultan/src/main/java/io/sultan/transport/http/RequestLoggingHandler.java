package io.sultan.transport.http;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.HttpString;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Tags every request with a random id and logs one line when the exchange completes.
 *
 * The id is echoed in the {@code X-Request-Id} response header and put in the SLF4J MDC under
 * {@code requestId}, so handler and service logs for the request carry it. Must sit inside the
 * {@link io.undertow.server.handlers.BlockingHandler}: the MDC is thread-local and has to be set
 * on the worker thread that runs the handlers.
 */
public final class RequestLoggingHandler implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(RequestLoggingHandler.class);

    public static final String MDC_REQUEST_ID = "requestId";
    public static final HttpString REQUEST_ID_HEADER = HttpString.tryFromString("X-Request-Id");

    private final HttpHandler next;

    public RequestLoggingHandler(HttpHandler next) {
        this.next = next;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) throws Exception {
        String requestId = UUID.randomUUID().toString();
        long startNanos = System.nanoTime();
        String method = exchange.getRequestMethod().toString();
        String path = exchange.getRequestPath();

        exchange.getResponseHeaders().put(REQUEST_ID_HEADER, requestId);
        exchange.addExchangeCompleteListener((completed, nextListener) -> {
            // Completion runs on an I/O thread or, when the response ends inside the handler, on this one
            String previous = MDC.get(MDC_REQUEST_ID);
            MDC.put(MDC_REQUEST_ID, requestId);
            try {
                long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
                log.info("[HTTP] {} {} -> {} ({} ms)", method, path, completed.getStatusCode(), elapsedMs);
            } finally {
                if (previous == null) {
                    MDC.remove(MDC_REQUEST_ID);
                } else {
                    MDC.put(MDC_REQUEST_ID, previous);
                }
                nextListener.proceed();
            }
        });

        MDC.put(MDC_REQUEST_ID, requestId);
        try {
            next.handleRequest(exchange);
        } finally {
            MDC.remove(MDC_REQUEST_ID);
        }
    }
}
