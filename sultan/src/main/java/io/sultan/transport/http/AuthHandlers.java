package io.sultan.transport.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.sultan.auth.TokenPair;
import io.sultan.domain.user.User;
import io.sultan.service.ErrorKind;
import io.sultan.service.ServiceResult;
import io.sultan.service.UserService;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.RoutingHandler;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;

/**
 * HTTP handlers for the account endpoints.
 *
 * Handlers read the request body with blocking I/O, so the routing handler must be wrapped in a
 * {@link io.undertow.server.handlers.BlockingHandler}; Argon2 work then runs on worker threads.
 */
public final class AuthHandlers {
    private static final Logger log = LoggerFactory.getLogger(AuthHandlers.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    // JSON Response Keys
    private static final String JSON_ERROR = "error";
    private static final String JSON_MESSAGE = "message";

    private static final String MSG_BODY_TOO_LARGE = "Request body too large";

    private static final String CONTENT_TYPE_JSON = "application/json; charset=utf-8";
    private static final String BEARER_PREFIX = "Bearer ";

    /** Largest accepted request body. Account payloads are a few hundred bytes. */
    public static final int MAX_BODY_BYTES = 16 * 1024;

    private final UserService userService;

    public AuthHandlers(UserService userService) {
        this.userService = userService;
    }

    /**
     * Add the account routes to {@code routes}.
     */
    public RoutingHandler addRoutes(RoutingHandler routes) {
        return routes
            .post("/api/auth/register", this::register)
            .post("/api/auth/login", this::login)
            .post("/api/auth/refresh", this::refresh)
            .post("/api/auth/logout", this::logout)
            .get("/api/auth/me", this::me)
            .get("/api/health", this::health);
    }

    /**
     * POST /api/auth/register
     * Body: {"username", "email", "password"}
     */
    public void register(HttpServerExchange exchange) {
        JsonNode body = readBody(exchange);
        if (body == null) {
            return;
        }

        ServiceResult<User> result = userService.register(
            text(body, "username"), text(body, "email"), text(body, "password"));

        if (result.isFailure()) {
            sendFailure(exchange, result);
            return;
        }
        sendJson(exchange, StatusCodes.CREATED, userJson(result.value()));
    }

    /**
     * POST /api/auth/login
     * Body: {"username", "password"}
     */
    public void login(HttpServerExchange exchange) {
        JsonNode body = readBody(exchange);
        if (body == null) {
            return;
        }

        ServiceResult<TokenPair> result = userService.login(text(body, "username"), text(body, "password"));
        if (result.isFailure()) {
            sendFailure(exchange, result);
            return;
        }
        sendJson(exchange, StatusCodes.OK, tokenJson(result.value()));
    }

    /**
     * POST /api/auth/refresh
     * Body: {"refreshToken"}
     */
    public void refresh(HttpServerExchange exchange) {
        JsonNode body = readBody(exchange);
        if (body == null) {
            return;
        }

        ServiceResult<TokenPair> result = userService.refresh(text(body, "refreshToken"));
        if (result.isFailure()) {
            sendFailure(exchange, result);
            return;
        }
        sendJson(exchange, StatusCodes.OK, tokenJson(result.value()));
    }

    /**
     * POST /api/auth/logout
     * Body: {"refreshToken"}
     */
    public void logout(HttpServerExchange exchange) {
        JsonNode body = readBody(exchange);
        if (body == null) {
            return;
        }

        ServiceResult<Void> result = userService.logout(text(body, "refreshToken"));
        if (result.isFailure()) {
            sendFailure(exchange, result);
            return;
        }
        exchange.setStatusCode(StatusCodes.NO_CONTENT);
        exchange.endExchange();
    }

    /**
     * GET /api/auth/me
     * Header: Authorization: Bearer &lt;access token&gt;
     */
    public void me(HttpServerExchange exchange) {
        String authHeader = exchange.getRequestHeaders().getFirst(Headers.AUTHORIZATION);
        if (authHeader == null || !authHeader.startsWith(BEARER_PREFIX)) {
            sendError(exchange, StatusCodes.UNAUTHORIZED, ErrorKind.INVALID_CREDENTIALS, "Missing bearer token");
            return;
        }

        ServiceResult<User> result = userService.authenticate(authHeader.substring(BEARER_PREFIX.length()));
        if (result.isFailure()) {
            sendFailure(exchange, result);
            return;
        }
        sendJson(exchange, StatusCodes.OK, userJson(result.value()));
    }

    /**
     * GET /api/health
     */
    public void health(HttpServerExchange exchange) {
        ObjectNode health = MAPPER.createObjectNode();
        health.put("status", "ok");
        health.put("ts", Instant.now().toString());
        sendJson(exchange, StatusCodes.OK, health);
    }

    static int statusFor(ErrorKind kind) {
        return switch (kind) {
            case VALIDATION_ERROR -> StatusCodes.BAD_REQUEST;
            case DUPLICATE_USERNAME, DUPLICATE_EMAIL -> StatusCodes.CONFLICT;
            case INVALID_CREDENTIALS -> StatusCodes.UNAUTHORIZED;
            case NOT_FOUND -> StatusCodes.NOT_FOUND;
            case INTERNAL -> StatusCodes.INTERNAL_SERVER_ERROR;
        };
    }

    private static ObjectNode userJson(User user) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("id", user.id().toString());
        node.put("username", user.username());
        node.put("email", user.email());
        node.putPOJO("createdAt", user.createdAt());
        return node;
    }

    private static ObjectNode tokenJson(TokenPair tokens) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("tokenType", "Bearer");
        node.put("accessToken", tokens.accessToken());
        node.putPOJO("accessTokenExpiresAt", tokens.access().expiresAt());
        node.put("refreshToken", tokens.refreshToken());
        node.putPOJO("refreshTokenExpiresAt", tokens.refresh().expiresAt());
        return node;
    }

    /**
     * Parse the request body as a JSON object. Sends 400 and returns null when it is not one or
     * when it is larger than {@link #MAX_BODY_BYTES}.
     */
    private static JsonNode readBody(HttpServerExchange exchange) {
        if (exchange.getRequestContentLength() > MAX_BODY_BYTES) {
            sendError(exchange, StatusCodes.BAD_REQUEST, ErrorKind.VALIDATION_ERROR, MSG_BODY_TOO_LARGE);
            return null;
        }
        try (InputStream in = exchange.getInputStream()) {
            // Chunked bodies carry no length; read one byte past the cap to detect overflow
            byte[] bytes = in.readNBytes(MAX_BODY_BYTES + 1);
            if (bytes.length > MAX_BODY_BYTES) {
                sendError(exchange, StatusCodes.BAD_REQUEST, ErrorKind.VALIDATION_ERROR, MSG_BODY_TOO_LARGE);
                return null;
            }
            JsonNode body = MAPPER.readTree(bytes);
            if (body == null || !body.isObject()) {
                sendError(exchange, StatusCodes.BAD_REQUEST, ErrorKind.VALIDATION_ERROR, "Request body must be a JSON object");
                return null;
            }
            return body;
        } catch (IOException e) {
            log.debug("[HTTP] Unreadable request body on {}: {}", exchange.getRequestPath(), e.getMessage());
            sendError(exchange, StatusCodes.BAD_REQUEST, ErrorKind.VALIDATION_ERROR, "Invalid request");
            return null;
        }
    }

    private static String text(JsonNode body, String field) {
        JsonNode value = body.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }

    private static void sendFailure(HttpServerExchange exchange, ServiceResult<?> result) {
        sendError(exchange, statusFor(result.error()), result.error(), result.message());
    }

    private static void sendError(HttpServerExchange exchange, int status, ErrorKind kind, String message) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put(JSON_ERROR, kind.name());
        node.put(JSON_MESSAGE, message);
        sendJson(exchange, status, node);
    }

    private static void sendJson(HttpServerExchange exchange, int status, JsonNode node) {
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, CONTENT_TYPE_JSON);
        try {
            exchange.getResponseSender().send(MAPPER.writeValueAsString(node), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.error("[HTTP] Failed to serialize response: {}", e.getMessage(), e);
            exchange.setStatusCode(StatusCodes.INTERNAL_SERVER_ERROR);
            exchange.endExchange();
        }
    }
}
