package io.roomchat.core.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.roomchat.core.model.ChatMessage;
import io.roomchat.core.model.Room;
import io.roomchat.core.store.StoreUnavailableException;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.handlers.PathHandler;
import io.undertow.util.Headers;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP front end: JSON-RPC on {@code /rpc}, the web client's JSON routes on {@code /api/messages}
 * and a health probe. Each request runs on an Undertow worker thread.
 */
public final class RpcServer implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(RpcServer.class);
    public static final int DEFAULT_MAX_REQUEST_BYTES = 64 * 1024;

    private final String host;
    private final int requestedPort;
    private final int maxRequestBytes;
    private final ChatRpcService service;
    private final ObjectMapper mapper;
    private final RpcDispatcher dispatcher;
    private final AtomicBoolean running;
    private Undertow server;
    private int actualPort;

    public RpcServer(String host, int port, int maxRequestBytes, ChatRpcService service) {
        this.host = host == null || host.isBlank() ? "0.0.0.0" : host;
        this.requestedPort = port;
        this.maxRequestBytes = maxRequestBytes > 0 ? maxRequestBytes : DEFAULT_MAX_REQUEST_BYTES;
        this.service = Objects.requireNonNull(service, "service must not be null");
        this.mapper = new ObjectMapper();
        this.dispatcher = service.dispatcher(mapper);
        this.running = new AtomicBoolean(false);
    }

    public void start() {
        if (running.getAndSet(true)) {
            return;
        }

        PathHandler routes = Handlers.path()
            .addExactPath("/healthz", this::handleHealth)
            .addExactPath("/rpc", this::handleRpc)
            .addExactPath("/api/messages", this::handleRestMessages);

        server = Undertow.builder()
            .addHttpListener(requestedPort, host)
            .setHandler(routes)
            .build();
        server.start();
        this.actualPort = resolveBoundPort(server, requestedPort);
        LOG.info("Chat RPC server listening on {}:{}", host, actualPort);
    }

    public int port() {
        return actualPort;
    }

    @Override
    public void close() {
        if (!running.getAndSet(false)) {
            return;
        }
        if (server != null) {
            server.stop();
            LOG.info("Chat RPC server on port {} stopped", actualPort);
        }
    }

    private void handleHealth(HttpServerExchange exchange) throws IOException {
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod().toString())) {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }
        sendJson(exchange, 200, Map.of("status", "ok"));
    }

    private void handleRpc(HttpServerExchange exchange) throws Exception {
        if (exchange.isInIoThread()) {
            exchange.dispatch(() -> {
                try {
                    handleRpc(exchange);
                } catch (Exception e) {
                    sendInternalError(exchange, e);
                }
            });
            return;
        }

        if (!"POST".equalsIgnoreCase(exchange.getRequestMethod().toString())) {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }

        byte[] body = readBody(exchange);
        if (body == null) {
            ObjectNode fault = dispatcher.fault(
                NullNode.getInstance(),
                FaultKind.INVALID_REQUEST,
                "request body exceeds " + maxRequestBytes + " bytes"
            );
            sendBytes(exchange, 413, dispatcher.write(fault));
            return;
        }
        sendBytes(exchange, 200, dispatcher.write(dispatcher.dispatch(body)));
    }

    private void handleRestMessages(HttpServerExchange exchange) throws Exception {
        if (exchange.isInIoThread()) {
            exchange.dispatch(() -> {
                try {
                    handleRestMessages(exchange);
                } catch (Exception e) {
                    sendInternalError(exchange, e);
                }
            });
            return;
        }

        String method = exchange.getRequestMethod().toString();
        try {
            if ("GET".equalsIgnoreCase(method)) {
                String room = queryParam(exchange, "room");
                List<MessageView> messages = service.log()
                    .pollSinceLenient(queryParam(exchange, "last_id"), room.isEmpty() ? Room.PUBLIC.id() : room)
                    .stream()
                    .map(MessageView::from)
                    .toList();
                sendJson(exchange, 200, messages);
                return;
            }
            if ("POST".equalsIgnoreCase(method)) {
                byte[] body = readBody(exchange);
                if (body == null) {
                    sendJson(exchange, 413, Map.of("error", "request body exceeds " + maxRequestBytes + " bytes"));
                    return;
                }
                JsonNode payload = readJsonObject(body);
                String author = text(payload, "author", text(payload, "username", ""));
                ChatMessage stored = service.log().appendMessage(
                    author,
                    text(payload, "text", ""),
                    text(payload, "room", Room.PUBLIC.id())
                );
                sendJson(exchange, 200, Map.of("id", stored.id()));
                return;
            }
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
        } catch (IllegalArgumentException e) {
            sendJson(exchange, 400, Map.of("error", e.getMessage()));
        } catch (StoreUnavailableException e) {
            LOG.warn("Store unavailable while serving /api/messages", e);
            sendJson(exchange, 500, Map.of("error", e.getMessage()));
        }
    }

    private byte[] readBody(HttpServerExchange exchange) throws IOException {
        long declared = exchange.getRequestContentLength();
        if (declared > maxRequestBytes) {
            return null;
        }
        exchange.startBlocking();
        byte[] bytes = exchange.getInputStream().readNBytes(maxRequestBytes + 1);
        return bytes.length > maxRequestBytes ? null : bytes;
    }

    private JsonNode readJsonObject(byte[] body) {
        try {
            JsonNode node = body.length == 0 ? mapper.createObjectNode() : mapper.readTree(body);
            return node != null && node.isObject() ? node : mapper.createObjectNode();
        } catch (IOException e) {
            throw new IllegalArgumentException("request body is not valid JSON");
        }
    }

    private String text(JsonNode body, String field, String fallback) {
        JsonNode node = body.get(field);
        if (node == null || node.isNull()) {
            return fallback;
        }
        return node.asText();
    }

    private void sendJson(HttpServerExchange exchange, int status, Object payload) throws IOException {
        sendBytes(exchange, status, mapper.writeValueAsBytes(payload));
    }

    private void sendBytes(HttpServerExchange exchange, int status, byte[] body) {
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        exchange.getResponseHeaders().put(Headers.CONTENT_LENGTH, String.valueOf(body.length));
        exchange.getResponseSender().send(ByteBuffer.wrap(body));
    }

    private void sendInternalError(HttpServerExchange exchange, Exception error) {
        LOG.error("Unhandled error for {}", exchange.getRequestPath(), error);
        try {
            sendJson(exchange, 500, Map.of("error", error.getMessage() == null ? "internal_error" : error.getMessage()));
        } catch (IOException e) {
            LOG.debug("Could not deliver error response: {}", e.getMessage());
        }
    }

    private String queryParam(HttpServerExchange exchange, String key) {
        Deque<String> values = exchange.getQueryParameters().get(key);
        if (values == null || values.isEmpty()) {
            return "";
        }
        String value = values.getFirst();
        return value == null ? "" : value;
    }

    private static int resolveBoundPort(Undertow undertow, int fallbackPort) {
        try {
            Object address = undertow.getListenerInfo().get(0).getAddress();
            if (address instanceof InetSocketAddress socketAddress) {
                return socketAddress.getPort();
            }
        } catch (RuntimeException e) {
            LOG.debug("Could not resolve bound port: {}", e.getMessage());
        }
        return fallbackPort;
    }
}
