package io.roomchat.core.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.roomchat.core.store.StoreUnavailableException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Routes JSON-RPC 2.0 requests to registered methods and turns every failure into a fault
 * response. Holds no per-call state.
 */
public final class RpcDispatcher {
    private static final Logger LOG = LoggerFactory.getLogger(RpcDispatcher.class);
    private static final String VERSION = "2.0";

    private final ObjectMapper mapper;
    private final Map<String, Registration> methods;

    public RpcDispatcher(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
        this.methods = new ConcurrentHashMap<>();
    }

    public RpcDispatcher register(String name, List<String> paramNames, RpcMethod method) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(method, "method must not be null");
        methods.put(name, new Registration(paramNames == null ? List.of() : List.copyOf(paramNames), method));
        return this;
    }

    public List<String> methodNames() {
        List<String> names = new ArrayList<>(methods.keySet());
        names.sort(String::compareTo);
        return names;
    }

    public ObjectNode dispatch(byte[] body) {
        JsonNode request;
        try {
            request = mapper.readTree(body);
        } catch (IOException e) {
            return fault(NullNode.getInstance(), FaultKind.PARSE_ERROR, "request body is not valid JSON");
        }
        if (request == null || request.isMissingNode()) {
            return fault(NullNode.getInstance(), FaultKind.INVALID_REQUEST, "empty request body");
        }
        return dispatch(request);
    }

    public ObjectNode dispatch(JsonNode request) {
        if (!request.isObject()) {
            return fault(NullNode.getInstance(), FaultKind.INVALID_REQUEST, "request must be a JSON object");
        }
        JsonNode id = request.has("id") ? request.get("id") : NullNode.getInstance();
        JsonNode methodNode = request.get("method");
        if (methodNode == null || !methodNode.isTextual() || methodNode.textValue().isBlank()) {
            return fault(id, FaultKind.INVALID_REQUEST, "method must be a non-empty string");
        }
        String name = methodNode.textValue();
        Registration registration = methods.get(name);
        if (registration == null) {
            return fault(id, FaultKind.METHOD_NOT_FOUND, "Unknown method: " + name);
        }

        try {
            RpcParams params = new RpcParams(name, registration.paramNames(), request.get("params"));
            Object result = registration.method().invoke(params);
            ObjectNode response = mapper.createObjectNode();
            response.put("jsonrpc", VERSION);
            response.set("id", id);
            response.set("result", mapper.valueToTree(result));
            return response;
        } catch (RpcFaultException e) {
            LOG.debug("Rejected {} call: {}", name, e.getMessage());
            return fault(id, e.kind(), e.getMessage());
        } catch (IllegalArgumentException e) {
            LOG.debug("Invalid argument for {}: {}", name, e.getMessage());
            return fault(id, FaultKind.INVALID_ARGUMENT, e.getMessage());
        } catch (StoreUnavailableException e) {
            LOG.warn("Store unavailable while handling {}", name, e);
            return fault(id, FaultKind.STORE_UNAVAILABLE, describe(e));
        } catch (Exception e) {
            LOG.error("Unexpected failure while handling {}", name, e);
            return fault(id, FaultKind.INTERNAL_ERROR, e.getMessage() == null ? "internal_error" : e.getMessage());
        }
    }

    public ObjectNode fault(JsonNode id, FaultKind kind, String message) {
        ObjectNode error = mapper.createObjectNode();
        error.put("code", kind.code());
        error.put("message", message);
        error.putObject("data").put("kind", kind.wireName());

        ObjectNode response = mapper.createObjectNode();
        response.put("jsonrpc", VERSION);
        response.set("id", id == null ? NullNode.getInstance() : id);
        response.set("error", error);
        return response;
    }

    public byte[] write(JsonNode response) throws JsonProcessingException {
        return mapper.writeValueAsBytes(response);
    }

    private static String describe(StoreUnavailableException e) {
        Throwable cause = e.getCause();
        if (cause == null || cause.getMessage() == null) {
            return e.getMessage();
        }
        return e.getMessage() + ": " + cause.getMessage();
    }

    private record Registration(List<String> paramNames, RpcMethod method) {
    }
}
