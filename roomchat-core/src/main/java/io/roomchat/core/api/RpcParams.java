package io.roomchat.core.api;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

/**
 * Type-checked access to JSON-RPC params, given either positionally or by name.
 */
public final class RpcParams {
    private final String method;
    private final List<String> names;
    private final JsonNode params;

    RpcParams(String method, List<String> names, JsonNode params) {
        this.method = method;
        this.names = List.copyOf(names);
        this.params = params;
        validateShape();
    }

    public String requiredString(String name) {
        JsonNode node = lookup(name);
        if (node == null) {
            throw invalid("missing required parameter '" + name + "'");
        }
        if (!node.isTextual()) {
            throw invalid("parameter '" + name + "' must be a string");
        }
        return node.textValue();
    }

    public String optionalString(String name, String fallback) {
        JsonNode node = lookup(name);
        if (node == null) {
            return fallback;
        }
        if (!node.isTextual()) {
            throw invalid("parameter '" + name + "' must be a string");
        }
        return node.textValue();
    }

    /**
     * Returns an integral number, a string (left for the caller to coerce) or {@code null} when
     * absent. Any other JSON type is rejected.
     */
    public Object integerOrText(String name) {
        JsonNode node = lookup(name);
        if (node == null) {
            return null;
        }
        if (node.isIntegralNumber()) {
            if (!node.canConvertToLong()) {
                throw invalid("parameter '" + name + "' is out of range");
            }
            return node.longValue();
        }
        if (node.isTextual()) {
            return node.textValue();
        }
        throw invalid("parameter '" + name + "' must be an integer");
    }

    private void validateShape() {
        if (params == null || params.isNull() || params.isMissingNode()) {
            return;
        }
        if (params.isArray()) {
            if (params.size() > names.size()) {
                throw invalid("expected at most " + names.size() + " parameters but got " + params.size());
            }
            return;
        }
        if (params.isObject()) {
            params.fieldNames().forEachRemaining(field -> {
                if (!names.contains(field)) {
                    throw invalid("unknown parameter '" + field + "'");
                }
            });
            return;
        }
        throw invalid("params must be an array or an object");
    }

    private JsonNode lookup(String name) {
        if (params == null || params.isNull() || params.isMissingNode()) {
            return null;
        }
        JsonNode node;
        if (params.isArray()) {
            int index = names.indexOf(name);
            node = index < 0 || index >= params.size() ? null : params.get(index);
        } else {
            node = params.get(name);
        }
        return node == null || node.isNull() ? null : node;
    }

    private RpcFaultException invalid(String detail) {
        return new RpcFaultException(FaultKind.INVALID_PARAMS, method + ": " + detail);
    }
}
