package io.roomchat.core.api;

public enum FaultKind {
    PARSE_ERROR("ParseError", -32700),
    INVALID_REQUEST("InvalidRequest", -32600),
    METHOD_NOT_FOUND("MethodNotFound", -32601),
    INVALID_PARAMS("InvalidParams", -32602),
    INTERNAL_ERROR("InternalError", -32603),
    INVALID_ARGUMENT("InvalidArgument", -32001),
    STORE_UNAVAILABLE("StoreUnavailable", -32002);

    private final String wireName;
    private final int code;

    FaultKind(String wireName, int code) {
        this.wireName = wireName;
        this.code = code;
    }

    public String wireName() {
        return wireName;
    }

    public int code() {
        return code;
    }

    public static FaultKind fromWire(String wireName, int code) {
        for (FaultKind kind : values()) {
            if (kind.wireName.equals(wireName)) {
                return kind;
            }
        }
        for (FaultKind kind : values()) {
            if (kind.code == code) {
                return kind;
            }
        }
        return INTERNAL_ERROR;
    }
}
