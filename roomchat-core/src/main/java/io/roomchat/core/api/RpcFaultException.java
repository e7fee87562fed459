package io.roomchat.core.api;

import java.util.Objects;

/**
 * A protocol-level fault: raised by the dispatcher for malformed calls and rebuilt by the client
 * from a fault response.
 */
public class RpcFaultException extends RuntimeException {
    private final FaultKind kind;

    public RpcFaultException(FaultKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    public FaultKind kind() {
        return kind;
    }
}
