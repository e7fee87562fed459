package io.roomchat.core.api;

@FunctionalInterface
public interface RpcMethod {
    Object invoke(RpcParams params) throws Exception;
}
