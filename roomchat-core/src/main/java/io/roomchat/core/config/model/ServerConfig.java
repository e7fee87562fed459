package io.roomchat.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ServerConfig(String host, int port, int maxRequestBytes) {

    public static ServerConfig defaults() {
        return new ServerConfig("0.0.0.0", 9000, 64 * 1024);
    }

    public ServerConfig withHost(String value) {
        return new ServerConfig(value, port, maxRequestBytes);
    }

    public ServerConfig withPort(int value) {
        return new ServerConfig(host, value, maxRequestBytes);
    }
}
