package io.roomchat.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ClientConfig(String serverUrl, String room, double pollIntervalSeconds) {

    public static ClientConfig defaults() {
        return new ClientConfig("http://127.0.0.1:9000/rpc", "public", 1.0);
    }
}
