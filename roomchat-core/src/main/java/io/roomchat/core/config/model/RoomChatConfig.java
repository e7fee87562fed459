package io.roomchat.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RoomChatConfig(
    ServerConfig server,
    StoreConfig store,
    ClientConfig client
) {

    public static RoomChatConfig defaults() {
        return new RoomChatConfig(
            ServerConfig.defaults(),
            StoreConfig.defaults(),
            ClientConfig.defaults()
        );
    }

    public RoomChatConfig withServer(ServerConfig value) {
        return new RoomChatConfig(value, store, client);
    }

    public RoomChatConfig withStore(StoreConfig value) {
        return new RoomChatConfig(server, value, client);
    }
}
