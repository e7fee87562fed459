package io.roomchat.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record StoreConfig(
    String backend,
    String path,
    String host,
    int port,
    String database,
    String user,
    String password
) {

    public static StoreConfig defaults() {
        return new StoreConfig(
            "sqlite",
            "~/.roomchat/chat.db",
            "localhost",
            5432,
            "chatdb",
            "chatuser",
            "chatpass"
        );
    }

    public StoreConfig withBackend(String value) {
        return new StoreConfig(value, path, host, port, database, user, password);
    }

    public StoreConfig withPath(String value) {
        return new StoreConfig(backend, value, host, port, database, user, password);
    }

    public StoreConfig withHost(String value) {
        return new StoreConfig(backend, path, value, port, database, user, password);
    }

    public StoreConfig withPort(int value) {
        return new StoreConfig(backend, path, host, value, database, user, password);
    }

    public StoreConfig withDatabase(String value) {
        return new StoreConfig(backend, path, host, port, value, user, password);
    }

    public StoreConfig withUser(String value) {
        return new StoreConfig(backend, path, host, port, database, value, password);
    }

    public StoreConfig withPassword(String value) {
        return new StoreConfig(backend, path, host, port, database, user, value);
    }

    public String describe() {
        if ("postgres".equalsIgnoreCase(backend) || "postgresql".equalsIgnoreCase(backend)) {
            return "postgres " + host + ":" + port + " db=" + database + " user=" + user;
        }
        return "sqlite " + path;
    }
}
