package io.roomchat.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.roomchat.core.config.model.RoomChatConfig;
import io.roomchat.core.config.model.ServerConfig;
import io.roomchat.core.config.model.StoreConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

public final class ConfigService {
    private final ObjectMapper mapper;

    public ConfigService() {
        mapper = new ObjectMapper();
    }

    public RoomChatConfig load(Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        if (!Files.exists(configPath)) {
            return RoomChatConfig.defaults();
        }

        JsonNode defaultsNode = mapper.valueToTree(RoomChatConfig.defaults());
        JsonNode existingNode = mapper.readTree(Files.readString(configPath));
        JsonNode merged = deepMerge(defaultsNode, existingNode);
        return mapper.treeToValue(merged, RoomChatConfig.class);
    }

    public RoomChatConfig loadWithEnvironment(Path configPath) throws IOException {
        return applyEnvironment(load(configPath), System.getenv());
    }

    public RoomChatConfig applyEnvironment(RoomChatConfig config, Map<String, String> env) {
        ServerConfig server = config.server()
            .withHost(env(env, "ROOMCHAT_HOST", config.server().host()))
            .withPort(intEnv(env, "ROOMCHAT_PORT", config.server().port()));
        StoreConfig store = config.store()
            .withBackend(env(env, "CHAT_DB_BACKEND", config.store().backend()))
            .withPath(env(env, "CHAT_DB_PATH", config.store().path()))
            .withHost(env(env, "CHAT_DB_HOST", config.store().host()))
            .withPort(intEnv(env, "CHAT_DB_PORT", config.store().port()))
            .withDatabase(env(env, "CHAT_DB_NAME", config.store().database()))
            .withUser(env(env, "CHAT_DB_USER", config.store().user()))
            .withPassword(env(env, "CHAT_DB_PASSWORD", config.store().password()));
        return config.withServer(server).withStore(store);
    }

    public void save(Path configPath, RoomChatConfig config) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        Objects.requireNonNull(config, "config must not be null");
        Files.createDirectories(configPath.toAbsolutePath().getParent());
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        Files.writeString(configPath, json + System.lineSeparator());
    }

    public InitResult init(Path configPath, boolean overwrite) throws IOException {
        boolean created = !Files.exists(configPath);
        boolean overwritten = false;

        RoomChatConfig config;
        if (created || overwrite) {
            config = RoomChatConfig.defaults();
            overwritten = !created && overwrite;
        } else {
            config = load(configPath);
        }

        save(configPath, config);
        return new InitResult(configPath, created, overwritten);
    }

    private JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (base == null) {
            return override;
        }
        if (override == null) {
            return base;
        }
        if (!base.isObject() || !override.isObject()) {
            return override;
        }

        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry -> {
            JsonNode existing = merged.get(entry.getKey());
            merged.set(entry.getKey(), deepMerge(existing, entry.getValue()));
        });
        return merged;
    }

    private static String env(Map<String, String> env, String key, String fallback) {
        String value = env.get(key);
        return value == null || value.isBlank() ? fallback : value.trim();
    }

    private static int intEnv(Map<String, String> env, String key, int fallback) {
        String value = env.get(key);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }
}
