package io.roomchat.core.config;

import java.nio.file.Path;

public final class ConfigPaths {

    private ConfigPaths() {
    }

    public static Path defaultConfigPath() {
        return Path.of(System.getProperty("user.home"), ".roomchat", "config.json");
    }

    public static Path defaultDatabasePath() {
        return Path.of(System.getProperty("user.home"), ".roomchat", "chat.db");
    }

    public static Path expandHome(String rawPath) {
        if (rawPath == null || rawPath.isBlank()) {
            return defaultDatabasePath();
        }
        if (rawPath.startsWith("~/")) {
            return Path.of(System.getProperty("user.home")).resolve(rawPath.substring(2));
        }
        return Path.of(rawPath);
    }
}
