package io.roomchat.cli;

import io.roomchat.core.client.RpcChatClient;
import io.roomchat.core.config.ConfigService;
import io.roomchat.core.config.model.RoomChatConfig;
import java.io.IOException;
import java.nio.file.Path;

public record CliContext(
    ConfigService configService,
    Path configPath,
    ServerRunner serverRunner,
    ChatClientFactory clientFactory
) {
    public CliContext(ConfigService configService, Path configPath) {
        this(configService, configPath, (host, port) -> {
            throw new UnsupportedOperationException("server runner is not configured");
        }, RpcChatClient::new);
    }

    public RoomChatConfig loadConfig() throws IOException {
        return configService.applyEnvironment(configService.load(configPath), System.getenv());
    }
}
