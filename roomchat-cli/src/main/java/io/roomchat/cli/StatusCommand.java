package io.roomchat.cli;

import io.roomchat.core.config.model.RoomChatConfig;
import io.roomchat.core.model.Room;
import java.nio.file.Files;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "status", description = "Show configuration status")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            RoomChatConfig config = context.loadConfig();
            System.out.println("Config path: " + context.configPath());
            System.out.println("Config exists: " + Files.exists(context.configPath()));
            System.out.println("Server address: " + config.server().host() + ":" + config.server().port());
            System.out.println("Max request bytes: " + config.server().maxRequestBytes());
            System.out.println("Store: " + config.store().describe());
            System.out.println("Client endpoint: " + config.client().serverUrl());
            System.out.println("Rooms: " + String.join(", ", Room.ids()));
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }
}
