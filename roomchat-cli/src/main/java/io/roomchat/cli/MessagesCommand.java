package io.roomchat.cli;

import io.roomchat.core.api.MessageView;
import io.roomchat.core.client.ChatClient;
import io.roomchat.core.config.model.RoomChatConfig;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "messages", description = "Print the messages of a room after a cursor")
public final class MessagesCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"--since"}, description = "Only show messages with a larger id", defaultValue = "0")
    long since;

    @Option(names = {"-r", "--room"}, description = "Room (public or founders)")
    String room;

    @Option(names = {"--url"}, description = "Server RPC endpoint override")
    String url;

    public MessagesCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            RoomChatConfig config = context.loadConfig();
            ChatClient client = context.clientFactory().connect(url != null ? url : config.client().serverUrl());
            List<MessageView> messages = client.getMessages(since, room != null ? room : config.client().room());
            if (messages.isEmpty()) {
                System.out.println("No messages.");
            }
            for (MessageView message : messages) {
                System.out.println(ChatLines.listing(message));
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Messages command failed: " + e.getMessage());
            return 1;
        }
    }
}
