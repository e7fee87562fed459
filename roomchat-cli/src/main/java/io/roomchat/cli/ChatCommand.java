package io.roomchat.cli;

import io.roomchat.core.api.FaultKind;
import io.roomchat.core.api.MessageView;
import io.roomchat.core.api.RpcFaultException;
import io.roomchat.core.client.ChatClient;
import io.roomchat.core.client.MessageListener;
import io.roomchat.core.client.MessagePoller;
import io.roomchat.core.config.model.RoomChatConfig;
import io.roomchat.core.model.Room;
import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "chat", description = "Join a room interactively; type /quit to leave")
public final class ChatCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"-u", "--username"}, required = true, description = "Name shown next to your messages")
    String username;

    @Option(names = {"-r", "--room"}, description = "Room (public or founders)")
    String room;

    @Option(names = {"--poll-interval"}, description = "Seconds between polls")
    Double pollInterval;

    @Option(names = {"--url"}, description = "Server RPC endpoint override")
    String url;

    public ChatCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            if (username.isBlank()) {
                throw new IllegalArgumentException("username must not be blank");
            }
            String name = username.trim();
            RoomChatConfig config = context.loadConfig();
            String endpoint = url != null ? url : config.client().serverUrl();
            String target = Room.parse(room != null ? room : config.client().room()).id();
            double seconds = pollInterval != null ? pollInterval : config.client().pollIntervalSeconds();
            ChatClient client = context.clientFactory().connect(endpoint);

            System.out.println("Connected to chat server at " + endpoint + " as '" + name + "' in room '" + target + "'.");
            System.out.println("Type your message and press Enter to send. Use /quit or /exit to leave.");

            try (MessagePoller poller = new MessagePoller(
                client,
                name,
                target,
                Duration.ofMillis(Math.round(seconds * 1000.0)),
                new ConsoleListener()
            )) {
                poller.start();
                readLoop(client, name, target);
            }
            System.out.println("Exiting chat client.");
            return 0;
        } catch (Exception e) {
            System.err.println("Chat failed: " + e.getMessage());
            return 1;
        }
    }

    private void readLoop(ChatClient client, String name, String target) throws Exception {
        BufferedReader reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        String line;
        while ((line = reader.readLine()) != null) {
            String text = line.trim();
            if (text.isEmpty()) {
                continue;
            }
            String command = text.toLowerCase(Locale.ROOT);
            if (command.equals("/quit") || command.equals("/exit")) {
                break;
            }
            try {
                long id = client.sendMessage(name, text, target);
                System.out.println(ChatLines.ownEcho(name, id, text));
            } catch (RpcFaultException e) {
                if (e.kind() == FaultKind.INVALID_ARGUMENT) {
                    System.out.println("[error] " + e.getMessage());
                } else {
                    System.out.println("[error] Message may not have been delivered: " + e.getMessage());
                }
            } catch (Exception e) {
                System.out.println("[error] Message may not have been delivered: " + e.getMessage());
            }
        }
    }

    private static final class ConsoleListener implements MessageListener {
        @Override
        public void onMessage(MessageView message) {
            System.out.println(ChatLines.incoming(message));
        }

        @Override
        public void onError(Exception error) {
            System.out.println("[warning] Error while receiving messages: " + error.getMessage());
        }
    }
}
