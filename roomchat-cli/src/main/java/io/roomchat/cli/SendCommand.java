package io.roomchat.cli;

import io.roomchat.core.api.FaultKind;
import io.roomchat.core.api.RpcFaultException;
import io.roomchat.core.client.ChatClient;
import io.roomchat.core.config.model.RoomChatConfig;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "send", description = "Send a single message and print its id")
public final class SendCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"-u", "--username"}, required = true, description = "Author name")
    String username;

    @Option(names = {"-r", "--room"}, description = "Room (public or founders)")
    String room;

    @Option(names = {"--url"}, description = "Server RPC endpoint override")
    String url;

    @Parameters(index = "0", arity = "1", description = "Message text")
    String text;

    public SendCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        ChatClient client;
        String target;
        try {
            RoomChatConfig config = context.loadConfig();
            client = context.clientFactory().connect(url != null ? url : config.client().serverUrl());
            target = room != null ? room : config.client().room();
        } catch (Exception e) {
            System.err.println("Send failed: " + e.getMessage());
            return 1;
        }

        try {
            long id = client.sendMessage(username, text, target);
            System.out.println(id);
            return 0;
        } catch (RpcFaultException e) {
            if (e.kind() == FaultKind.INVALID_ARGUMENT) {
                System.err.println("Send failed: " + e.getMessage());
            } else {
                System.err.println("Send failed: message may not have been delivered: " + e.getMessage());
            }
            return 1;
        } catch (Exception e) {
            System.err.println("Send failed: message may not have been delivered: " + e.getMessage());
            return 1;
        }
    }
}
