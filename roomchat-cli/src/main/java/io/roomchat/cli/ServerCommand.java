package io.roomchat.cli;

import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "server", description = "Run the chat RPC server until interrupted")
public final class ServerCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"--host"}, description = "Bind address override")
    String host;

    @Option(names = {"--port"}, description = "Port override")
    Integer port;

    public ServerCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            return context.serverRunner().run(host, port);
        } catch (Exception e) {
            System.err.println("Server command failed: " + e.getMessage());
            return 1;
        }
    }
}
