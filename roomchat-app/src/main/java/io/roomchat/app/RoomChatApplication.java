package io.roomchat.app;

import io.roomchat.cli.ChatCommand;
import io.roomchat.cli.CliContext;
import io.roomchat.cli.InitCommand;
import io.roomchat.cli.MessagesCommand;
import io.roomchat.cli.RoomChatCliCommand;
import io.roomchat.cli.SendCommand;
import io.roomchat.cli.ServerCommand;
import io.roomchat.cli.StatusCommand;
import io.roomchat.core.api.ChatRpcService;
import io.roomchat.core.api.RpcServer;
import io.roomchat.core.client.RpcChatClient;
import io.roomchat.core.config.ConfigPaths;
import io.roomchat.core.config.ConfigService;
import io.roomchat.core.config.model.RoomChatConfig;
import io.roomchat.core.config.model.ServerConfig;
import io.roomchat.core.log.MessageLog;
import io.roomchat.core.store.JdbcMessageStore;
import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

public final class RoomChatApplication {
    private static final Logger LOG = LoggerFactory.getLogger(RoomChatApplication.class);

    private RoomChatApplication() {
    }

    public static void main(String[] args) {
        ConfigService configService = new ConfigService();
        Path configPath = ConfigPaths.defaultConfigPath();

        CliContext context = new CliContext(
            configService,
            configPath,
            (host, port) -> runServer(configService, configPath, host, port),
            RpcChatClient::new
        );

        CommandLine commandLine = new CommandLine(new RoomChatCliCommand());
        commandLine.addSubcommand("server", new ServerCommand(context));
        commandLine.addSubcommand("chat", new ChatCommand(context));
        commandLine.addSubcommand("send", new SendCommand(context));
        commandLine.addSubcommand("messages", new MessagesCommand(context));
        commandLine.addSubcommand("init", new InitCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));

        int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    private static int runServer(
        ConfigService configService,
        Path configPath,
        String hostOverride,
        Integer portOverride
    ) throws Exception {
        RoomChatConfig config = configService.loadWithEnvironment(configPath);
        ServerConfig server = config.server();
        if (hostOverride != null && !hostOverride.isBlank()) {
            server = server.withHost(hostOverride);
        }
        if (portOverride != null) {
            server = server.withPort(portOverride);
        }

        JdbcMessageStore store = JdbcMessageStore.open(config.store());
        store.initialize();
        LOG.info("Chat store ready: {}", config.store().describe());
        ChatRpcService service = new ChatRpcService(new MessageLog(store));

        CountDownLatch shutdown = new CountDownLatch(1);
        try (RpcServer rpcServer = new RpcServer(server.host(), server.port(), server.maxRequestBytes(), service)) {
            Runtime.getRuntime().addShutdownHook(new Thread(shutdown::countDown));
            rpcServer.start();
            System.out.println("Chat server started on http://" + server.host() + ":" + rpcServer.port());
            System.out.println("Endpoints: POST /rpc (send_message, get_messages), GET|POST /api/messages, GET /healthz");
            shutdown.await();
        }
        return 0;
    }
}
