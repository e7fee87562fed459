package io.roomchat.cli;

import static org.assertj.core.api.Assertions.assertThat;

import io.roomchat.core.api.ChatRpcService;
import io.roomchat.core.api.RpcServer;
import io.roomchat.core.config.ConfigService;
import io.roomchat.core.log.MessageLog;
import io.roomchat.core.model.ChatMessage;
import io.roomchat.core.store.JdbcMessageStore;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.function.BooleanSupplier;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class ChatCommandTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldEchoOwnMessagesAndRenderOthers() throws Exception {
        JdbcMessageStore store = JdbcMessageStore.sqlite(tempDir.resolve("chat.db"));
        store.initialize();
        MessageLog log = new MessageLog(store);
        log.append("bob", "yo", "public");
        log.append("carol", "founders only", "founders");

        try (RpcServer server = new RpcServer("127.0.0.1", 0, RpcServer.DEFAULT_MAX_REQUEST_BYTES, new ChatRpcService(log))) {
            server.start();
            String url = "http://127.0.0.1:" + server.port() + "/rpc";
            CliContext context = new CliContext(new ConfigService(), tempDir.resolve("config.json"));

            ByteArrayOutputStream out = new ByteArrayOutputStream();
            InputStream input = new GatedInput(
                "hello everyone\n\n",
                () -> out.toString(StandardCharsets.UTF_8).contains("bob: yo"),
                "/quit\n"
            );

            int code = runWithConsole(input, out, () -> new CommandLine(new ChatCommand(context)).execute(
                "--username", "alice", "--url", url, "--poll-interval", "0.2"
            ));

            String printed = out.toString(StandardCharsets.UTF_8);
            assertThat(code).isZero();
            assertThat(printed).contains("Connected to chat server at " + url + " as 'alice' in room 'public'.");
            assertThat(printed).containsPattern("\\[\\d{2}:\\d{2}:\\d{2}] you \\(alice\\) \\[3]: hello everyone");
            assertThat(printed).containsPattern("\\[\\d{2}:\\d{2}:\\d{2}] bob: yo");
            assertThat(printed).doesNotContain("founders only").doesNotContain("] alice: hello everyone");
            assertThat(printed).contains("Exiting chat client.");
        }

        assertThat(log.pollSince(0, "public")).extracting(ChatMessage::text).containsExactly("yo", "hello everyone");
    }

    @Test
    void shouldReportUndeliveredMessageAndKeepGoing() throws Exception {
        CliContext context = new CliContext(new ConfigService(), tempDir.resolve("config.json"));
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        InputStream input = new ByteArrayInputStream("anyone there?\n/exit\n".getBytes(StandardCharsets.UTF_8));

        int code = runWithConsole(input, out, () -> new CommandLine(new ChatCommand(context)).execute(
            "-u", "alice", "--url", "http://127.0.0.1:1/rpc"
        ));

        assertThat(code).isZero();
        assertThat(out.toString(StandardCharsets.UTF_8))
            .contains("[error] Message may not have been delivered:")
            .contains("Exiting chat client.");
    }

    @Test
    void shouldRejectUnknownRoomBeforeConnecting() throws Exception {
        CliContext context = new CliContext(new ConfigService(), tempDir.resolve("config.json"));
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        PrintStream originalErr = System.err;
        int code;
        try {
            System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
            code = runWithConsole(new ByteArrayInputStream(new byte[0]), out, () -> new CommandLine(new ChatCommand(context))
                .execute("-u", "alice", "--room", "secretroom"));
        } finally {
            System.setErr(originalErr);
        }

        assertThat(code).isEqualTo(1);
        assertThat(err.toString(StandardCharsets.UTF_8)).contains("Chat failed:").contains("secretroom");
    }

    private static int runWithConsole(InputStream input, ByteArrayOutputStream out, CommandRun run) {
        InputStream originalIn = System.in;
        PrintStream originalOut = System.out;
        try {
            System.setIn(input);
            System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
            return run.execute();
        } finally {
            System.setIn(originalIn);
            System.setOut(originalOut);
        }
    }

    @FunctionalInterface
    private interface CommandRun {
        int execute();
    }

    /**
     * Serves the first chunk immediately and holds back the second until the condition holds or
     * ten seconds pass.
     */
    private static final class GatedInput extends InputStream {
        private final ByteArrayInputStream first;
        private final BooleanSupplier gate;
        private final ByteArrayInputStream second;
        private boolean opened;

        GatedInput(String first, BooleanSupplier gate, String second) {
            this.first = new ByteArrayInputStream(first.getBytes(StandardCharsets.UTF_8));
            this.gate = gate;
            this.second = new ByteArrayInputStream(second.getBytes(StandardCharsets.UTF_8));
        }

        @Override
        public int read() {
            byte[] single = new byte[1];
            int count = read(single, 0, 1);
            return count < 0 ? -1 : single[0] & 0xff;
        }

        @Override
        public int read(byte[] buffer, int offset, int length) {
            if (first.available() > 0) {
                return first.read(buffer, offset, length);
            }
            if (!opened) {
                long deadline = System.nanoTime() + 10_000_000_000L;
                while (!gate.getAsBoolean() && System.nanoTime() < deadline) {
                    try {
                        Thread.sleep(50);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        break;
                    }
                }
                opened = true;
            }
            return second.read(buffer, offset, length);
        }
    }
}
