package io.roomchat.cli;

import picocli.CommandLine.Command;

@Command(name = "roomchat", mixinStandardHelpOptions = true, description = "Room-based chat over JSON-RPC")
public final class RoomChatCliCommand implements Runnable {

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }
}
