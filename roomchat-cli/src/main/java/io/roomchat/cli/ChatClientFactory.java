package io.roomchat.cli;

import io.roomchat.core.client.ChatClient;

@FunctionalInterface
public interface ChatClientFactory {
    ChatClient connect(String serverUrl);
}
