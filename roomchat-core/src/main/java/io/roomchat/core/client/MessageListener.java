package io.roomchat.core.client;

import io.roomchat.core.api.MessageView;

public interface MessageListener {
    void onMessage(MessageView message);

    default void onError(Exception error) {
    }
}
