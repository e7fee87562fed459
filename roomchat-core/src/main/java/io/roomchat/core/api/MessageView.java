package io.roomchat.core.api;

import io.roomchat.core.model.ChatMessage;

public record MessageView(long id, String room, String author, String text, double timestamp) {

    public static MessageView from(ChatMessage message) {
        return new MessageView(
            message.id(),
            message.room().id(),
            message.author(),
            message.text(),
            message.timestampSeconds()
        );
    }
}
