package io.roomchat.cli;

import io.roomchat.core.api.MessageView;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

final class ChatLines {
    private static final DateTimeFormatter CLOCK = DateTimeFormatter.ofPattern("HH:mm:ss").withZone(ZoneId.systemDefault());

    private ChatLines() {
    }

    static String incoming(MessageView message) {
        return "[" + clock(message.timestamp()) + "] " + message.author() + ": " + message.text();
    }

    static String ownEcho(String username, long id, String text) {
        return "[" + CLOCK.format(Instant.now()) + "] you (" + username + ") [" + id + "]: " + text;
    }

    static String listing(MessageView message) {
        return "#" + message.id() + " " + incoming(message);
    }

    static String clock(double epochSeconds) {
        long millis = Math.round(epochSeconds * 1000.0);
        return CLOCK.format(Instant.ofEpochMilli(millis));
    }
}
