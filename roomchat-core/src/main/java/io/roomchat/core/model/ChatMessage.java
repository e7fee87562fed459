package io.roomchat.core.model;

import java.time.Instant;
import java.util.Objects;

public record ChatMessage(long id, Room room, String author, String text, Instant createdAt) {

    public ChatMessage {
        Objects.requireNonNull(room, "room must not be null");
        Objects.requireNonNull(author, "author must not be null");
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
    }

    public double timestampSeconds() {
        return createdAt.getEpochSecond() + createdAt.getNano() / 1_000_000_000.0;
    }
}
