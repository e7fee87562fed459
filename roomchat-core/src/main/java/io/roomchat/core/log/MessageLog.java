package io.roomchat.core.log;

import io.roomchat.core.model.ChatMessage;
import io.roomchat.core.model.Cursor;
import io.roomchat.core.model.Room;
import io.roomchat.core.store.MessageStore;
import io.roomchat.core.store.StoreUnavailableException;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Append-only, room-partitioned chat log.
 *
 * <p>Appends are serialized on a per-instance monitor held only while the store assigns and commits
 * the id. Reads take no lock and see every append that has already returned.
 */
public final class MessageLog {
    private static final Logger LOG = LoggerFactory.getLogger(MessageLog.class);

    private final MessageStore store;
    private final Object writeLock = new Object();

    public MessageLog(MessageStore store) {
        this.store = Objects.requireNonNull(store, "store must not be null");
    }

    public long append(String author, String text, String room) throws StoreUnavailableException {
        return appendMessage(author, text, room).id();
    }

    public ChatMessage appendMessage(String author, String text, String room) throws StoreUnavailableException {
        String normalizedAuthor = requireText(author, "author");
        String normalizedText = requireText(text, "text");
        Room target = Room.parse(room);

        ChatMessage stored;
        try {
            synchronized (writeLock) {
                stored = store.insert(target, normalizedAuthor, normalizedText);
            }
        } catch (StoreUnavailableException e) {
            LOG.error("Failed to append message to room {}: {}", target, e.getMessage(), e);
            throw e;
        }
        LOG.debug("Stored message id={} room={} author={}", stored.id(), target, normalizedAuthor);
        return stored;
    }

    public List<ChatMessage> pollSince(long cursor, String room) throws StoreUnavailableException {
        Room target = Room.parse(room);
        try {
            return store.findSince(target, Math.max(Cursor.START, cursor));
        } catch (StoreUnavailableException e) {
            LOG.error("Failed to fetch messages for room {} since {}: {}", target, cursor, e.getMessage(), e);
            throw e;
        }
    }

    public List<ChatMessage> pollSinceLenient(Object rawCursor, String room) throws StoreUnavailableException {
        return pollSince(Cursor.parse(rawCursor), room);
    }

    private static String requireText(String value, String field) {
        String trimmed = value == null ? "" : value.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException(field + " must be a non-empty string");
        }
        return trimmed;
    }
}
