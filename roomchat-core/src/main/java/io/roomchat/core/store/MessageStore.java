package io.roomchat.core.store;

import io.roomchat.core.model.ChatMessage;
import io.roomchat.core.model.Room;
import java.util.List;

/**
 * Durable, append-only table of chat messages. Identifiers are assigned by the store and are
 * strictly increasing; gaps are allowed, reuse is not.
 */
public interface MessageStore {

    /**
     * Creates or upgrades the schema. Safe to call against an already initialized database.
     */
    void initialize() throws StoreUnavailableException;

    ChatMessage insert(Room room, String author, String text) throws StoreUnavailableException;

    /**
     * Returns every message of {@code room} with an id greater than {@code cursor}, ascending by id.
     */
    List<ChatMessage> findSince(Room room, long cursor) throws StoreUnavailableException;
}
