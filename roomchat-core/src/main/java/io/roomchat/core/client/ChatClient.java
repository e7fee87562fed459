package io.roomchat.core.client;

import io.roomchat.core.api.MessageView;
import java.io.IOException;
import java.util.List;

public interface ChatClient {

    /**
     * Appends a message. An {@link IOException} means the outcome is unknown: the server may have
     * stored the message before the connection failed.
     */
    long sendMessage(String author, String text, String room) throws IOException;

    List<MessageView> getMessages(long cursor, String room) throws IOException;
}
