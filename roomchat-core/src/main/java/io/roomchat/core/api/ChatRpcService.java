package io.roomchat.core.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.roomchat.core.log.MessageLog;
import io.roomchat.core.model.Room;
import io.roomchat.core.store.StoreUnavailableException;
import java.util.List;
import java.util.Objects;

public final class ChatRpcService {
    public static final String SEND_MESSAGE = "send_message";
    public static final String GET_MESSAGES = "get_messages";
    public static final String LIST_METHODS = "system.listMethods";

    private final MessageLog log;

    public ChatRpcService(MessageLog log) {
        this.log = Objects.requireNonNull(log, "log must not be null");
    }

    public RpcDispatcher dispatcher(ObjectMapper mapper) {
        RpcDispatcher dispatcher = new RpcDispatcher(mapper);
        dispatcher.register(SEND_MESSAGE, List.of("author", "text", "room"), this::sendMessage);
        dispatcher.register(GET_MESSAGES, List.of("cursor", "room"), this::getMessages);
        dispatcher.register(LIST_METHODS, List.of(), params -> dispatcher.methodNames());
        return dispatcher;
    }

    public MessageLog log() {
        return log;
    }

    private long sendMessage(RpcParams params) throws StoreUnavailableException {
        String author = params.requiredString("author");
        String text = params.requiredString("text");
        String room = params.optionalString("room", Room.PUBLIC.id());
        return log.append(author, text, room);
    }

    private List<MessageView> getMessages(RpcParams params) throws StoreUnavailableException {
        Object cursor = params.integerOrText("cursor");
        String room = params.optionalString("room", Room.PUBLIC.id());
        return log.pollSinceLenient(cursor, room).stream().map(MessageView::from).toList();
    }
}
