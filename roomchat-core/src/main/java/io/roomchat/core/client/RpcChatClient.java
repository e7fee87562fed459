package io.roomchat.core.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.roomchat.core.api.ChatRpcService;
import io.roomchat.core.api.FaultKind;
import io.roomchat.core.api.MessageView;
import io.roomchat.core.api.RpcFaultException;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

public final class RpcChatClient implements ChatClient {
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final TypeReference<List<MessageView>> MESSAGE_LIST = new TypeReference<>() {
    };
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };

    private final HttpUrl endpoint;
    private final OkHttpClient client;
    private final ObjectMapper mapper;
    private final AtomicLong requestIds;

    public RpcChatClient(String endpoint) {
        this(endpoint, Duration.ofSeconds(10));
    }

    public RpcChatClient(String endpoint, Duration timeout) {
        this.endpoint = HttpUrl.get(Objects.requireNonNull(endpoint, "endpoint must not be null"));
        this.client = new OkHttpClient.Builder()
            .connectTimeout(timeout)
            .readTimeout(timeout)
            .writeTimeout(timeout)
            .build();
        this.mapper = new ObjectMapper();
        this.requestIds = new AtomicLong();
    }

    public String endpoint() {
        return endpoint.toString();
    }

    @Override
    public long sendMessage(String author, String text, String room) throws IOException {
        ArrayNode params = mapper.createArrayNode().add(author).add(text).add(room);
        JsonNode result = call(ChatRpcService.SEND_MESSAGE, params);
        if (!result.canConvertToLong()) {
            throw new IOException("send_message returned a non-integer result: " + result);
        }
        return result.longValue();
    }

    @Override
    public List<MessageView> getMessages(long cursor, String room) throws IOException {
        ArrayNode params = mapper.createArrayNode().add(cursor).add(room);
        JsonNode result = call(ChatRpcService.GET_MESSAGES, params);
        if (!result.isArray()) {
            throw new IOException("get_messages returned a non-array result: " + result);
        }
        return mapper.convertValue(result, MESSAGE_LIST);
    }

    public List<String> listMethods() throws IOException {
        return mapper.convertValue(call(ChatRpcService.LIST_METHODS, mapper.createArrayNode()), STRING_LIST);
    }

    private JsonNode call(String method, JsonNode params) throws IOException {
        ObjectNode payload = mapper.createObjectNode();
        payload.put("jsonrpc", "2.0");
        payload.put("id", requestIds.incrementAndGet());
        payload.put("method", method);
        payload.set("params", params);

        Request request = new Request.Builder()
            .url(endpoint)
            .post(RequestBody.create(mapper.writeValueAsString(payload), JSON))
            .build();

        try (Response response = client.newCall(request).execute()) {
            ResponseBody body = response.body();
            String raw = body == null ? "" : body.string();
            JsonNode node = parse(raw, response.code());
            JsonNode error = node.get("error");
            if (error != null && !error.isNull()) {
                throw toFault(error);
            }
            if (!response.isSuccessful()) {
                throw new IOException("HTTP " + response.code() + " from " + endpoint);
            }
            JsonNode result = node.get("result");
            if (result == null) {
                throw new IOException("Response to " + method + " carried neither result nor error");
            }
            return result;
        }
    }

    private JsonNode parse(String raw, int status) throws IOException {
        if (raw.isBlank()) {
            throw new IOException("Empty response (HTTP " + status + ") from " + endpoint);
        }
        try {
            JsonNode node = mapper.readTree(raw);
            if (node == null || !node.isObject()) {
                throw new IOException("Malformed response (HTTP " + status + ") from " + endpoint);
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new IOException("Malformed response (HTTP " + status + ") from " + endpoint, e);
        }
    }

    private RpcFaultException toFault(JsonNode error) {
        String kind = error.path("data").path("kind").asText("");
        int code = error.path("code").asInt(FaultKind.INTERNAL_ERROR.code());
        String message = error.path("message").asText("unknown fault");
        return new RpcFaultException(FaultKind.fromWire(kind, code), message);
    }
}
