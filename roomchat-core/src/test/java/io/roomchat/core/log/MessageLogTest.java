package io.roomchat.core.log;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.roomchat.core.model.ChatMessage;
import io.roomchat.core.model.Room;
import io.roomchat.core.store.JdbcMessageStore;
import io.roomchat.core.store.MessageStore;
import io.roomchat.core.store.StoreUnavailableException;
import java.nio.file.Path;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MessageLogTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldAssignSequentialIdsAndReturnThemInOrder() throws Exception {
        MessageLog log = newLog("chat.db");

        assertThat(log.append("alice", "hi", "public")).isEqualTo(1L);
        assertThat(log.append("bob", "yo", "public")).isEqualTo(2L);

        List<ChatMessage> messages = log.pollSince(0, "public");
        assertThat(messages).extracting(ChatMessage::id).containsExactly(1L, 2L);
        assertThat(messages).extracting(ChatMessage::author).containsExactly("alice", "bob");
        assertThat(messages).extracting(ChatMessage::text).containsExactly("hi", "yo");
    }

    @Test
    void shouldKeepRoomsIsolated() throws Exception {
        MessageLog log = newLog("chat.db");
        log.append("alice", "hello all", "public");
        log.append("carol", "board meeting", "founders");

        assertThat(log.pollSince(0, "public")).extracting(ChatMessage::text).containsExactly("hello all");
        assertThat(log.pollSince(0, "founders")).extracting(ChatMessage::text).containsExactly("board meeting");
        assertThat(log.pollSince(0, "founders")).allMatch(message -> message.room() == Room.FOUNDERS);
    }

    @Test
    void shouldOnlyReturnMessagesAfterCursor() throws Exception {
        MessageLog log = newLog("chat.db");
        log.append("alice", "one", "public");
        long second = log.append("alice", "two", "public");
        log.append("alice", "three", "public");

        assertThat(log.pollSince(second, "public")).extracting(ChatMessage::text).containsExactly("three");
        assertThat(log.pollSince(99, "public")).isEmpty();
    }

    @Test
    void shouldTreatMalformedCursorAsStart() throws Exception {
        MessageLog log = newLog("chat.db");
        log.append("alice", "one", "public");

        assertThat(log.pollSinceLenient("abc", "public")).hasSize(1);
        assertThat(log.pollSinceLenient(null, "public")).hasSize(1);
        assertThat(log.pollSinceLenient("-3", "public")).hasSize(1);
        assertThat(log.pollSinceLenient("1", "public")).isEmpty();
    }

    @Test
    void shouldDefaultAbsentRoomToPublic() throws Exception {
        MessageLog log = newLog("chat.db");
        log.append("alice", "hi", null);
        log.append("bob", "yo", "");

        assertThat(log.pollSince(0, null)).extracting(ChatMessage::room).containsExactly(Room.PUBLIC, Room.PUBLIC);
    }

    @Test
    void shouldRejectWhitespaceOnlyRoomWithoutWriting() throws Exception {
        MessageLog log = newLog("chat.db");

        assertThatThrownBy(() -> log.append("alice", "hi", "   "))
            .isInstanceOf(IllegalArgumentException.class);

        assertThat(log.pollSince(0, "public")).isEmpty();
    }

    @Test
    void shouldTrimAuthorAndText() throws Exception {
        MessageLog log = newLog("chat.db");

        ChatMessage stored = log.appendMessage("  alice ", "  hi there  ", "public");

        assertThat(stored.author()).isEqualTo("alice");
        assertThat(stored.text()).isEqualTo("hi there");
    }

    @Test
    void shouldRejectInvalidInputWithoutWriting() throws Exception {
        RecordingStore store = new RecordingStore();
        MessageLog log = new MessageLog(store);

        assertThatThrownBy(() -> log.append("   ", "hello", "public"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("author");
        assertThatThrownBy(() -> log.append("alice", "", "public"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("text");
        assertThatThrownBy(() -> log.append("alice", null, "public"))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> log.append("alice", "hello", "secretroom"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("secretroom");
        assertThatThrownBy(() -> log.pollSince(0, "secretroom"))
            .isInstanceOf(IllegalArgumentException.class);

        assertThat(store.inserts.get()).isZero();
    }

    @Test
    void shouldPropagateStoreFailures() {
        MessageLog log = new MessageLog(new FailingStore());

        assertThatThrownBy(() -> log.append("alice", "hi", "public"))
            .isInstanceOf(StoreUnavailableException.class)
            .hasMessageContaining("insert");
        assertThatThrownBy(() -> log.pollSince(0, "public"))
            .isInstanceOf(StoreUnavailableException.class)
            .hasMessageContaining("fetch");
    }

    @Test
    void shouldAssignDistinctIdsUnderConcurrentAppends() throws Exception {
        MessageLog log = newLog("chat.db");
        int writers = 8;
        int perWriter = 10;

        ExecutorService executor = Executors.newFixedThreadPool(writers);
        try {
            List<Callable<List<Long>>> tasks = new ArrayList<>();
            for (int writer = 0; writer < writers; writer++) {
                String author = "writer-" + writer;
                String room = writer % 2 == 0 ? "public" : "founders";
                tasks.add(() -> {
                    List<Long> ids = new ArrayList<>();
                    for (int i = 0; i < perWriter; i++) {
                        ids.add(log.append(author, "message " + i, room));
                    }
                    return ids;
                });
            }

            Set<Long> allIds = new HashSet<>();
            for (Future<List<Long>> future : executor.invokeAll(tasks, 60, TimeUnit.SECONDS)) {
                List<Long> ids = future.get();
                assertThat(ids).isSorted();
                allIds.addAll(ids);
            }
            assertThat(allIds).hasSize(writers * perWriter);
        } finally {
            executor.shutdownNow();
        }

        List<ChatMessage> publicRoom = log.pollSince(0, "public");
        List<ChatMessage> foundersRoom = log.pollSince(0, "founders");
        assertThat(publicRoom).hasSize(writers / 2 * perWriter);
        assertThat(foundersRoom).hasSize(writers / 2 * perWriter);
        assertThat(publicRoom).extracting(ChatMessage::id).isSorted();
    }

    @Test
    void shouldKeepIndependentInstancesSeparate() throws Exception {
        MessageLog first = newLog("first.db");
        MessageLog second = newLog("second.db");

        first.append("alice", "only in first", "public");

        assertThat(first.pollSince(0, "public")).hasSize(1);
        assertThat(second.pollSince(0, "public")).isEmpty();
        assertThat(second.append("bob", "first in second", "public")).isEqualTo(1L);
    }

    private MessageLog newLog(String fileName) throws Exception {
        JdbcMessageStore store = JdbcMessageStore.sqlite(tempDir.resolve(fileName));
        store.initialize();
        return new MessageLog(store);
    }

    private static final class RecordingStore implements MessageStore {
        private final AtomicInteger inserts = new AtomicInteger();

        @Override
        public void initialize() {
        }

        @Override
        public ChatMessage insert(Room room, String author, String text) {
            inserts.incrementAndGet();
            throw new AssertionError("insert must not be reached");
        }

        @Override
        public List<ChatMessage> findSince(Room room, long cursor) {
            return List.of();
        }
    }

    private static final class FailingStore implements MessageStore {
        @Override
        public void initialize() throws StoreUnavailableException {
            throw new StoreUnavailableException("Failed to initialize", new SQLException("down"));
        }

        @Override
        public ChatMessage insert(Room room, String author, String text) throws StoreUnavailableException {
            throw new StoreUnavailableException("Failed to insert chat message", new SQLException("down"));
        }

        @Override
        public List<ChatMessage> findSince(Room room, long cursor) throws StoreUnavailableException {
            throw new StoreUnavailableException("Failed to fetch chat messages", new SQLException("down"));
        }
    }
}
