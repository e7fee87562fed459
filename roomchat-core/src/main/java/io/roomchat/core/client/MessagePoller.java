package io.roomchat.core.client;

import io.roomchat.core.api.MessageView;
import io.roomchat.core.model.Cursor;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Polls one room at a fixed delay and hands new messages to a listener in id order. Messages
 * written under the poller's own identity advance the cursor without being delivered.
 */
public final class MessagePoller implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(MessagePoller.class);
    public static final Duration MIN_INTERVAL = Duration.ofMillis(200);

    private final ChatClient client;
    private final String identity;
    private final String room;
    private final Duration interval;
    private final MessageListener listener;
    private final AtomicLong cursor;
    private final ScheduledExecutorService scheduler;
    private ScheduledFuture<?> task;

    public MessagePoller(ChatClient client, String identity, String room, Duration interval, MessageListener listener) {
        this(client, identity, room, interval, listener, Cursor.START);
    }

    public MessagePoller(
        ChatClient client,
        String identity,
        String room,
        Duration interval,
        MessageListener listener,
        long initialCursor
    ) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.identity = identity == null ? "" : identity.trim();
        this.room = room;
        this.interval = interval == null || interval.compareTo(MIN_INTERVAL) < 0 ? MIN_INTERVAL : interval;
        this.listener = Objects.requireNonNull(listener, "listener must not be null");
        this.cursor = new AtomicLong(Math.max(Cursor.START, initialCursor));
        this.scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "roomchat-poller");
            thread.setDaemon(true);
            return thread;
        });
    }

    public synchronized void start() {
        if (task != null) {
            return;
        }
        task = scheduler.scheduleWithFixedDelay(this::tick, 0, interval.toMillis(), TimeUnit.MILLISECONDS);
    }

    public long cursor() {
        return cursor.get();
    }

    public Duration interval() {
        return interval;
    }

    /**
     * Fetches and delivers everything newer than the cursor. Returns the number of messages handed
     * to the listener.
     */
    public int pollOnce() throws IOException {
        List<MessageView> messages = client.getMessages(cursor.get(), room);
        int delivered = 0;
        for (MessageView message : messages) {
            if (message.id() <= cursor.get()) {
                continue;
            }
            if (!identity.equals(message.author())) {
                listener.onMessage(message);
                delivered++;
            }
            cursor.set(message.id());
        }
        return delivered;
    }

    private void tick() {
        try {
            pollOnce();
        } catch (Exception e) {
            LOG.debug("Poll of room {} failed: {}", room, e.getMessage());
            try {
                listener.onError(e);
            } catch (RuntimeException listenerError) {
                LOG.warn("Poll error listener failed", listenerError);
            }
        }
    }

    @Override
    public synchronized void close() {
        if (task != null) {
            task.cancel(false);
        }
        scheduler.shutdownNow();
    }
}
