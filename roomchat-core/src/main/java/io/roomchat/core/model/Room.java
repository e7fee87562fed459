package io.roomchat.core.model;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

public enum Room {
    PUBLIC("public"),
    FOUNDERS("founders");

    private final String id;

    Room(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    /**
     * Normalizes a wire room name. Absent or empty input selects {@link #PUBLIC}; anything outside
     * the closed set, whitespace-only input included, is rejected rather than remapped.
     */
    public static Room parse(String raw) {
        if (raw == null || raw.isEmpty()) {
            return PUBLIC;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (Room room : values()) {
            if (room.id.equals(normalized)) {
                return room;
            }
        }
        throw new IllegalArgumentException("room must be one of " + ids() + " but was '" + raw.trim() + "'");
    }

    public static List<String> ids() {
        return Arrays.stream(values()).map(Room::id).toList();
    }

    @Override
    public String toString() {
        return id;
    }
}
