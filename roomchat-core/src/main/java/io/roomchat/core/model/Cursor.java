package io.roomchat.core.model;

public final class Cursor {
    public static final long START = 0L;

    private Cursor() {
    }

    // Malformed cursors restart from the beginning of the room instead of failing.
    public static long parse(Object raw) {
        if (raw == null) {
            return START;
        }
        if (raw instanceof Number number) {
            return clamp(number.longValue());
        }
        String text = String.valueOf(raw).trim();
        if (text.isEmpty()) {
            return START;
        }
        try {
            return clamp(Long.parseLong(text));
        } catch (NumberFormatException e) {
            return START;
        }
    }

    private static long clamp(long value) {
        return Math.max(START, value);
    }
}
