package io.roomchat.core.store;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Locale;

public enum SqlDialect {
    SQLITE(
        """
            CREATE TABLE IF NOT EXISTS chat_messages (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                author TEXT NOT NULL,
                room TEXT NOT NULL DEFAULT 'public',
                text TEXT NOT NULL,
                created_at REAL NOT NULL DEFAULT ((julianday('now') - 2440587.5) * 86400.0)
            )
            """,
        "created_at"
    ) {
        @Override
        void configure(Connection connection) throws SQLException {
            try (Statement statement = connection.createStatement()) {
                statement.execute("PRAGMA busy_timeout=5000;");
                statement.execute("PRAGMA synchronous=NORMAL;");
            }
        }

        @Override
        void prepareDatabase(Connection connection) throws SQLException {
            try (Statement statement = connection.createStatement()) {
                statement.execute("PRAGMA journal_mode=WAL;");
            }
        }
    },
    POSTGRES(
        """
            CREATE TABLE IF NOT EXISTS chat_messages (
                id BIGSERIAL PRIMARY KEY,
                author TEXT NOT NULL,
                room TEXT NOT NULL DEFAULT 'public',
                text TEXT NOT NULL,
                created_at TIMESTAMPTZ NOT NULL DEFAULT NOW()
            )
            """,
        "EXTRACT(EPOCH FROM created_at)"
    ) {
        @Override
        String schemaPattern(Connection connection) throws SQLException {
            return connection.getSchema();
        }
    };

    private final String createTable;
    private final String epochSecondsExpression;

    SqlDialect(String createTable, String epochSecondsExpression) {
        this.createTable = createTable;
        this.epochSecondsExpression = epochSecondsExpression;
    }

    String createTable() {
        return createTable;
    }

    String epochSeconds() {
        return epochSecondsExpression;
    }

    // Per-connection session settings.
    void configure(Connection connection) throws SQLException {
    }

    // Database-wide settings applied once during schema initialization.
    void prepareDatabase(Connection connection) throws SQLException {
    }

    // Schema to search when inspecting existing columns; null matches any.
    String schemaPattern(Connection connection) throws SQLException {
        return null;
    }

    public static SqlDialect parse(String raw) {
        String normalized = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "", "sqlite" -> SQLITE;
            case "postgres", "postgresql" -> POSTGRES;
            default -> throw new IllegalArgumentException("Unsupported store backend: " + raw);
        };
    }
}
