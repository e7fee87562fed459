package io.roomchat.core.store;

import io.roomchat.core.config.ConfigPaths;
import io.roomchat.core.config.model.StoreConfig;
import io.roomchat.core.model.ChatMessage;
import io.roomchat.core.model.Room;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public final class JdbcMessageStore implements MessageStore {
    private static final String TABLE = "chat_messages";

    private final SqlDialect dialect;
    private final String jdbcUrl;
    private final String user;
    private final String password;

    public JdbcMessageStore(SqlDialect dialect, String jdbcUrl, String user, String password) {
        this.dialect = Objects.requireNonNull(dialect, "dialect must not be null");
        this.jdbcUrl = Objects.requireNonNull(jdbcUrl, "jdbcUrl must not be null");
        this.user = user == null ? "" : user;
        this.password = password == null ? "" : password;
    }

    public static JdbcMessageStore sqlite(Path dbPath) throws IOException {
        if (dbPath == null) {
            throw new IllegalArgumentException("dbPath must not be null");
        }
        Path absolute = dbPath.toAbsolutePath();
        Files.createDirectories(absolute.getParent());
        return new JdbcMessageStore(SqlDialect.SQLITE, "jdbc:sqlite:" + absolute, "", "");
    }

    public static JdbcMessageStore postgres(String host, int port, String database, String user, String password) {
        String url = "jdbc:postgresql://" + host + ":" + port + "/" + database;
        return new JdbcMessageStore(SqlDialect.POSTGRES, url, user, password);
    }

    public static JdbcMessageStore open(StoreConfig config) throws IOException {
        Objects.requireNonNull(config, "config must not be null");
        return switch (SqlDialect.parse(config.backend())) {
            case SQLITE -> sqlite(ConfigPaths.expandHome(config.path()));
            case POSTGRES -> postgres(config.host(), config.port(), config.database(), config.user(), config.password());
        };
    }

    public SqlDialect dialect() {
        return dialect;
    }

    public String jdbcUrl() {
        return jdbcUrl;
    }

    @Override
    public void initialize() throws StoreUnavailableException {
        String index = """
            CREATE INDEX IF NOT EXISTS ix_chat_messages_room_id
            ON chat_messages (room, id)
            """;
        try (Connection connection = openConnection()) {
            dialect.prepareDatabase(connection);
            connection.setAutoCommit(false);
            try (Statement statement = connection.createStatement()) {
                statement.execute(dialect.createTable());
                if (!hasColumn(connection, "author") && hasColumn(connection, "username")) {
                    // Deployments of the earlier server named the author column "username".
                    statement.execute("ALTER TABLE chat_messages RENAME COLUMN username TO author");
                }
                if (!hasColumn(connection, "room")) {
                    // Tables created before rooms existed: every legacy row belongs to the public room.
                    statement.execute("ALTER TABLE chat_messages ADD COLUMN room TEXT NOT NULL DEFAULT 'public'");
                }
                statement.execute(index);
                connection.commit();
            } catch (SQLException e) {
                connection.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to initialize chat_messages schema", e);
        }
    }

    @Override
    public ChatMessage insert(Room room, String author, String text) throws StoreUnavailableException {
        String sql = """
            INSERT INTO chat_messages (author, room, text)
            VALUES (?, ?, ?)
            RETURNING id, %s AS ts
            """.formatted(dialect.epochSeconds());
        try (Connection connection = openConnection()) {
            connection.setAutoCommit(false);
            try {
                ChatMessage stored;
                try (PreparedStatement statement = connection.prepareStatement(sql)) {
                    statement.setString(1, author);
                    statement.setString(2, room.id());
                    statement.setString(3, text);
                    try (ResultSet resultSet = statement.executeQuery()) {
                        if (!resultSet.next()) {
                            throw new SQLException("INSERT returned no generated id");
                        }
                        stored = new ChatMessage(
                            resultSet.getLong("id"),
                            room,
                            author,
                            text,
                            toInstant(resultSet.getDouble("ts"))
                        );
                    }
                }
                connection.commit();
                return stored;
            } catch (SQLException e) {
                connection.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to insert chat message", e);
        }
    }

    @Override
    public List<ChatMessage> findSince(Room room, long cursor) throws StoreUnavailableException {
        String sql = """
            SELECT id, author, text, %s AS ts
            FROM chat_messages
            WHERE room = ? AND id > ?
            ORDER BY id ASC
            """.formatted(dialect.epochSeconds());
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, room.id());
            statement.setLong(2, cursor);
            try (ResultSet resultSet = statement.executeQuery()) {
                List<ChatMessage> messages = new ArrayList<>();
                while (resultSet.next()) {
                    messages.add(new ChatMessage(
                        resultSet.getLong("id"),
                        room,
                        resultSet.getString("author"),
                        resultSet.getString("text"),
                        toInstant(resultSet.getDouble("ts"))
                    ));
                }
                return messages;
            }
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to fetch chat messages", e);
        }
    }

    private Connection openConnection() throws SQLException {
        Connection connection = user.isBlank()
            ? DriverManager.getConnection(jdbcUrl)
            : DriverManager.getConnection(jdbcUrl, user, password);
        try {
            dialect.configure(connection);
        } catch (SQLException e) {
            connection.close();
            throw e;
        }
        return connection;
    }

    private boolean hasColumn(Connection connection, String column) throws SQLException {
        DatabaseMetaData metaData = connection.getMetaData();
        try (ResultSet columns = metaData.getColumns(null, dialect.schemaPattern(connection), TABLE, column)) {
            return columns.next();
        }
    }

    private static Instant toInstant(double epochSeconds) {
        long seconds = (long) Math.floor(epochSeconds);
        long nanos = Math.round((epochSeconds - seconds) * 1_000_000_000L);
        return Instant.ofEpochSecond(seconds, nanos);
    }
}
