package com.acme.chat.persistence.jdbc;

import com.acme.chat.core.InvalidArgumentException;
import com.acme.chat.core.NotFoundException;
import com.acme.chat.core.TransientException;
import com.acme.chat.domain.CreateMessageRequest;
import com.acme.chat.domain.Message;
import com.acme.chat.domain.MessagePage;
import com.acme.chat.pagination.CursorCodec;
import com.acme.chat.pagination.HistoryFilter;
import com.acme.chat.pagination.PageLimits;
import com.acme.chat.repository.MessageRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Abstract JDBC implementation of MessageRepository using Template Method pattern.
 * Subclasses supply the dialect-specific insert; reads are portable SQL.
 *
 * <p>Every statement runs in autocommit mode on the shard that owns the channel. Idempotency is
 * enforced by the unique constraint on {@code idempotency_key}: when an insert loses a race (no
 * row inserted, or a duplicate key error) the winner is re-read by key.
 */
public abstract class JdbcMessageRepository implements MessageRepository {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcMessageRepository.class);

    static final int REREAD_ATTEMPTS = 5;
    static final long REREAD_BACKOFF_MILLIS = 20;

    private static final String COLUMNS =
            "id, channel_id, user_id, content, message_type, created_at, updated_at, idempotency_key";

    protected final ShardedDataSources shards;

    protected JdbcMessageRepository(ShardedDataSources shards) {
        this.shards = shards;
    }

    @Override
    public Message createMessage(CreateMessageRequest request) {
        String channelId = request.channelId();
        String key = request.effectiveIdempotencyKey();

        try (Connection conn = connectionFor(channelId)) {
            if (key != null) {
                Optional<Message> existing = selectByKey(conn, key);
                if (existing.isPresent()) {
                    LOG.debug("Idempotency key {} already stored as message {}", key, existing.get().id());
                    return requireSameChannel(existing.get(), channelId);
                }
            }

            UUID id = UUID.randomUUID();
            int inserted;
            try {
                inserted = insert(conn, id, request, key);
            } catch (SQLException e) {
                if (key == null) {
                    throw e;
                }
                LOG.debug("Insert for idempotency key {} failed ({}), re-reading winner", key, e.getSQLState());
                return rereadWinner(conn, key, channelId, e);
            }

            if (inserted == 0) {
                if (key == null) {
                    throw new TransientException("Message insert affected no rows in channel " + channelId);
                }
                LOG.debug("Insert for idempotency key {} was a no-op, re-reading winner", key);
                return rereadWinner(conn, key, channelId, null);
            }

            Message created = selectById(conn, id, channelId)
                    .orElseThrow(() -> new TransientException("Inserted message " + id + " could not be read back"));
            LOG.debug("Created message {} in channel {}", created.id(), channelId);
            return created;

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "create message in channel " + channelId, LOG);
        }
    }

    @Override
    public Optional<Message> findMessage(String messageId, String channelId) {
        Optional<UUID> id = parseId(messageId);
        if (id.isEmpty()) {
            return Optional.empty();
        }
        try (Connection conn = connectionFor(channelId)) {
            return selectById(conn, id.get(), channelId);
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "find message " + messageId, LOG);
        }
    }

    @Override
    public Optional<Instant> findCreatedAt(String messageId, String channelId) {
        Optional<UUID> id = parseId(messageId);
        if (id.isEmpty()) {
            return Optional.empty();
        }
        try (Connection conn = connectionFor(channelId)) {
            return selectCreatedAt(conn, id.get(), channelId);
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "find creation time of message " + messageId, LOG);
        }
    }

    @Override
    public MessagePage listMessages(String channelId, HistoryFilter filter, int limit) {
        int pageSize = PageLimits.clamp(limit);

        try (Connection conn = connectionFor(channelId)) {
            Instant position = filter.at();
            if (filter.kind() == HistoryFilter.Kind.SINCE_MESSAGE) {
                Optional<UUID> sinceId = parseId(filter.messageId());
                Optional<Instant> sinceTime = sinceId.isPresent()
                        ? selectCreatedAt(conn, sinceId.get(), channelId)
                        : Optional.empty();
                position = sinceTime.orElseThrow(() -> new NotFoundException(
                        "message " + filter.messageId() + " not found in channel " + channelId));
            }

            List<Message> fetched = selectPage(conn, channelId, filter, position, pageSize + 1);
            boolean hasMore = fetched.size() > pageSize;
            List<Message> messages = hasMore ? fetched.subList(0, pageSize) : fetched;

            String nextCursor = null;
            if (hasMore && filter.issuesCursor()) {
                nextCursor = CursorCodec.encode(messages.get(messages.size() - 1).createdAt());
            }

            int total = count(conn, channelId);
            LOG.debug("Listed {} message(s) of channel {} ({}), hasMore={}, total={}",
                    messages.size(), channelId, filter.kind(), hasMore, total);
            return new MessagePage(messages, nextCursor, hasMore, total);

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "list messages of channel " + channelId, LOG);
        }
    }

    @Override
    public int countMessages(String channelId) {
        try (Connection conn = connectionFor(channelId)) {
            return count(conn, channelId);
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "count messages of channel " + channelId, LOG);
        }
    }

    // Idempotency

    /**
     * Resolve a lost insert race by re-reading the row that holds the key. The winner may not be
     * visible yet when its transaction is still committing, so the read is retried a few times.
     */
    private Message rereadWinner(Connection conn, String key, String channelId, SQLException insertFailure)
            throws SQLException {
        for (int attempt = 1; attempt <= REREAD_ATTEMPTS; attempt++) {
            Optional<Message> winner = selectByKey(conn, key);
            if (winner.isPresent()) {
                LOG.debug("Idempotency key {} resolved to message {} on attempt {}", key, winner.get().id(), attempt);
                return requireSameChannel(winner.get(), channelId);
            }
            if (attempt < REREAD_ATTEMPTS) {
                pause();
            }
        }

        String unresolved = "Idempotency key " + key + " conflicted but the stored message could not be read";
        if (insertFailure == null) {
            throw new TransientException(unresolved);
        }
        if (ExceptionTranslator.isUniqueViolation(insertFailure)) {
            throw new TransientException(unresolved, insertFailure);
        }
        throw insertFailure;
    }

    private static Message requireSameChannel(Message message, String channelId) {
        if (!message.channelId().equals(channelId)) {
            throw new InvalidArgumentException("idempotency key is already used by a message in another channel");
        }
        return message;
    }

    private static void pause() {
        try {
            Thread.sleep(REREAD_BACKOFF_MILLIS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientException("Interrupted while resolving idempotency key", e);
        }
    }

    // Statements

    private int insert(Connection conn, UUID id, CreateMessageRequest request, String key) throws SQLException {
        try (PreparedStatement ps = prepare(conn, getInsertMessageSql())) {
            ps.setObject(1, id);
            ps.setString(2, request.channelId());
            ps.setString(3, request.userId());
            ps.setString(4, request.content());
            ps.setString(5, request.effectiveMessageType());
            ps.setString(6, key);
            return ps.executeUpdate();
        }
    }

    private Optional<Message> selectByKey(Connection conn, String key) throws SQLException {
        try (PreparedStatement ps = prepare(conn, getSelectByIdempotencyKeySql())) {
            ps.setString(1, key);
            return selectOne(ps);
        }
    }

    private Optional<Message> selectById(Connection conn, UUID id, String channelId) throws SQLException {
        try (PreparedStatement ps = prepare(conn, getSelectByIdSql())) {
            ps.setObject(1, id);
            ps.setString(2, channelId);
            return selectOne(ps);
        }
    }

    private Optional<Instant> selectCreatedAt(Connection conn, UUID id, String channelId) throws SQLException {
        try (PreparedStatement ps = prepare(conn, getSelectCreatedAtSql())) {
            ps.setObject(1, id);
            ps.setString(2, channelId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(readInstant(rs, "created_at")) : Optional.empty();
            }
        }
    }

    private List<Message> selectPage(Connection conn, String channelId, HistoryFilter filter,
                                     Instant position, int fetchSize) throws SQLException {
        String sql;
        switch (filter.kind()) {
            case LATEST -> sql = getSelectLatestSql();
            case BEFORE -> sql = getSelectBeforeSql();
            default -> sql = getSelectSinceSql();
        }

        try (PreparedStatement ps = prepare(conn, sql)) {
            int index = 1;
            ps.setString(index++, channelId);
            if (filter.kind() != HistoryFilter.Kind.LATEST) {
                ps.setObject(index++, OffsetDateTime.ofInstant(position, ZoneOffset.UTC));
            }
            ps.setInt(index, fetchSize);

            List<Message> messages = new ArrayList<>(fetchSize);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    messages.add(mapMessage(rs));
                }
            }
            return messages;
        }
    }

    private int count(Connection conn, String channelId) throws SQLException {
        try (PreparedStatement ps = prepare(conn, getCountSql())) {
            ps.setString(1, channelId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        }
    }

    private Optional<Message> selectOne(PreparedStatement ps) throws SQLException {
        try (ResultSet rs = ps.executeQuery()) {
            return rs.next() ? Optional.of(mapMessage(rs)) : Optional.empty();
        }
    }

    private Connection connectionFor(String channelId) throws SQLException {
        return shards.router().resolveByChannel(channelId).getConnection();
    }

    /** Prepare a statement bounded by the configured query timeout. */
    private PreparedStatement prepare(Connection conn, String sql) throws SQLException {
        PreparedStatement ps = conn.prepareStatement(sql);
        try {
            ps.setQueryTimeout(shards.config().getQueryTimeoutSeconds());
            return ps;
        } catch (SQLException e) {
            ps.close();
            throw e;
        }
    }

    // Mapping

    protected Message mapMessage(ResultSet rs) throws SQLException {
        return new Message(
                rs.getObject("id", UUID.class).toString(),
                rs.getString("channel_id"),
                rs.getString("user_id"),
                rs.getString("content"),
                rs.getString("message_type"),
                readInstant(rs, "created_at"),
                readInstant(rs, "updated_at"),
                rs.getString("idempotency_key"));
    }

    private static Instant readInstant(ResultSet rs, String column) throws SQLException {
        OffsetDateTime value = rs.getObject(column, OffsetDateTime.class);
        return value == null ? null : value.toInstant();
    }

    /** Message ids are UUIDs; anything else cannot name a stored message. */
    static Optional<UUID> parseId(String messageId) {
        if (messageId == null || messageId.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(UUID.fromString(messageId));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    // Template method for database-specific SQL

    /**
     * Insert of one message. Parameters: id, channel_id, user_id, content, message_type,
     * idempotency_key. Timestamps come from the column defaults. May report 0 rows when the
     * idempotency key already exists.
     */
    protected abstract String getInsertMessageSql();

    // Portable SQL, overridable per dialect

    protected String getSelectByIdempotencyKeySql() {
        return "SELECT " + COLUMNS + " FROM messages WHERE idempotency_key = ?";
    }

    protected String getSelectByIdSql() {
        return "SELECT " + COLUMNS + " FROM messages WHERE id = ? AND channel_id = ?";
    }

    protected String getSelectCreatedAtSql() {
        return "SELECT created_at FROM messages WHERE id = ? AND channel_id = ?";
    }

    protected String getSelectLatestSql() {
        return """
                SELECT %s FROM messages
                WHERE channel_id = ?
                ORDER BY created_at DESC
                LIMIT ?
                """.formatted(COLUMNS);
    }

    protected String getSelectBeforeSql() {
        return """
                SELECT %s FROM messages
                WHERE channel_id = ? AND created_at < ?
                ORDER BY created_at DESC
                LIMIT ?
                """.formatted(COLUMNS);
    }

    protected String getSelectSinceSql() {
        return """
                SELECT %s FROM messages
                WHERE channel_id = ? AND created_at > ?
                ORDER BY created_at ASC
                LIMIT ?
                """.formatted(COLUMNS);
    }

    protected String getCountSql() {
        return "SELECT COUNT(*) FROM messages WHERE channel_id = ?";
    }
}
