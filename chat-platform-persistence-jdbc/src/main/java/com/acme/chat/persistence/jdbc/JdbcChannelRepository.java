package com.acme.chat.persistence.jdbc;

import com.acme.chat.domain.Channel;
import com.acme.chat.spi.ChannelDirectory;
import com.acme.chat.spi.MembershipChecker;
import jakarta.inject.Singleton;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Optional;

/**
 * JDBC lookup of channels and their members, routed to the channel's shard. Read-only: channels
 * and memberships are managed elsewhere.
 */
@Singleton
@RequiredArgsConstructor
@Slf4j
public class JdbcChannelRepository implements ChannelDirectory, MembershipChecker {
    private final ShardedDataSources shards;

    @Override
    public Optional<Channel> findChannel(String channelId) {
        log.debug("Finding channel: {}", channelId);

        String sql = """
            SELECT id, name, type, created_by, created_at, updated_at
            FROM channels
            WHERE id = ?
            """;

        try (Connection conn = connectionFor(channelId);
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setQueryTimeout(shards.config().getQueryTimeoutSeconds());
            stmt.setString(1, channelId);

            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapChannel(rs));
                }
            }
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "find channel " + channelId, log);
        }

        return Optional.empty();
    }

    @Override
    public boolean isMember(String channelId, String userId) {
        String sql = "SELECT 1 FROM channel_members WHERE channel_id = ? AND user_id = ?";

        try (Connection conn = connectionFor(channelId);
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setQueryTimeout(shards.config().getQueryTimeoutSeconds());
            stmt.setString(1, channelId);
            stmt.setString(2, userId);

            try (ResultSet rs = stmt.executeQuery()) {
                boolean member = rs.next();
                log.debug("Membership of user {} in channel {}: {}", userId, channelId, member);
                return member;
            }
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(
                e, "check membership of user " + userId + " in channel " + channelId, log);
        }
    }

    private Connection connectionFor(String channelId) throws SQLException {
        return shards.router().resolveByChannel(channelId).getConnection();
    }

    private Channel mapChannel(ResultSet rs) throws SQLException {
        return new Channel(
            rs.getString("id"),
            rs.getString("name"),
            rs.getString("type"),
            rs.getString("created_by"),
            toInstant(rs.getObject("created_at", OffsetDateTime.class)),
            toInstant(rs.getObject("updated_at", OffsetDateTime.class)));
    }

    private static Instant toInstant(OffsetDateTime value) {
        return value == null ? null : value.toInstant();
    }
}
