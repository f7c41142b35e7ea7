package com.acme.chat.persistence.jdbc;

import com.acme.chat.config.DatabaseConfig;
import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;

/**
 * PostgreSQL-specific implementation of MessageRepository
 */
@Singleton
@Requires(
    property = "chat.database.dialect",
    value = DatabaseConfig.DIALECT_POSTGRESQL,
    defaultValue = DatabaseConfig.DIALECT_POSTGRESQL)
public class PostgresMessageRepository extends JdbcMessageRepository {

    public PostgresMessageRepository(ShardedDataSources shards) {
        super(shards);
    }

    @Override
    protected String getInsertMessageSql() {
        return """
                INSERT INTO messages (id, channel_id, user_id, content, message_type, idempotency_key)
                VALUES (?, ?, ?, ?, ?, ?)
                ON CONFLICT (idempotency_key) DO NOTHING
                """;
    }
}
