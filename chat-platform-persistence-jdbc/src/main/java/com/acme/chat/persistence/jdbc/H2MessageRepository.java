package com.acme.chat.persistence.jdbc;

import com.acme.chat.config.DatabaseConfig;
import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;

/**
 * H2-specific implementation of MessageRepository. H2 has no conflict clause, so a duplicate
 * idempotency key surfaces as a unique violation that the base class resolves by re-reading.
 */
@Singleton
@Requires(property = "chat.database.dialect", value = DatabaseConfig.DIALECT_H2)
public class H2MessageRepository extends JdbcMessageRepository {

  public H2MessageRepository(ShardedDataSources shards) {
    super(shards);
  }

  @Override
  protected String getInsertMessageSql() {
    return """
        INSERT INTO messages (id, channel_id, user_id, content, message_type, idempotency_key)
        VALUES (?, ?, ?, ?, ?, ?)
        """;
  }
}
