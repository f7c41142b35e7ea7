package com.acme.chat.service.config;

import com.acme.chat.config.DatabaseConfig;
import com.acme.chat.persistence.jdbc.ShardSchemaMigrator;
import com.acme.chat.persistence.jdbc.ShardedDataSources;
import io.micronaut.context.annotation.Bean;
import io.micronaut.context.annotation.Factory;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Opens the per-shard pools once for the application and closes them on shutdown. The schema is
 * migrated before the pools are handed out when {@code chat.database.migrate-on-startup} is set.
 */
@Factory
public class ShardingFactory {
  private static final Logger LOG = LoggerFactory.getLogger(ShardingFactory.class);

  @Singleton
  @Bean(preDestroy = "close")
  public ShardedDataSources shardedDataSources(DatabaseConfig config) {
    ShardedDataSources shards = ShardedDataSources.open(config);
    if (!config.isMigrateOnStartup()) {
      LOG.info("Schema migration on startup disabled");
      return shards;
    }
    try {
      ShardSchemaMigrator.migrate(shards);
    } catch (RuntimeException e) {
      shards.close();
      throw e;
    }
    return shards;
  }
}
