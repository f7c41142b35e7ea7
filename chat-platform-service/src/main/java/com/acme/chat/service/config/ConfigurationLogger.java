package com.acme.chat.service.config;

import com.acme.chat.config.DatabaseConfig;
import com.acme.chat.config.EventsConfig;
import io.micronaut.context.annotation.Requires;
import io.micronaut.context.env.Environment;
import io.micronaut.context.event.ApplicationEventListener;
import io.micronaut.context.event.StartupEvent;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs effective configuration on application startup for visibility and troubleshooting.
 * Disabled in test environment.
 */
@Singleton
@Requires(notEnv = "test")
public class ConfigurationLogger implements ApplicationEventListener<StartupEvent> {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigurationLogger.class);

    private final DatabaseConfig databaseConfig;
    private final EventsConfig eventsConfig;
    private final Environment environment;

    public ConfigurationLogger(DatabaseConfig databaseConfig, EventsConfig eventsConfig, Environment environment) {
        this.databaseConfig = databaseConfig;
        this.eventsConfig = eventsConfig;
        this.environment = environment;
    }

    @Override
    public void onApplicationEvent(StartupEvent event) {
        LOG.info("═══════════════════════════════════════════════════════════════════════════════");
        LOG.info("                         EFFECTIVE CONFIGURATION                                ");
        LOG.info("═══════════════════════════════════════════════════════════════════════════════");
        LOG.info("");

        LOG.info("━━━ Sharding Configuration ━━━");
        LOG.info("  Dialect:            {} (selects the message repository implementation)", databaseConfig.getDialect());
        LOG.info("  Shard Count:        {} (fixed for the process; changing it re-routes channels)", databaseConfig.getShardCount());
        for (int shard = 0; shard < databaseConfig.getShardCount(); shard++) {
            LOG.info("  Shard {}:            {}", shard, databaseConfig.buildShardUrl(shard));
        }
        LOG.info("  Username:           {} (Database user)", databaseConfig.getUsername());
        LOG.info("  Migrate On Startup: {} (Flyway schema migration per shard)", databaseConfig.isMigrateOnStartup());
        LOG.info("");

        LOG.info("━━━ Pool Configuration (per shard) ━━━");
        LOG.info("  Max Pool Size:      {} (HikariCP maximum connections)", databaseConfig.getMaximumPoolSize());
        LOG.info("  Min Idle:           {} (HikariCP minimum idle connections)", databaseConfig.getMinimumIdle());
        LOG.info("  Connection Timeout: {} (Maximum wait for a pooled connection)", databaseConfig.getConnectionTimeout());
        LOG.info("  Query Timeout:      {} (Maximum duration of one statement)", databaseConfig.getQueryTimeout());
        LOG.info("  Idle Timeout:       {}", databaseConfig.getIdleTimeout());
        LOG.info("  Max Lifetime:       {}", databaseConfig.getMaxLifetime());
        LOG.info("");

        LOG.info("━━━ Event Configuration ━━━");
        LOG.info("  Redis Address:      {}", environment.getProperty("chat.redis.address", String.class).orElse("(not configured, events are logged only)"));
        LOG.info("  Channel Topic:      {} (example topic name)", eventsConfig.buildChannelTopic("{channel}"));
        LOG.info("");

        LOG.info("═══════════════════════════════════════════════════════════════════════════════");
        LOG.info("                      APPLICATION READY FOR TRAFFIC                             ");
        LOG.info("═══════════════════════════════════════════════════════════════════════════════");
    }
}
