package com.acme.chat.service.config;

import com.acme.chat.config.DatabaseConfig;
import com.acme.chat.config.EventsConfig;
import io.micronaut.context.annotation.Factory;
import io.micronaut.context.env.Environment;
import io.micronaut.context.exceptions.ConfigurationException;
import jakarta.inject.Singleton;
import java.time.Duration;

/**
 * Factory for creating core configuration beans.
 *
 * <p>The core module stays free of framework dependencies; its POJOs are populated here from the
 * application.yml {@code chat.database.*} and {@code chat.events.*} properties. Properties that
 * are not set keep the POJO defaults.
 */
@Factory
public class CoreBeansFactory {

  static final String DATABASE = "chat.database.";
  static final String EVENTS = "chat.events.";

  /**
   * Creates DatabaseConfig bean populated from chat.database.* properties. The dialect must be
   * spelled exactly as the repository beans' {@code @Requires} expects.
   */
  @Singleton
  public DatabaseConfig databaseConfig(Environment env) {
    DatabaseConfig config = new DatabaseConfig();
    env.getProperty(DATABASE + "dialect", String.class).ifPresent(config::setDialect);
    env.getProperty(DATABASE + "url-template", String.class).ifPresent(config::setUrlTemplate);
    env.getProperty(DATABASE + "shard-count", Integer.class).ifPresent(config::setShardCount);
    env.getProperty(DATABASE + "username", String.class).ifPresent(config::setUsername);
    env.getProperty(DATABASE + "password", String.class).ifPresent(config::setPassword);
    env.getProperty(DATABASE + "maximum-pool-size", Integer.class).ifPresent(config::setMaximumPoolSize);
    env.getProperty(DATABASE + "minimum-idle", Integer.class).ifPresent(config::setMinimumIdle);
    env.getProperty(DATABASE + "max-lifetime", Duration.class).ifPresent(config::setMaxLifetime);
    env.getProperty(DATABASE + "idle-timeout", Duration.class).ifPresent(config::setIdleTimeout);
    env.getProperty(DATABASE + "connection-timeout", Duration.class).ifPresent(config::setConnectionTimeout);
    env.getProperty(DATABASE + "query-timeout", Duration.class).ifPresent(config::setQueryTimeout);
    env.getProperty(DATABASE + "migrate-on-startup", Boolean.class).ifPresent(config::setMigrateOnStartup);
    if (!config.isKnownDialect()) {
      throw new ConfigurationException(
          "chat.database.dialect must be " + DatabaseConfig.DIALECT_H2 + " or "
              + DatabaseConfig.DIALECT_POSTGRESQL + ", got: " + config.getDialect());
    }
    return config;
  }

  /** Creates EventsConfig bean populated from chat.events.* properties */
  @Singleton
  public EventsConfig eventsConfig(Environment env) {
    EventsConfig config = new EventsConfig();
    env.getProperty(EVENTS + "channel-topic-prefix", String.class).ifPresent(config::setChannelTopicPrefix);
    env.getProperty(EVENTS + "channel-topic-suffix", String.class).ifPresent(config::setChannelTopicSuffix);
    return config;
  }
}
