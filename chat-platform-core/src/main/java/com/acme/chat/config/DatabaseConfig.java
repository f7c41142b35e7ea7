package com.acme.chat.config;

import java.time.Duration;

/**
 * Connection settings shared by every shard. Pure POJO - no framework dependencies.
 *
 * <p>Each shard gets its own pool built from {@link #buildShardUrl(int)}; the {@code {shard}}
 * placeholder in the URL template is replaced by the shard index. The shard count is fixed for
 * the lifetime of the process: changing it re-routes every channel to a different store.
 */
public class DatabaseConfig {

  public static final String SHARD_PLACEHOLDER = "{shard}";

  /** Dialect names, matched exactly (they also select the repository beans). */
  public static final String DIALECT_H2 = "H2";
  public static final String DIALECT_POSTGRESQL = "PostgreSQL";

  private String dialect = DIALECT_POSTGRESQL;
  private String urlTemplate = "jdbc:postgresql://localhost:5432/chatplatform";
  private int shardCount = 3;
  private String username = "postgres";
  private String password = "postgres";
  private int maximumPoolSize = 25;
  private int minimumIdle = 5;
  private Duration maxLifetime = Duration.ofMinutes(5);
  private Duration idleTimeout = Duration.ofMinutes(30);
  private Duration connectionTimeout = Duration.ofSeconds(5);
  private Duration queryTimeout = Duration.ofSeconds(10);
  private boolean migrateOnStartup = true;

  public String getDialect() {
    return dialect;
  }

  public void setDialect(String dialect) {
    this.dialect = dialect;
  }

  public boolean isH2() {
    return DIALECT_H2.equals(dialect);
  }

  public boolean isKnownDialect() {
    return DIALECT_H2.equals(dialect) || DIALECT_POSTGRESQL.equals(dialect);
  }

  public String getUrlTemplate() {
    return urlTemplate;
  }

  public void setUrlTemplate(String urlTemplate) {
    this.urlTemplate = urlTemplate;
  }

  public int getShardCount() {
    return shardCount;
  }

  public void setShardCount(int shardCount) {
    this.shardCount = shardCount;
  }

  public String getUsername() {
    return username;
  }

  public void setUsername(String username) {
    this.username = username;
  }

  public String getPassword() {
    return password;
  }

  public void setPassword(String password) {
    this.password = password;
  }

  public int getMaximumPoolSize() {
    return maximumPoolSize;
  }

  public void setMaximumPoolSize(int maximumPoolSize) {
    this.maximumPoolSize = maximumPoolSize;
  }

  public int getMinimumIdle() {
    return minimumIdle;
  }

  public void setMinimumIdle(int minimumIdle) {
    this.minimumIdle = minimumIdle;
  }

  public Duration getMaxLifetime() {
    return maxLifetime;
  }

  public void setMaxLifetime(Duration maxLifetime) {
    this.maxLifetime = maxLifetime;
  }

  public Duration getIdleTimeout() {
    return idleTimeout;
  }

  public void setIdleTimeout(Duration idleTimeout) {
    this.idleTimeout = idleTimeout;
  }

  public Duration getConnectionTimeout() {
    return connectionTimeout;
  }

  public void setConnectionTimeout(Duration connectionTimeout) {
    this.connectionTimeout = connectionTimeout;
  }

  public Duration getQueryTimeout() {
    return queryTimeout;
  }

  public void setQueryTimeout(Duration queryTimeout) {
    this.queryTimeout = queryTimeout;
  }

  /** JDBC query timeout in whole seconds, at least 1 so a configured timeout is never "unbounded". */
  public int getQueryTimeoutSeconds() {
    return (int) Math.max(1, queryTimeout.toSeconds());
  }

  public boolean isMigrateOnStartup() {
    return migrateOnStartup;
  }

  public void setMigrateOnStartup(boolean migrateOnStartup) {
    this.migrateOnStartup = migrateOnStartup;
  }

  /**
   * Build the JDBC URL of one shard. Example: jdbc:postgresql://db/chat_{shard} -> jdbc:postgresql://db/chat_2.
   * A template without the placeholder points every shard at the same database.
   */
  public String buildShardUrl(int shardIndex) {
    return urlTemplate.replace(SHARD_PLACEHOLDER, Integer.toString(shardIndex));
  }
}
