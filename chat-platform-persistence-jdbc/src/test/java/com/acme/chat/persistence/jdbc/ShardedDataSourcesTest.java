package com.acme.chat.persistence.jdbc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.acme.chat.config.DatabaseConfig;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.List;
import javax.sql.DataSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ShardedDataSources lifecycle")
class ShardedDataSourcesTest {

  @Nested
  @DisplayName("Opening pools")
  class OpenTests {

    @Test
    @DisplayName("open should create one healthy pool per shard")
    void testOpenOnePoolPerShard() {
      // Given
      DatabaseConfig config = H2ShardTestBase.h2Config("lifecycle", 4);

      // When
      try (ShardedDataSources shards = ShardedDataSources.open(config)) {
        // Then
        assertThat(shards.shardCount()).isEqualTo(4);
        assertThat(shards.router().shardCount()).isEqualTo(4);
        assertThat(shards.config()).isSameAs(config);
        assertThat(shards.health())
            .hasSize(4)
            .allSatisfy(health -> {
              assertThat(health.healthy()).isTrue();
              assertThat(health.error()).isNull();
            });
      }
    }

    @Test
    @DisplayName("closed pools should refuse connections")
    void testCloseReleasesPools() {
      // Given
      ShardedDataSources shards = ShardedDataSources.open(H2ShardTestBase.h2Config("closing", 2));

      // When
      shards.close();

      // Then
      assertThat(shards.dataSources())
          .allSatisfy(dataSource -> assertThat(((HikariDataSource) dataSource).isClosed()).isTrue());
      assertThatThrownBy(() -> shards.dataSources().get(0).getConnection())
          .isInstanceOf(SQLException.class);
    }

    @Test
    @DisplayName("open should reject a shard count below one")
    void testRejectsZeroShards() {
      DatabaseConfig config = H2ShardTestBase.h2Config("none", 0);

      assertThatThrownBy(() -> ShardedDataSources.open(config))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessageContaining("shard-count");
    }

    @Test
    @DisplayName("open should fail when a shard URL has no driver")
    void testUnreachableShard() {
      // Given
      DatabaseConfig config = H2ShardTestBase.h2Config("unreachable", 2);
      config.setUrlTemplate("jdbc:nosuchdriver://nowhere/chat_{shard}");

      // When & Then
      assertThatThrownBy(() -> ShardedDataSources.open(config)).isInstanceOf(RuntimeException.class);
    }

    @Test
    @DisplayName("pool settings should be taken from the configuration")
    void testHikariConfig() {
      // Given
      DatabaseConfig config = new DatabaseConfig();
      config.setUrlTemplate("jdbc:postgresql://db/chat_{shard}");
      config.setMaximumPoolSize(7);
      config.setMinimumIdle(2);
      config.setConnectionTimeout(Duration.ofSeconds(3));
      config.setIdleTimeout(Duration.ofMinutes(10));
      config.setMaxLifetime(Duration.ofMinutes(20));

      // When
      HikariConfig hikari = ShardedDataSources.hikariConfig(config, 2);

      // Then
      assertThat(hikari.getPoolName()).isEqualTo("chat-shard-2");
      assertThat(hikari.getJdbcUrl()).isEqualTo("jdbc:postgresql://db/chat_2");
      assertThat(hikari.getMaximumPoolSize()).isEqualTo(7);
      assertThat(hikari.getMinimumIdle()).isEqualTo(2);
      assertThat(hikari.getConnectionTimeout()).isEqualTo(3000);
      assertThat(hikari.getIdleTimeout()).isEqualTo(600_000);
      assertThat(hikari.getMaxLifetime()).isEqualTo(1_200_000);
      assertThat(hikari.isAutoCommit()).isTrue();
    }
  }

  @Nested
  @DisplayName("Health and shutdown with mocks")
  class MockTests {

    @Test
    @DisplayName("health should report an unreachable shard without throwing")
    void testHealthReportsFailure() throws SQLException {
      // Given
      DataSource healthy = mock(DataSource.class);
      Connection connection = mock(Connection.class);
      when(healthy.getConnection()).thenReturn(connection);
      when(connection.isValid(10)).thenReturn(true);
      DataSource broken = mock(DataSource.class);
      when(broken.getConnection()).thenThrow(new SQLException("Connection refused", "08001"));

      ShardedDataSources shards = new ShardedDataSources(new DatabaseConfig(), List.of(healthy, broken));

      // When
      List<ShardedDataSources.ShardHealth> health = shards.health();

      // Then
      assertThat(health).containsExactly(
          new ShardedDataSources.ShardHealth(0, true, null),
          new ShardedDataSources.ShardHealth(1, false, "Connection refused"));
    }

    @Test
    @DisplayName("close should attempt every pool and rethrow the first failure")
    void testCloseAttemptsAllPools() {
      // Given
      HikariDataSource first = mock(HikariDataSource.class);
      HikariDataSource second = mock(HikariDataSource.class);
      HikariDataSource third = mock(HikariDataSource.class);
      IllegalStateException firstFailure = new IllegalStateException("first");
      IllegalStateException secondFailure = new IllegalStateException("second");
      doThrow(firstFailure).when(first).close();
      doThrow(secondFailure).when(second).close();

      ShardedDataSources shards = new ShardedDataSources(new DatabaseConfig(), List.of(first, second, third));

      // When & Then
      assertThatThrownBy(shards::close)
          .isSameAs(firstFailure)
          .satisfies(e -> assertThat(e.getSuppressed()).containsExactly(secondFailure));
      verify(first).close();
      verify(second).close();
      verify(third).close();
    }
  }
}
