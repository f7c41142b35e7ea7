package com.acme.chat.persistence.jdbc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.acme.chat.config.DatabaseConfig;
import com.acme.chat.core.InvalidArgumentException;
import com.acme.chat.core.PermanentException;
import com.acme.chat.core.TransientException;
import com.acme.chat.domain.CreateMessageRequest;
import com.acme.chat.domain.Message;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;
import javax.sql.DataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Mock-based tests for the insert-race branches of JdbcMessageRepository.
 * Uses Mockito to simulate the PostgreSQL "no row inserted" outcome and failures that are hard
 * to trigger against a real database.
 */
@DisplayName("JdbcMessageRepository Mock-Based Branch Coverage Tests")
class JdbcMessageRepositoryMockTest {

  private static final String WINNER_ID = "7f1c7c6e-3f7a-4a57-9a63-2d3f2f0c9b11";

  private DataSource dataSource;
  private Connection connection;
  private PreparedStatement insertPs;
  private PreparedStatement selectPs;
  private JdbcMessageRepository repository;

  @BeforeEach
  void setUp() throws SQLException {
    dataSource = mock(DataSource.class);
    connection = mock(Connection.class);
    insertPs = mock(PreparedStatement.class);
    selectPs = mock(PreparedStatement.class);

    when(dataSource.getConnection()).thenReturn(connection);
    when(connection.prepareStatement(anyString())).thenAnswer(invocation -> {
      String sql = invocation.getArgument(0);
      return sql.trim().startsWith("INSERT") ? insertPs : selectPs;
    });

    DatabaseConfig config = new DatabaseConfig();
    config.setQueryTimeout(Duration.ofSeconds(7));
    repository = new PostgresMessageRepository(new ShardedDataSources(config, List.of(dataSource)));
  }

  private static ResultSet emptyResultSet() throws SQLException {
    ResultSet rs = mock(ResultSet.class);
    when(rs.next()).thenReturn(false);
    return rs;
  }

  private static ResultSet winnerResultSet(String channelId) throws SQLException {
    OffsetDateTime at = OffsetDateTime.of(2024, 1, 1, 0, 0, 0, 0, ZoneOffset.UTC);
    ResultSet rs = mock(ResultSet.class);
    when(rs.next()).thenReturn(true);
    when(rs.getObject("id", UUID.class)).thenReturn(UUID.fromString(WINNER_ID));
    when(rs.getString("channel_id")).thenReturn(channelId);
    when(rs.getString("user_id")).thenReturn("alice");
    when(rs.getString("content")).thenReturn("first");
    when(rs.getString("message_type")).thenReturn("text");
    when(rs.getObject("created_at", OffsetDateTime.class)).thenReturn(at);
    when(rs.getObject("updated_at", OffsetDateTime.class)).thenReturn(at);
    when(rs.getString("idempotency_key")).thenReturn("k1");
    return rs;
  }

  private Message sendWithKey() {
    return repository.createMessage(new CreateMessageRequest("C1", "alice", "second", "k1"));
  }

  @Nested
  @DisplayName("Conflict resolution")
  class ConflictTests {

    @Test
    @DisplayName("zero rows inserted should resolve to the winner re-read by key")
    void testNoRowInsertedReturnsWinner() throws SQLException {
      // Given: key not visible at pre-check, conflict on insert, winner visible afterwards
      ResultSet empty = emptyResultSet();
      ResultSet winner = winnerResultSet("C1");
      when(selectPs.executeQuery()).thenReturn(empty, winner);
      when(insertPs.executeUpdate()).thenReturn(0);

      // When
      Message result = sendWithKey();

      // Then
      assertThat(result.id()).isEqualTo(WINNER_ID);
      assertThat(result.content()).isEqualTo("first");
      verify(selectPs, times(2)).executeQuery();
    }

    @Test
    @DisplayName("a winner that never becomes visible should raise a transient failure")
    void testUnresolvedConflict() throws SQLException {
      // Given
      ResultSet empty = emptyResultSet();
      when(selectPs.executeQuery()).thenReturn(empty);
      when(insertPs.executeUpdate()).thenReturn(0);

      // When & Then
      assertThatThrownBy(this::send)
          .isInstanceOf(TransientException.class)
          .hasMessageContaining("k1");
      verify(selectPs, times(1 + JdbcMessageRepository.REREAD_ATTEMPTS)).executeQuery();
    }

    @Test
    @DisplayName("a unique violation should resolve to the winner re-read by key")
    void testUniqueViolationReturnsWinner() throws SQLException {
      // Given
      ResultSet empty = emptyResultSet();
      ResultSet winner = winnerResultSet("C1");
      when(selectPs.executeQuery()).thenReturn(empty, empty, winner);
      when(insertPs.executeUpdate()).thenThrow(new SQLException("duplicate key", "23505"));

      // When
      Message result = sendWithKey();

      // Then
      assertThat(result.id()).isEqualTo(WINNER_ID);
      verify(selectPs, times(3)).executeQuery();
    }

    @Test
    @DisplayName("an unresolved unique violation should be transient and keep the cause")
    void testUnresolvedUniqueViolation() throws SQLException {
      // Given
      SQLException duplicate = new SQLException("duplicate key", "23505");
      ResultSet empty = emptyResultSet();
      when(selectPs.executeQuery()).thenReturn(empty);
      when(insertPs.executeUpdate()).thenThrow(duplicate);

      // When & Then
      assertThatThrownBy(this::send)
          .isInstanceOf(TransientException.class)
          .hasCause(duplicate);
    }

    @Test
    @DisplayName("any other insert failure should be translated once the re-read finds nothing")
    void testOtherInsertFailureTranslated() throws SQLException {
      // Given
      ResultSet empty = emptyResultSet();
      when(selectPs.executeQuery()).thenReturn(empty);
      when(insertPs.executeUpdate()).thenThrow(new SQLException("relation does not exist", "42P01"));

      // When & Then
      assertThatThrownBy(this::send).isInstanceOf(PermanentException.class);
    }

    @Test
    @DisplayName("a winner stored in another channel should be rejected")
    void testWinnerInOtherChannel() throws SQLException {
      // Given
      ResultSet empty = emptyResultSet();
      ResultSet winner = winnerResultSet("C9");
      when(selectPs.executeQuery()).thenReturn(empty, winner);
      when(insertPs.executeUpdate()).thenReturn(0);

      // When & Then
      assertThatThrownBy(this::send).isInstanceOf(InvalidArgumentException.class);
    }

    private void send() {
      sendWithKey();
    }
  }

  @Nested
  @DisplayName("Failures and resources")
  class FailureTests {

    @Test
    @DisplayName("pool timeout should surface as a transient failure")
    void testConnectionTimeout() throws SQLException {
      // Given
      when(dataSource.getConnection())
          .thenThrow(new SQLException("Connection is not available, request timed out", "08001"));

      // When & Then
      assertThatThrownBy(() -> repository.countMessages("C1")).isInstanceOf(TransientException.class);
    }

    @Test
    @DisplayName("an insert without a key should not re-read on failure")
    void testFailureWithoutKey() throws SQLException {
      // Given
      when(insertPs.executeUpdate()).thenThrow(new SQLException("Connection reset", "08006"));

      // When & Then
      assertThatThrownBy(() -> repository.createMessage(new CreateMessageRequest("C1", "alice", "hi", null)))
          .isInstanceOf(TransientException.class);
      verify(selectPs, never()).executeQuery();
    }

    @Test
    @DisplayName("statements should carry the configured query timeout and be closed")
    void testQueryTimeoutAndClose() throws SQLException {
      // Given
      ResultSet rs = mock(ResultSet.class);
      when(rs.next()).thenReturn(true);
      when(rs.getInt(1)).thenReturn(4);
      when(selectPs.executeQuery()).thenReturn(rs);

      // When
      int count = repository.countMessages("C1");

      // Then
      assertThat(count).isEqualTo(4);
      verify(selectPs).setQueryTimeout(7);
      verify(selectPs).close();
      verify(rs).close();
      verify(connection).close();
    }

    @Test
    @DisplayName("a statement whose timeout cannot be set should be closed")
    void testPrepareFailureClosesStatement() throws SQLException {
      // Given
      doThrow(new SQLException("not supported", "0A000"))
          .when(selectPs).setQueryTimeout(anyInt());

      // When & Then
      assertThatThrownBy(() -> repository.countMessages("C1")).isInstanceOf(RuntimeException.class);
      verify(selectPs).close();
      verify(connection).close();
    }
  }
}
