package com.acme.chat.persistence.jdbc;

import com.acme.chat.core.PermanentException;
import com.acme.chat.core.TransientException;
import org.slf4j.Logger;

import java.sql.SQLException;
import java.util.Locale;

/**
 * Translates {@link SQLException} into the core's storage failures.
 * A failure is either transient (retryable by the caller) or permanent (schema, syntax or data
 * errors that will fail again); anything unrecognised is treated as transient.
 */
public final class ExceptionTranslator {

    /** SQLState of a unique constraint violation, shared by PostgreSQL and H2. */
    static final String UNIQUE_VIOLATION = "23505";

    private ExceptionTranslator() {
        // Utility class - no instantiation
    }

    /**
     * Translates a SQLException to either PermanentException or TransientException.
     *
     * @param originalException The SQLException that occurred
     * @param operation         Description of the operation that failed
     * @param logger            Logger for error reporting
     * @return PermanentException for non-retryable errors, TransientException for everything else
     */
    public static RuntimeException translateException(
            SQLException originalException, String operation, Logger logger) {

        logger.error("Database operation failed: {}", operation, originalException);

        String detail = originalException.getMessage();
        if (isTransientError(originalException)) {
            return new TransientException(
                    String.format("Transient database error during %s: %s", operation, detail),
                    originalException);
        }
        if (isPermanentError(originalException)) {
            return new PermanentException(
                    String.format("Permanent database error during %s: %s", operation, detail),
                    originalException);
        }
        return new TransientException(
                String.format("Database error during %s: %s", operation, detail), originalException);
    }

    /**
     * True when the exception reports a duplicate key. On the message insert path this means the
     * idempotency key already has a row, which the caller re-reads instead of failing.
     */
    public static boolean isUniqueViolation(SQLException exception) {
        return exception != null
                && (UNIQUE_VIOLATION.equals(exception.getSQLState())
                || exception.getErrorCode() == 23505);
    }

    /**
     * Transient errors: connection failures (08xxx), transaction rollbacks such as deadlocks and
     * serialization failures (40xxx), server start-up/shutdown (57P0x), pool exhaustion and
     * timeouts.
     */
    static boolean isTransientError(SQLException exception) {
        String message = lowerMessage(exception);
        if (message.contains("timeout") || message.contains("timed out")
                || message.contains("connection refused") || message.contains("deadlock")
                || message.contains("too many connections") || message.contains("pool exhausted")) {
            return true;
        }

        String sqlState = exception.getSQLState();
        if (sqlState != null
                && (sqlState.startsWith("08") || sqlState.startsWith("40")
                || sqlState.startsWith("57P0") || sqlState.equals("HYT00"))) {
            return true;
        }

        // H2: 90008 general timeout, 50200 lock timeout
        int errorCode = exception.getErrorCode();
        return errorCode == 90008 || errorCode == 50200;
    }

    /**
     * Permanent errors: data exceptions (22xxx), integrity violations (23xxx), syntax errors and
     * missing objects (42xxx), invalid catalog or schema (3Dxxx, 3Fxxx).
     */
    static boolean isPermanentError(SQLException exception) {
        String message = lowerMessage(exception);
        if (message.contains("syntax error") || message.contains("not found")
                || message.contains("does not exist") || message.contains("constraint")
                || message.contains("foreign key") || message.contains("type mismatch")) {
            return true;
        }

        String sqlState = exception.getSQLState();
        if (sqlState != null
                && (sqlState.startsWith("22") || sqlState.startsWith("23") || sqlState.startsWith("42")
                || sqlState.startsWith("3D") || sqlState.startsWith("3F"))) {
            return true;
        }

        // H2: 90002 table not found, 90007 parameter count mismatch, 42122 column not found
        int errorCode = exception.getErrorCode();
        return errorCode == 90002 || errorCode == 90007 || errorCode == 42122;
    }

    private static String lowerMessage(SQLException exception) {
        String message = exception.getMessage();
        return message == null ? "" : message.toLowerCase(Locale.ROOT);
    }
}
