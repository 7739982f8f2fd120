package com.acme.cqrs.persistence.jdbc;

import com.acme.cqrs.core.PermanentException;
import com.acme.cqrs.core.PersistenceException;
import java.sql.SQLException;
import java.util.Locale;
import java.util.Set;
import org.slf4j.Logger;

/**
 * Maps {@link SQLException}s raised by the JDBC stores onto the platform's exception roots.
 * Connection problems, rollbacks and lock timeouts become a retryable {@link PersistenceException};
 * schema, syntax and data errors become a {@link PermanentException}. Unclassified errors are
 * treated as retryable.
 */
public final class ExceptionTranslator {

    /** SQLState of a unique constraint violation, shared by H2 and PostgreSQL. */
    public static final String UNIQUE_VIOLATION = "23505";

    private static final Set<String> TRANSIENT_STATE_CLASSES = Set.of("08", "40", "53", "57");
    private static final Set<String> PERMANENT_STATE_CLASSES = Set.of("22", "23", "42", "3D", "3F");

    // vendor codes: PostgreSQL serialization failure / connection failures, H2 lock timeout
    private static final Set<Integer> TRANSIENT_VENDOR_CODES = Set.of(40001, 8003, 8006, 50200);
    // vendor codes: H2 table / column not found, parameter mismatch; PostgreSQL undefined column
    private static final Set<Integer> PERMANENT_VENDOR_CODES = Set.of(42102, 42122, 90007, 42703);

    private static final String[] TRANSIENT_HINTS = {
        "timeout", "timed out", "connection refused", "connection is closed", "deadlock",
        "too many connections", "pool exhausted"
    };
    private static final String[] PERMANENT_HINTS = {
        "syntax error", "not found", "does not exist", "constraint violation", "type mismatch",
        "invalid column", "value too long"
    };

    private ExceptionTranslator() {
    }

    /**
     * Logs the failure and returns the exception to throw in its place.
     *
     * @param operation what the store was doing, used in the message
     */
    public static RuntimeException translate(SQLException e, String operation, Logger logger) {
        logger.error("Database operation failed: {}", operation, e);
        String message = String.format("%s failed: %s", operation, e.getMessage());
        if (isTransient(e)) {
            return new PersistenceException(message, e);
        }
        if (isPermanent(e)) {
            return new PermanentException(message, e);
        }
        return new PersistenceException(message, e);
    }

    /** True when the exception, or one chained or nested in it, reports a duplicate key. */
    public static boolean isUniqueViolation(SQLException e) {
        for (SQLException current = e; current != null; current = current.getNextException()) {
            if (UNIQUE_VIOLATION.equals(current.getSQLState())) {
                return true;
            }
            if (current.getCause() instanceof SQLException
                    && UNIQUE_VIOLATION.equals(((SQLException) current.getCause()).getSQLState())) {
                return true;
            }
        }
        return false;
    }

    static boolean isTransient(SQLException e) {
        return stateClassIn(e, TRANSIENT_STATE_CLASSES)
                || TRANSIENT_VENDOR_CODES.contains(e.getErrorCode())
                || messageContains(e, TRANSIENT_HINTS);
    }

    static boolean isPermanent(SQLException e) {
        return stateClassIn(e, PERMANENT_STATE_CLASSES)
                || PERMANENT_VENDOR_CODES.contains(e.getErrorCode())
                || messageContains(e, PERMANENT_HINTS);
    }

    private static boolean stateClassIn(SQLException e, Set<String> classes) {
        String state = e.getSQLState();
        return state != null && state.length() >= 2 && classes.contains(state.substring(0, 2));
    }

    private static boolean messageContains(SQLException e, String[] hints) {
        if (e.getMessage() == null) {
            return false;
        }
        String message = e.getMessage().toLowerCase(Locale.ROOT);
        for (String hint : hints) {
            if (message.contains(hint)) {
                return true;
            }
        }
        return false;
    }
}
