package com.ivamare.requestqueue.exception;

import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.jdbc.CannotGetJdbcConnectionException;

import java.sql.SQLException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientException;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Classifies storage exceptions raised by the persisted request queue.
 *
 * <p>The sequential queue uses this to decide whether a failed drain pass is
 * a temporary outage (back off and try again quietly) or a defect that should
 * be logged loudly.
 *
 * @see <a href="https://www.postgresql.org/docs/current/errcodes-appendix.html">PostgreSQL Error Codes</a>
 */
public final class DatabaseExceptionClassifier {

    private static final String UNKNOWN = "Unknown";

    private DatabaseExceptionClassifier() {
    }

    /**
     * Connection (08), insufficient resources (53), operator intervention (57)
     * and transaction rollback (40) states.
     */
    private static final Set<String> TRANSIENT_SQL_STATES = Set.of(
        "08000", "08001", "08003", "08004", "08006", "08007", "08P01",
        "53000", "53100", "53200", "53300",
        "57P01", "57P02", "57P03", "57P04",
        "40001", "40002", "40003", "40P01"
    );

    private static final List<String> TRANSIENT_MESSAGE_PATTERNS = List.of(
        "connection refused",
        "connection reset",
        "connection timed out",
        "socket timeout",
        "read timed out",
        "connection is not available",
        "pool exhausted",
        "connection closed",
        "broken pipe",
        "terminating connection",
        "could not connect to server",
        "the database system is starting up",
        "the database system is shutting down"
    );

    /**
     * Determine if the exception is a temporary storage condition.
     *
     * @param ex the exception to classify
     * @return true if retrying later may succeed
     */
    public static boolean isTransient(Throwable ex) {
        return !UNKNOWN.equals(getTransientReason(ex));
    }

    /**
     * Describe why the exception was classified as transient, for logging.
     *
     * @param ex the exception to describe
     * @return the reason, or "Unknown" if not transient
     */
    public static String getTransientReason(Throwable ex) {
        Throwable current = ex;
        // Bounded walk of the cause chain
        for (int depth = 0; current != null && depth < 16; depth++) {
            String reason = directReason(current);
            if (reason != null) {
                return reason;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return UNKNOWN;
    }

    private static String directReason(Throwable ex) {
        if (ex instanceof CannotGetJdbcConnectionException
                || ex instanceof TransientDataAccessException
                || ex instanceof RecoverableDataAccessException
                || ex instanceof DataAccessResourceFailureException) {
            return "Spring " + ex.getClass().getSimpleName();
        }
        if (ex instanceof SQLTransientException
                || ex instanceof SQLRecoverableException
                || ex instanceof SQLNonTransientConnectionException) {
            return "JDBC " + ex.getClass().getSimpleName();
        }
        if (ex instanceof SQLException sqlEx) {
            String sqlState = sqlEx.getSQLState();
            if (sqlState != null && TRANSIENT_SQL_STATES.contains(sqlState)) {
                return "SQL state " + sqlState;
            }
        }
        String message = ex.getMessage();
        if (message != null) {
            String lowerMessage = message.toLowerCase(Locale.ROOT);
            for (String pattern : TRANSIENT_MESSAGE_PATTERNS) {
                if (lowerMessage.contains(pattern)) {
                    return "Message pattern: " + pattern;
                }
            }
        }
        return null;
    }
}
