package com.flagship.gold_ledger.exception;

import org.springframework.dao.DataIntegrityViolationException;

import java.sql.SQLException;

/**
 * Tells unique-key collisions apart from the other integrity failures PostgreSQL reports
 * (oversized values, check constraints, nulls).
 */
public final class IntegrityViolations {

    static final String UNIQUE_VIOLATION = "23505";

    private IntegrityViolations() {
    }

    public static boolean isUniqueViolation(DataIntegrityViolationException e) {
        return UNIQUE_VIOLATION.equals(sqlState(e));
    }

    /**
     * Maps a non-unique integrity failure to a client error naming the database's reason.
     */
    public static IllegalArgumentException rejected(String what, DataIntegrityViolationException e) {
        return new IllegalArgumentException(
            String.format("%s rejected by storage: %s", what, e.getMostSpecificCause().getMessage()), e);
    }

    static String sqlState(Throwable e) {
        for (Throwable cause = e; cause != null; cause = cause.getCause()) {
            if (cause instanceof SQLException && ((SQLException) cause).getSQLState() != null) {
                return ((SQLException) cause).getSQLState();
            }
            if (cause.getCause() == cause) {
                break;
            }
        }
        return null;
    }
}
