package com.datapulse.etl.output;

import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;

/**
 * A write or read against a store failed.
 *
 * Record-level failures (a bad value, a violated check constraint) only lose that record.
 * Connection-level failures mean the store is unreachable and the batch is aborted.
 */
public class PersistenceException extends RuntimeException {

    private final boolean connectionLevel;

    public PersistenceException(String message, Throwable cause, boolean connectionLevel) {
        super(message, cause);
        this.connectionLevel = connectionLevel;
    }

    public static PersistenceException from(String operation, DataAccessException e) {
        boolean connection = e instanceof DataAccessResourceFailureException;
        return new PersistenceException(operation + " failed: " + e.getMostSpecificCause().getMessage(), e, connection);
    }

    public boolean isConnectionLevel() {
        return connectionLevel;
    }
}
