package de.bsommerfeld.unitupdate.db;

/**
 * Unchecked wrapper for {@link java.sql.SQLException} raised by the
 * repositories. Callers above the persistence layer have no meaningful way
 * to recover from a broken database, so the failure propagates.
 */
public class DatabaseException extends IllegalStateException {

    public DatabaseException(String message, Throwable cause) {
        super(message, cause);
    }
}
