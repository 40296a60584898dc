package org.example.campusschedule.exception;

/**
 * Unexpected backend error on a live connection.
 */
public class PersistenceException extends StoreException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
