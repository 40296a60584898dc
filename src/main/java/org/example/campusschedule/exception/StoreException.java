package org.example.campusschedule.exception;

/**
 * Base type for failures raised by the document store adapter.
 */
public abstract class StoreException extends RuntimeException {

    protected StoreException(String message) {
        super(message);
    }

    protected StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
