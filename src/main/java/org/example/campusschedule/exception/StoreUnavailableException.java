package org.example.campusschedule.exception;

public class StoreUnavailableException extends StoreException {

    public StoreUnavailableException() {
        super("Database not available");
    }

    public StoreUnavailableException(Throwable cause) {
        super("Database not available", cause);
    }
}
