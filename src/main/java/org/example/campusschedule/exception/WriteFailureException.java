package org.example.campusschedule.exception;

public class WriteFailureException extends PersistenceException {

    public WriteFailureException(String collection, Throwable cause) {
        super("Write to " + collection + " failed: " + cause.getMessage(), cause);
    }
}
