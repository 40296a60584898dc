package org.example.campusschedule.exception;

public class ReadFailureException extends PersistenceException {

    public ReadFailureException(String collection, Throwable cause) {
        super("Read from " + collection + " failed: " + cause.getMessage(), cause);
    }
}
