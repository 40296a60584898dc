package org.example.campusschedule.exception;

public class DuplicateEmailException extends RuntimeException {

    public DuplicateEmailException(Throwable cause) {
        super("Email already registered", cause);
    }
}
