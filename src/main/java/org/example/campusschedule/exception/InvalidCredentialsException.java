package org.example.campusschedule.exception;

/**
 * Raised for both an unknown email and a wrong password; callers must not be able to tell them apart.
 */
public class InvalidCredentialsException extends RuntimeException {

    public InvalidCredentialsException() {
        super("Invalid credentials");
    }
}
