package org.example.campusschedule.exception;

import java.util.List;

/**
 * Malformed or missing client input, detected before any store call.
 */
public class ClientValidationException extends RuntimeException {

    private final List<String> errors;

    public ClientValidationException(String target, List<String> errors) {
        super("Invalid " + target + ": " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
