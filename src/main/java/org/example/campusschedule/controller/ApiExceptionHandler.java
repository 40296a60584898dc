package org.example.campusschedule.controller;

import lombok.extern.slf4j.Slf4j;
import org.example.campusschedule.dto.response.ErrorResponse;
import org.example.campusschedule.exception.ClientValidationException;
import org.example.campusschedule.exception.DuplicateDocumentException;
import org.example.campusschedule.exception.DuplicateEmailException;
import org.example.campusschedule.exception.InvalidCredentialsException;
import org.example.campusschedule.exception.NotFoundException;
import org.example.campusschedule.exception.PersistenceException;
import org.example.campusschedule.exception.StoreUnavailableException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Maps service exceptions to status codes. Bodies carry a short {@code detail};
 * stack traces and stored values never reach the client.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    static final int MAX_DETAIL_CHARS = 120;

    @ExceptionHandler(ClientValidationException.class)
    public ResponseEntity<ErrorResponse> clientValidation(ClientValidationException ex) {
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(new ErrorResponse("Validation failed", ex.getErrors()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> invalidBody(MethodArgumentNotValidException ex) {
        List<String> errors = ex.getBindingResult().getFieldErrors().stream()
                .map(e -> e.getField() + ": " + e.getDefaultMessage())
                .sorted()
                .collect(Collectors.toList());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(new ErrorResponse("Validation failed", errors));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> unreadableBody(HttpMessageNotReadableException ex) {
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(new ErrorResponse("Malformed request body"));
    }

    @ExceptionHandler(DuplicateEmailException.class)
    public ResponseEntity<ErrorResponse> duplicateEmail(DuplicateEmailException ex) {
        return ResponseEntity.badRequest().body(new ErrorResponse(ex.getMessage()));
    }

    @ExceptionHandler(InvalidCredentialsException.class)
    public ResponseEntity<ErrorResponse> invalidCredentials(InvalidCredentialsException ex) {
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(new ErrorResponse(ex.getMessage()));
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> notFound(NotFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(new ErrorResponse(ex.getMessage()));
    }

    @ExceptionHandler(DuplicateDocumentException.class)
    public ResponseEntity<ErrorResponse> duplicateDocument(DuplicateDocumentException ex) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(new ErrorResponse(ex.getMessage()));
    }

    @ExceptionHandler(StoreUnavailableException.class)
    public ResponseEntity<ErrorResponse> storeUnavailable(StoreUnavailableException ex) {
        log.warn("Request rejected, store unavailable: {}",
                ex.getCause() == null ? "disabled" : ex.getCause().getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(new ErrorResponse(ex.getMessage()));
    }

    @ExceptionHandler(PersistenceException.class)
    public ResponseEntity<ErrorResponse> persistence(PersistenceException ex) {
        log.error("Store operation failed", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(new ErrorResponse(truncate(ex.getMessage())));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> unexpected(Exception ex) {
        // framework errors (unknown path, wrong method) keep their own status
        if (ex instanceof org.springframework.web.ErrorResponse) {
            org.springframework.web.ErrorResponse framework = (org.springframework.web.ErrorResponse) ex;
            return ResponseEntity.status(framework.getStatusCode())
                    .body(new ErrorResponse(framework.getBody().getTitle()));
        }
        log.error("Unhandled exception", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(new ErrorResponse("Internal server error"));
    }

    static String truncate(String message) {
        if (message == null) {
            return "Internal server error";
        }
        return message.length() <= MAX_DETAIL_CHARS ? message : message.substring(0, MAX_DETAIL_CHARS);
    }
}
