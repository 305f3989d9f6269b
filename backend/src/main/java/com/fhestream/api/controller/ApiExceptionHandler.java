package com.fhestream.api.controller;

import com.fhestream.api.dto.ErrorBody;
import com.fhestream.ciphertext.CiphertextNotFoundException;
import com.fhestream.ciphertext.CiphertextStateException;
import com.fhestream.gateway.StreamRequestException;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;

import java.util.Optional;

/**
 * Maps request failures to ErrorBody (error, message, timestamp): validation 400, unknown ciphertext 404,
 * disallowed status transition 409.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorBody> handleValidation(WebExchangeBindException ex) {
        String error = Optional.ofNullable(ex.getFieldError())
                .map(FieldError::getDefaultMessage)
                .filter(msg -> msg != null && !msg.isBlank())
                .orElse("VALIDATION_ERROR");
        String message = userFacingMessage(error, ex);
        return json(HttpStatus.BAD_REQUEST, ErrorBody.of(error, message));
    }

    @ExceptionHandler(StreamRequestException.class)
    public ResponseEntity<ErrorBody> handleStreamRequest(StreamRequestException ex) {
        return json(HttpStatus.BAD_REQUEST, ErrorBody.of(ex.getCode(), ex.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorBody> handleIllegalArgument(IllegalArgumentException ex) {
        return json(HttpStatus.BAD_REQUEST, ErrorBody.of("INVALID_REQUEST", ex.getMessage()));
    }

    @ExceptionHandler(CiphertextNotFoundException.class)
    public ResponseEntity<ErrorBody> handleNotFound(CiphertextNotFoundException ex) {
        return json(HttpStatus.NOT_FOUND, ErrorBody.of("NOT_FOUND", ex.getMessage()));
    }

    @ExceptionHandler(CiphertextStateException.class)
    public ResponseEntity<ErrorBody> handleConflict(CiphertextStateException ex) {
        return json(HttpStatus.CONFLICT, ErrorBody.of("INVALID_STATE", ex.getMessage()));
    }

    // The stream endpoint only produces text/event-stream, so error bodies declare JSON explicitly.
    private static ResponseEntity<ErrorBody> json(HttpStatus status, ErrorBody body) {
        return ResponseEntity.status(status).contentType(MediaType.APPLICATION_JSON).body(body);
    }

    private static String userFacingMessage(String errorCode, WebExchangeBindException ex) {
        return switch (errorCode) {
            case "INVALID_HANDLE" -> "Handle must be 32 bytes of hex";
            case "INVALID_OWNER" -> "Owner is required";
            case "INVALID_SIGNATURE" -> "Transaction signature is required";
            default -> ex.getFieldErrors().stream()
                    .findFirst()
                    .map(e -> e.getField() + ": " + e.getDefaultMessage())
                    .orElse("Validation failed");
        };
    }
}
