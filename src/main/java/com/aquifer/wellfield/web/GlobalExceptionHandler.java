package com.aquifer.wellfield.web;

import com.aquifer.wellfield.exception.InvalidParameterException;
import com.aquifer.wellfield.exception.NumericalDomainException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.LocalDateTime;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * Non-physical input. Client error, logged without stack trace.
     */
    @ExceptionHandler(InvalidParameterException.class)
    public ResponseEntity<Object> handleInvalidParameter(InvalidParameterException ex) {
        log.warn("Invalid parameter: {}", ex.getMessage());
        return badRequest("Invalid Parameter", ex.getMessage());
    }

    /**
     * Kernel argument outside its domain (u <= 0, t <= 0...).
     */
    @ExceptionHandler(NumericalDomainException.class)
    public ResponseEntity<Object> handleNumericalDomain(NumericalDomainException ex) {
        log.warn("Numerical domain error: {}", ex.getMessage());
        return badRequest("Numerical Domain Error", ex.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Object> handleUnreadable(HttpMessageNotReadableException ex) {
        log.warn("Malformed request body: {}", ex.getMostSpecificCause().getMessage());
        return badRequest("Malformed Request", "Request body could not be parsed");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Object> handleGeneralErrors(Exception ex) {
        log.error("Unexpected error while processing request", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.of(
                "timestamp", LocalDateTime.now(),
                "status", 500,
                "error", "Internal Server Error",
                "message", "An unexpected error occurred."
        ));
    }

    private ResponseEntity<Object> badRequest(String error, String message) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(Map.of(
                "timestamp", LocalDateTime.now(),
                "status", 400,
                "error", error,
                "message", message
        ));
    }
}
