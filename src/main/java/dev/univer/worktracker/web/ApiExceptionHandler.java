package dev.univer.worktracker.web;

import dev.univer.worktracker.error.InvalidIdentityException;
import dev.univer.worktracker.error.RosterException;
import dev.univer.worktracker.error.StorageUnavailableException;
import dev.univer.worktracker.error.ValidationFailedException;
import dev.univer.worktracker.web.dto.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(ValidationFailedException.class)
    public ResponseEntity<ErrorResponse> validation(ValidationFailedException e) {
        log.info("Rejected submission: {}", e.getMessage());
        return ResponseEntity.badRequest().body(ErrorResponse.builder()
                .error("validation_failed")
                .detail(e.getMessage())
                .day(e.getDay())
                .field(e.getField())
                .build());
    }

    @ExceptionHandler(InvalidIdentityException.class)
    public ResponseEntity<ErrorResponse> identity(InvalidIdentityException e) {
        return ResponseEntity.badRequest().body(ErrorResponse.builder()
                .error("invalid_identity")
                .detail(e.getMessage())
                .field("user_name")
                .build());
    }

    @ExceptionHandler(StorageUnavailableException.class)
    public ResponseEntity<ErrorResponse> storage(StorageUnavailableException e) {
        log.warn("Storage unavailable: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(ErrorResponse.builder()
                .error("storage_unavailable")
                .detail(e.getMessage())
                .retryable(true)
                .build());
    }

    @ExceptionHandler(RosterException.class)
    public ResponseEntity<ErrorResponse> other(RosterException e) {
        log.error("Unhandled roster failure", e);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(ErrorResponse.builder()
                .error("unavailable")
                .detail(e.getMessage())
                .retryable(e.isRetryable())
                .build());
    }

    @ExceptionHandler({MethodArgumentTypeMismatchException.class, MissingServletRequestParameterException.class})
    public ResponseEntity<ErrorResponse> badParameter(Exception e) {
        return ResponseEntity.badRequest().body(ErrorResponse.builder()
                .error("bad_request")
                .detail("Invalid or missing parameter. Dates use YYYY-MM-DD: " + e.getMessage())
                .build());
    }

    @ExceptionHandler({MethodArgumentNotValidException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<ErrorResponse> badBody(Exception e) {
        return ResponseEntity.badRequest().body(ErrorResponse.builder()
                .error("bad_request")
                .detail("Malformed request body: " + e.getMessage())
                .build());
    }
}
