package com.sparagne.budget_ledger.api.exception;

import com.sparagne.budget_ledger.exception.ErrorKind;
import com.sparagne.budget_ledger.exception.LedgerException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Global exception handler for REST API.
 *
 * Ledger failures are mapped by {@link ErrorKind} alone; the message and
 * context of the exception are passed through unchanged.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(LedgerException.class)
    public ResponseEntity<ApiError> handleLedgerException(LedgerException e) {
        HttpStatus status = statusOf(e.getKind());
        if (status.is5xxServerError()) {
            log.error("Ledger failure: kind={}, message={}", e.getKind(), e.getMessage(), e);
        } else {
            log.debug("Ledger request rejected: kind={}, message={}", e.getKind(), e.getMessage());
        }

        ApiError error = ApiError.builder()
            .error(status.getReasonPhrase())
            .kind(e.getKind().name())
            .message(status.is5xxServerError() ? "The ledger store is unavailable" : e.getMessage())
            .details(e.getContext())
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(status).body(error);
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ApiError> handleMissingHeader(MissingRequestHeaderException e) {
        log.warn("Missing required header: {}", e.getHeaderName());

        ApiError error = ApiError.builder()
            .error("Missing Required Header")
            .kind(ErrorKind.INVALID_INPUT.name())
            .message("Required header '" + e.getHeaderName() + "' is missing")
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidationException(MethodArgumentNotValidException e) {
        log.warn("Validation failed: {}", e.getMessage());

        Map<String, String> errors = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                error -> error.getField(),
                error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (existing, replacement) -> existing
            ));

        ApiError error = ApiError.builder()
            .error("Validation Failed")
            .kind(ErrorKind.INVALID_INPUT.name())
            .message("Request validation failed")
            .details(errors)
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ApiError> handleUnreadableRequest(Exception e) {
        log.warn("Unreadable request: {}", e.getMessage());

        ApiError error = ApiError.builder()
            .error("Invalid Request")
            .kind(ErrorKind.INVALID_INPUT.name())
            .message("Malformed request")
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGenericException(Exception e) {
        log.error("Unexpected error", e);

        ApiError error = ApiError.builder()
            .error("Internal Server Error")
            .message("An unexpected error occurred")
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    static HttpStatus statusOf(ErrorKind kind) {
        return switch (kind) {
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case UNAUTHORIZED -> HttpStatus.FORBIDDEN;
            case INVALID_AMOUNT, IMMUTABLE, SAME_WALLET, SAME_FLOW, CURRENCY_MISMATCH, MAX_BALANCE_REACHED ->
                HttpStatus.UNPROCESSABLE_ENTITY;
            case INVALID_STATE, ALREADY_VOIDED -> HttpStatus.CONFLICT;
            case INVALID_INPUT -> HttpStatus.BAD_REQUEST;
            case STORE_FAILURE -> HttpStatus.SERVICE_UNAVAILABLE;
        };
    }
}
