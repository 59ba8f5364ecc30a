package com.flagship.finance_automation.web;

import com.flagship.finance_automation.bank.AccountSourceException;
import com.flagship.finance_automation.pot.PotNotFoundException;
import com.flagship.finance_automation.transfer.DuplicateIntentException;
import com.flagship.finance_automation.transfer.UnknownRecordException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps exceptions to the JSON error shape {@code {error, message, details, timestamp}}.
 *
 * Unknown records and pots are 404, a key that is already taken or a poll
 * already running is 409, malformed input is 400 and a bank that cannot be
 * read is 502.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(UnknownRecordException.class)
    public ResponseEntity<ErrorResponse> handleUnknownRecord(UnknownRecordException e) {
        log.warn("Unknown transfer record: {}", e.getMessage());
        return respond(HttpStatus.NOT_FOUND, "Not Found", e.getMessage(),
                Map.of("idempotencyKey", e.getIdempotencyKey()));
    }

    @ExceptionHandler(PotNotFoundException.class)
    public ResponseEntity<ErrorResponse> handlePotNotFound(PotNotFoundException e) {
        log.warn("Unknown pot: {}", e.getMessage());
        return respond(HttpStatus.NOT_FOUND, "Not Found", e.getMessage(), null);
    }

    @ExceptionHandler(DuplicateIntentException.class)
    public ResponseEntity<ErrorResponse> handleDuplicateIntent(DuplicateIntentException e) {
        log.warn("Duplicate intent: {}", e.getMessage());
        return respond(HttpStatus.CONFLICT, "Duplicate Intent", e.getMessage(), Map.of(
                "idempotencyKey", e.getExisting().getIdempotencyKey(),
                "status", e.getExisting().getStatus().name()));
    }

    @ExceptionHandler(AccountSourceException.class)
    public ResponseEntity<ErrorResponse> handleAccountSource(AccountSourceException e) {
        log.warn("Bank unavailable: {}", e.getMessage());
        return respond(HttpStatus.BAD_GATEWAY, "Bank Unavailable", e.getMessage(), Map.of(
                "bank", String.valueOf(e.getBankRef()),
                "kind", String.valueOf(e.getKind())));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException e) {
        log.warn("Validation failed: {}", e.getMessage());
        Map<String, String> fields = new LinkedHashMap<>();
        e.getBindingResult().getFieldErrors().forEach(fieldError -> fields.putIfAbsent(fieldError.getField(),
                fieldError.getDefaultMessage() != null ? fieldError.getDefaultMessage() : "Invalid value"));
        return respond(HttpStatus.BAD_REQUEST, "Validation Failed", "Request validation failed", fields);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Request", "Request body is missing or malformed", null);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        log.warn("Invalid parameter {}: {}", e.getName(), e.getValue());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Request",
                "Invalid value for parameter '" + e.getName() + "': " + e.getValue(), null);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Invalid argument: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Request", e.getMessage(), null);
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> handleIllegalState(IllegalStateException e) {
        log.warn("Invalid state: {}", e.getMessage());
        return respond(HttpStatus.CONFLICT, "Invalid State", e.getMessage(), null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "An unexpected error occurred", null);
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String error, String message,
                                                         Map<String, String> details) {
        ErrorResponse body = ErrorResponse.builder()
            .error(error)
            .message(message)
            .details(details)
            .timestamp(Instant.now())
            .build();
        return ResponseEntity.status(status).body(body);
    }

    /**
     * Error response DTO.
     */
    @lombok.Value
    @lombok.Builder
    public static class ErrorResponse {
        String error;
        String message;
        Map<String, String> details;
        Instant timestamp;
    }
}
