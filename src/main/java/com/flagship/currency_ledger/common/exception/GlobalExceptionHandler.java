package com.flagship.currency_ledger.common.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.transaction.TransactionTimedOutException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps ledger errors to HTTP responses.
 *
 * Every error kind keeps its own status and code so clients can surface the
 * specific failure (e.g. "no exchange rate for USD on 2024-01-01") instead of
 * a generic one.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ApiError> handleValidation(ValidationException e) {
        log.warn("Validation failed: {}", e.getMessage());
        return build(HttpStatus.BAD_REQUEST, "Invalid Request", e);
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ApiError> handleNotFound(NotFoundException e) {
        log.warn("Not found: {}", e.getMessage());
        return build(HttpStatus.NOT_FOUND, "Not Found", e);
    }

    @ExceptionHandler(CurrencyMismatchException.class)
    public ResponseEntity<ApiError> handleCurrencyMismatch(CurrencyMismatchException e) {
        log.warn("Currency mismatch: {}", e.getMessage());
        return build(HttpStatus.UNPROCESSABLE_ENTITY, "Currency Mismatch", e);
    }

    @ExceptionHandler(RateUnavailableException.class)
    public ResponseEntity<ApiError> handleRateUnavailable(RateUnavailableException e) {
        log.warn("Rate unavailable: {}", e.getMessage());
        return build(HttpStatus.UNPROCESSABLE_ENTITY, "Rate Unavailable", e);
    }

    @ExceptionHandler(ConcurrencyConflictException.class)
    public ResponseEntity<ApiError> handleConflict(ConcurrencyConflictException e) {
        log.warn("Concurrency conflict: {}", e.getMessage());
        return build(HttpStatus.CONFLICT, "Concurrency Conflict", e);
    }

    /**
     * Lock waits and transaction timeouts that escape the account lock helper,
     * e.g. a timeout raised at commit.
     */
    @ExceptionHandler({PessimisticLockingFailureException.class, QueryTimeoutException.class,
            TransactionTimedOutException.class})
    public ResponseEntity<ApiError> handleLockFailure(RuntimeException e) {
        return handleConflict(new ConcurrencyConflictException(
                "Ledger update could not complete in time, nothing was applied", e));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleBeanValidation(MethodArgumentNotValidException e) {
        log.warn("Request validation failed: {}", e.getMessage());

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
            .code(ValidationException.CODE)
            .message("Request validation failed")
            .details(errors)
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class})
    public ResponseEntity<ApiError> handleMalformedRequest(Exception e) {
        log.warn("Malformed request: {}", e.getMessage());

        ApiError error = ApiError.builder()
            .error("Invalid Request")
            .code(ValidationException.CODE)
            .message(e instanceof HttpMessageNotReadableException
                    ? "Request body could not be parsed"
                    : e.getMessage())
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

    private ResponseEntity<ApiError> build(HttpStatus status, String title, LedgerException e) {
        ApiError error = ApiError.builder()
            .error(title)
            .code(e.getCode())
            .message(e.getMessage())
            .retryable(e.isRetryable())
            .timestamp(Instant.now())
            .build();
        return ResponseEntity.status(status).body(error);
    }
}
