package com.flagship.currency_ledger.common.exception;

/**
 * An account lock could not be obtained, or the transaction holding it timed out.
 * Nothing was applied; the request is safe to retry as-is.
 */
public class ConcurrencyConflictException extends LedgerException {

    public static final String CODE = "CONCURRENCY_CONFLICT";

    public ConcurrencyConflictException(String message) {
        super(CODE, message);
    }

    public ConcurrencyConflictException(String message, Throwable cause) {
        super(CODE, message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
