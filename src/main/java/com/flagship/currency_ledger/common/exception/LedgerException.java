package com.flagship.currency_ledger.common.exception;

/**
 * Base type for every error the ledger core reports to its callers.
 *
 * Each subclass maps to one distinct, recoverable failure kind. None of them
 * is ever downgraded to a default value by the core; a thrown LedgerException
 * always means the surrounding transaction was rolled back.
 */
public abstract class LedgerException extends RuntimeException {

    private final String code;

    protected LedgerException(String code, String message) {
        super(message);
        this.code = code;
    }

    protected LedgerException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * Whether the caller may retry the same request unchanged.
     */
    public boolean isRetryable() {
        return false;
    }
}
