package com.flagship.currency_ledger.common.exception;

/**
 * Non-positive amount, missing required field, same-account transfer,
 * invalid or expired confirmation token.
 */
public class ValidationException extends LedgerException {

    public static final String CODE = "VALIDATION_ERROR";

    public ValidationException(String message) {
        super(CODE, message);
    }
}
