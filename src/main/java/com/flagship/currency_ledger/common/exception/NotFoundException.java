package com.flagship.currency_ledger.common.exception;

import java.util.UUID;

/**
 * Unknown account, payment, transfer, transaction or rate.
 */
public class NotFoundException extends LedgerException {

    public static final String CODE = "NOT_FOUND";

    public NotFoundException(String message) {
        super(CODE, message);
    }

    public static NotFoundException of(String entity, UUID id) {
        return new NotFoundException(entity + " not found: " + id);
    }
}
