package com.flagship.currency_ledger.payment;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.flagship.currency_ledger.common.exception.ValidationException;

import java.util.Arrays;

public enum PaymentChannel {
    CASH("cash"),
    BANK_TRANSFER("bank_transfer"),
    CREDIT_CARD("credit_card"),
    PAYTR("paytr"),
    GPAY("gpay"),
    CRYPTO("crypto"),
    ADVANCE("advance"),
    OTHER("other");

    private final String code;

    PaymentChannel(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static PaymentChannel fromCode(String code) {
        return Arrays.stream(values())
                .filter(channel -> channel.code.equalsIgnoreCase(code) || channel.name().equalsIgnoreCase(code))
                .findFirst()
                .orElseThrow(() -> new ValidationException("Unknown payment channel: " + code));
    }
}
