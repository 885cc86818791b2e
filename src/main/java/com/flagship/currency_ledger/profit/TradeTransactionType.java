package com.flagship.currency_ledger.profit;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.flagship.currency_ledger.common.exception.ValidationException;

import java.util.Arrays;
import java.util.Locale;

public enum TradeTransactionType {

    SALE("SLS"),
    PURCHASE("PRC"),
    SALE_RETURN("SLR"),
    PURCHASE_RETURN("PRR");

    private final String documentPrefix;

    TradeTransactionType(String documentPrefix) {
        this.documentPrefix = documentPrefix;
    }

    public String getDocumentPrefix() {
        return documentPrefix;
    }

    @JsonValue
    public String getCode() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static TradeTransactionType fromCode(String code) {
        return Arrays.stream(values())
                .filter(type -> type.name().equalsIgnoreCase(code))
                .findFirst()
                .orElseThrow(() -> new ValidationException("Unknown transaction type: " + code));
    }
}
