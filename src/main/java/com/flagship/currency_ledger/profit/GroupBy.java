package com.flagship.currency_ledger.profit;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.flagship.currency_ledger.common.exception.ValidationException;

import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Function;

/**
 * Grouping keys of the profit/loss report. Lines without a contact group under {@code "none"}.
 */
public enum GroupBy {

    PRODUCT(line -> Objects.toString(line.getProductId(), "none")),
    CONTACT(line -> Objects.toString(line.getContactId(), "none")),
    COMPANY(line -> Objects.toString(line.getCompanyId(), "none")),
    DATE(line -> Objects.toString(line.getTransactionDate(), "none"));

    private final Function<ProfitLine, String> keyExtractor;

    GroupBy(Function<ProfitLine, String> keyExtractor) {
        this.keyExtractor = keyExtractor;
    }

    public String keyOf(ProfitLine line) {
        return keyExtractor.apply(line);
    }

    @JsonValue
    public String getCode() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static GroupBy fromCode(String code) {
        return Arrays.stream(values())
                .filter(groupBy -> groupBy.name().equalsIgnoreCase(code))
                .findFirst()
                .orElseThrow(() -> new ValidationException("Unknown grouping: " + code));
    }
}
