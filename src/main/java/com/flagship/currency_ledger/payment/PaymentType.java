package com.flagship.currency_ledger.payment;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.flagship.currency_ledger.common.exception.ValidationException;

import java.math.BigDecimal;
import java.util.Arrays;

/**
 * What a payment is, and which way it moves the account balance.
 *
 * The direction alone decides the sign of the balance effect; the category is
 * reporting metadata and never changes the arithmetic.
 */
public enum PaymentType {

    INCOMING("incoming", Direction.INCOMING, Category.STANDARD),
    OUTGOING("outgoing", Direction.OUTGOING, Category.STANDARD),
    INTRA_COMPANY_IN("intra_company_in", Direction.INCOMING, Category.INTRA_COMPANY),
    INTRA_COMPANY_OUT("intra_company_out", Direction.OUTGOING, Category.INTRA_COMPANY),
    INTER_COMPANY_IN("inter_company_in", Direction.INCOMING, Category.INTER_COMPANY),
    INTER_COMPANY_OUT("inter_company_out", Direction.OUTGOING, Category.INTER_COMPANY),
    CURRENCY_PURCHASE("currency_purchase", Direction.INCOMING, Category.CURRENCY_EXCHANGE),
    CURRENCY_SALE("currency_sale", Direction.OUTGOING, Category.CURRENCY_EXCHANGE);

    public enum Direction {
        INCOMING(BigDecimal.ONE, "PMI"),
        OUTGOING(BigDecimal.ONE.negate(), "PMO");

        private final BigDecimal sign;
        private final String documentPrefix;

        Direction(BigDecimal sign, String documentPrefix) {
            this.sign = sign;
            this.documentPrefix = documentPrefix;
        }

        public BigDecimal getSign() {
            return sign;
        }

        public String getDocumentPrefix() {
            return documentPrefix;
        }
    }

    public enum Category {
        STANDARD,
        INTRA_COMPANY,
        INTER_COMPANY,
        CURRENCY_EXCHANGE
    }

    private final String code;
    private final Direction direction;
    private final Category category;

    PaymentType(String code, Direction direction, Category category) {
        this.code = code;
        this.direction = direction;
        this.category = category;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public Direction getDirection() {
        return direction;
    }

    public Category getCategory() {
        return category;
    }

    /**
     * Signed balance effect of {@code amount} paid with this type.
     */
    public BigDecimal signedAmount(BigDecimal amount) {
        return amount.multiply(direction.getSign());
    }

    @JsonCreator
    public static PaymentType fromCode(String code) {
        return Arrays.stream(values())
                .filter(type -> type.code.equalsIgnoreCase(code) || type.name().equalsIgnoreCase(code))
                .findFirst()
                .orElseThrow(() -> new ValidationException("Unknown payment type: " + code));
    }
}
