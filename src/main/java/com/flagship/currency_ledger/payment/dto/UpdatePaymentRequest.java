package com.flagship.currency_ledger.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.currency_ledger.payment.PaymentChannel;
import com.flagship.currency_ledger.payment.PaymentCommand;
import com.flagship.currency_ledger.payment.PaymentType;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Partial update; omitted fields keep their stored values.
 */
@Value
public class UpdatePaymentRequest {

    @JsonProperty("payment_type")
    PaymentType paymentType;

    @JsonProperty("payment_channel")
    PaymentChannel paymentChannel;

    @DecimalMin(value = "0", inclusive = false, message = "Amount must be greater than 0")
    @JsonProperty("amount")
    BigDecimal amount;

    @Pattern(regexp = "^[A-Za-z]{3,10}$", message = "Currency must be a 3 to 10 letter code")
    @JsonProperty("currency")
    String currency;

    @JsonProperty("account_id")
    UUID accountId;

    @JsonProperty("contact_id")
    UUID contactId;

    @DecimalMin(value = "0", inclusive = false, message = "Exchange rate must be positive")
    @JsonProperty("exchange_rate")
    BigDecimal exchangeRate;

    @JsonProperty("description")
    String description;

    @Size(max = 100)
    @JsonProperty("reference_no")
    String referenceNo;

    @JsonProperty("payment_date")
    Instant paymentDate;

    public PaymentCommand toCommand() {
        return PaymentCommand.builder()
            .type(paymentType)
            .channel(paymentChannel)
            .amount(amount)
            .currency(currency)
            .accountId(accountId)
            .contactId(contactId)
            .exchangeRate(exchangeRate)
            .description(description)
            .referenceNo(referenceNo)
            .paymentDate(paymentDate)
            .build();
    }
}
