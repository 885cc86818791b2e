package com.flagship.currency_ledger.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.currency_ledger.payment.PaymentChannel;
import com.flagship.currency_ledger.payment.PaymentCommand;
import com.flagship.currency_ledger.payment.PaymentType;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class CreatePaymentRequest {

    @NotNull(message = "Payment type is required")
    @JsonProperty("payment_type")
    PaymentType paymentType;

    @NotNull(message = "Payment channel is required")
    @JsonProperty("payment_channel")
    PaymentChannel paymentChannel;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0", inclusive = false, message = "Amount must be greater than 0")
    @JsonProperty("amount")
    BigDecimal amount;

    @NotBlank(message = "Currency is required")
    @Pattern(regexp = "^[A-Za-z]{3,10}$", message = "Currency must be a 3 to 10 letter code")
    @JsonProperty("currency")
    String currency;

    @NotNull(message = "Account ID is required")
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
