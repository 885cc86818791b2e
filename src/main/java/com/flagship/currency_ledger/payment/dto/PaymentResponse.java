package com.flagship.currency_ledger.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.currency_ledger.payment.Payment;
import com.flagship.currency_ledger.payment.PaymentChannel;
import com.flagship.currency_ledger.payment.PaymentType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class PaymentResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("payment_no")
    String paymentNo;

    @JsonProperty("payment_type")
    PaymentType paymentType;

    @JsonProperty("direction")
    PaymentType.Direction direction;

    @JsonProperty("category")
    PaymentType.Category category;

    @JsonProperty("payment_channel")
    PaymentChannel paymentChannel;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("exchange_rate")
    BigDecimal exchangeRate;

    @JsonProperty("base_amount")
    BigDecimal baseAmount;

    @JsonProperty("account_id")
    UUID accountId;

    @JsonProperty("contact_id")
    UUID contactId;

    @JsonProperty("description")
    String description;

    @JsonProperty("reference_no")
    String referenceNo;

    @JsonProperty("payment_date")
    Instant paymentDate;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static PaymentResponse from(Payment payment) {
        return PaymentResponse.builder()
            .id(payment.getId())
            .paymentNo(payment.getPaymentNo())
            .paymentType(payment.getType())
            .direction(payment.getType().getDirection())
            .category(payment.getType().getCategory())
            .paymentChannel(payment.getChannel())
            .amount(payment.getAmount())
            .currency(payment.getCurrency())
            .exchangeRate(payment.getExchangeRate())
            .baseAmount(payment.getBaseAmount())
            .accountId(payment.getAccountId())
            .contactId(payment.getContactId())
            .description(payment.getDescription())
            .referenceNo(payment.getReferenceNo())
            .paymentDate(payment.getPaymentDate())
            .createdAt(payment.getCreatedAt())
            .updatedAt(payment.getUpdatedAt())
            .build();
    }
}
