package com.flagship.currency_ledger.transfer.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.currency_ledger.transfer.Transfer;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class TransferResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("transfer_no")
    String transferNo;

    @JsonProperty("from_account_id")
    UUID fromAccountId;

    @JsonProperty("to_account_id")
    UUID toAccountId;

    @JsonProperty("from_amount")
    BigDecimal fromAmount;

    @JsonProperty("to_amount")
    BigDecimal toAmount;

    @JsonProperty("exchange_rate")
    BigDecimal exchangeRate;

    @JsonProperty("description")
    String description;

    @JsonProperty("reference_no")
    String referenceNo;

    @JsonProperty("transfer_date")
    Instant transferDate;

    @JsonProperty("created_at")
    Instant createdAt;

    public static TransferResponse from(Transfer transfer) {
        return TransferResponse.builder()
            .id(transfer.getId())
            .transferNo(transfer.getTransferNo())
            .fromAccountId(transfer.getFromAccountId())
            .toAccountId(transfer.getToAccountId())
            .fromAmount(transfer.getFromAmount())
            .toAmount(transfer.getToAmount())
            .exchangeRate(transfer.getExchangeRate())
            .description(transfer.getDescription())
            .referenceNo(transfer.getReferenceNo())
            .transferDate(transfer.getTransferDate())
            .createdAt(transfer.getCreatedAt())
            .build();
    }
}
