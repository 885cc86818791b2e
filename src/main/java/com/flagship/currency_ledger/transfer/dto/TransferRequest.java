package com.flagship.currency_ledger.transfer.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.currency_ledger.transfer.TransferCommand;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class TransferRequest {

    @NotNull(message = "Source account ID is required")
    @JsonProperty("from_account_id")
    UUID fromAccountId;

    @NotNull(message = "Target account ID is required")
    @JsonProperty("to_account_id")
    UUID toAccountId;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0", inclusive = false, message = "Amount must be greater than 0")
    @JsonProperty("from_amount")
    BigDecimal fromAmount;

    @DecimalMin(value = "0", inclusive = false, message = "Target amount must be greater than 0")
    @JsonProperty("to_amount")
    BigDecimal toAmount;

    @DecimalMin(value = "0", inclusive = false, message = "Exchange rate must be positive")
    @JsonProperty("exchange_rate")
    BigDecimal exchangeRate;

    @JsonProperty("description")
    String description;

    @Size(max = 100)
    @JsonProperty("reference_no")
    String referenceNo;

    @JsonProperty("transfer_date")
    Instant transferDate;

    public TransferCommand toCommand() {
        return TransferCommand.builder()
            .fromAccountId(fromAccountId)
            .toAccountId(toAccountId)
            .fromAmount(fromAmount)
            .toAmount(toAmount)
            .exchangeRate(exchangeRate)
            .description(description)
            .referenceNo(referenceNo)
            .transferDate(transferDate)
            .build();
    }
}
