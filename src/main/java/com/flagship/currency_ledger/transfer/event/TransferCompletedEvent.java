package com.flagship.currency_ledger.transfer.event;

import com.flagship.currency_ledger.transfer.Transfer;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class TransferCompletedEvent {

    public static final String EVENT_TYPE = "TransferCompleted";

    UUID eventId;
    UUID transferId;
    String transferNo;
    UUID fromAccountId;
    String fromCurrency;
    BigDecimal fromAmount;
    BigDecimal fromBalanceAfter;
    UUID toAccountId;
    String toCurrency;
    BigDecimal toAmount;
    BigDecimal toBalanceAfter;
    BigDecimal exchangeRate;
    Instant occurredAt;

    public String getEventType() {
        return EVENT_TYPE;
    }

    public static TransferCompletedEvent from(Transfer transfer, String fromCurrency, BigDecimal fromBalanceAfter,
                                              String toCurrency, BigDecimal toBalanceAfter) {
        return new TransferCompletedEvent(
            UUID.randomUUID(),
            transfer.getId(),
            transfer.getTransferNo(),
            transfer.getFromAccountId(),
            fromCurrency,
            transfer.getFromAmount(),
            fromBalanceAfter,
            transfer.getToAccountId(),
            toCurrency,
            transfer.getToAmount(),
            toBalanceAfter,
            transfer.getExchangeRate(),
            Instant.now()
        );
    }
}
