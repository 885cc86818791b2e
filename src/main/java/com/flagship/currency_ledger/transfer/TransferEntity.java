package com.flagship.currency_ledger.transfer;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA mapping of {@code transfers}. Transfers are written once and never changed.
 */
@Entity
@Immutable
@Table(name = "transfers")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TransferEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "transfer_no", nullable = false, length = 50)
    private String transferNo;

    @Column(name = "from_account_id", nullable = false)
    private UUID fromAccountId;

    @Column(name = "to_account_id", nullable = false)
    private UUID toAccountId;

    @Column(name = "from_amount", nullable = false, precision = 18, scale = 4)
    private BigDecimal fromAmount;

    @Column(name = "to_amount", nullable = false, precision = 18, scale = 4)
    private BigDecimal toAmount;

    @Column(name = "exchange_rate", nullable = false, precision = 18, scale = 8)
    private BigDecimal exchangeRate;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Column(name = "reference_no", length = 100)
    private String referenceNo;

    @Column(name = "transfer_date", nullable = false)
    private Instant transferDate;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
    }

    static TransferEntity fromDomain(Transfer transfer) {
        return new TransferEntity(
            transfer.getId(),
            transfer.getTransferNo(),
            transfer.getFromAccountId(),
            transfer.getToAccountId(),
            transfer.getFromAmount(),
            transfer.getToAmount(),
            transfer.getExchangeRate(),
            transfer.getDescription(),
            transfer.getReferenceNo(),
            transfer.getTransferDate(),
            null
        );
    }

    public Transfer toDomain() {
        return new Transfer(id, transferNo, fromAccountId, toAccountId, fromAmount, toAmount,
                exchangeRate, description, referenceNo, transferDate, createdAt);
    }
}
