package com.flagship.currency_ledger.profit;

import jakarta.persistence.CascadeType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.OneToMany;
import jakarta.persistence.OrderBy;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * JPA mapping of {@code trade_transactions} with its lines.
 */
@Entity
@Table(name = "trade_transactions")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class TradeTransactionEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "transaction_no", nullable = false, updatable = false, length = 50)
    private String transactionNo;

    @Enumerated(EnumType.STRING)
    @Column(name = "transaction_type", nullable = false, length = 20)
    private TradeTransactionType type;

    @Column(name = "company_id", nullable = false)
    private UUID companyId;

    @Column(name = "contact_id")
    private UUID contactId;

    @Column(nullable = false, length = 10)
    private String currency;

    @Column(name = "transaction_date", nullable = false)
    private Instant transactionDate;

    @Column(nullable = false, precision = 18, scale = 4)
    private BigDecimal subtotal;

    @Column(name = "total_cost", nullable = false, precision = 18, scale = 4)
    private BigDecimal totalCost;

    @Column(name = "total_profit", nullable = false, precision = 18, scale = 4)
    private BigDecimal totalProfit;

    @Column(columnDefinition = "TEXT")
    private String notes;

    @OneToMany(mappedBy = "transaction", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("lineNumber ASC")
    private List<TransactionItemEntity> items = new ArrayList<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
    }

    static TradeTransactionEntity fromDomain(TradeTransaction transaction) {
        TradeTransactionEntity entity = new TradeTransactionEntity();
        entity.id = transaction.getId();
        entity.transactionNo = transaction.getTransactionNo();
        entity.type = transaction.getType();
        entity.companyId = transaction.getCompanyId();
        entity.contactId = transaction.getContactId();
        entity.currency = transaction.getCurrency();
        entity.transactionDate = transaction.getTransactionDate();
        entity.subtotal = transaction.getSubtotal();
        entity.totalCost = transaction.getTotalCost();
        entity.totalProfit = transaction.getTotalProfit();
        entity.notes = transaction.getNotes();
        transaction.getItems().forEach(item -> entity.items.add(new TransactionItemEntity(entity, item)));
        return entity;
    }

    public TradeTransaction toDomain() {
        return new TradeTransaction(id, transactionNo, type, companyId, contactId, currency, transactionDate,
                subtotal, totalCost, totalProfit, notes,
                items.stream().map(TransactionItemEntity::toDomain).toList(), createdAt);
    }
}
