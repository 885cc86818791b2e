package com.flagship.currency_ledger.profit;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * JPA mapping of {@code transaction_items}. Derived columns are written once with the line.
 */
@Entity
@Table(name = "transaction_items")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class TransactionItemEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "transaction_id", nullable = false, updatable = false)
    private TradeTransactionEntity transaction;

    @Column(name = "line_number", nullable = false)
    private int lineNumber;

    @Column(name = "product_id", nullable = false)
    private UUID productId;

    @Column(length = 200)
    private String description;

    @Column(nullable = false, precision = 18, scale = 4)
    private BigDecimal quantity;

    @Column(name = "unit_price", nullable = false, precision = 18, scale = 4)
    private BigDecimal unitPrice;

    @Column(name = "cost_price", nullable = false, precision = 18, scale = 4)
    private BigDecimal costPrice;

    @Column(name = "line_total", nullable = false, precision = 18, scale = 4)
    private BigDecimal lineTotal;

    @Column(name = "line_cost", nullable = false, precision = 18, scale = 4)
    private BigDecimal lineCost;

    @Column(name = "line_profit", nullable = false, precision = 18, scale = 4)
    private BigDecimal lineProfit;

    @Column(name = "margin_pct", nullable = false, precision = 12, scale = 4)
    private BigDecimal marginPct;

    TransactionItemEntity(TradeTransactionEntity transaction, TransactionItem item) {
        this.id = item.getId();
        this.transaction = transaction;
        this.lineNumber = item.getLineNumber();
        this.productId = item.getProductId();
        this.description = item.getDescription();
        this.quantity = item.getQuantity();
        this.unitPrice = item.getUnitPrice();
        this.costPrice = item.getCostPrice();
        this.lineTotal = item.getLineTotal();
        this.lineCost = item.getLineCost();
        this.lineProfit = item.getLineProfit();
        this.marginPct = item.getMarginPct();
    }

    public TransactionItem toDomain() {
        return new TransactionItem(id, lineNumber, productId, description, quantity, unitPrice, costPrice,
                lineTotal, lineCost, lineProfit, marginPct);
    }
}
