package com.flagship.currency_ledger.profit.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.currency_ledger.profit.TradeTransaction;
import com.flagship.currency_ledger.profit.TradeTransactionType;
import com.flagship.currency_ledger.profit.TransactionItem;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class TransactionResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("transaction_no")
    String transactionNo;

    @JsonProperty("transaction_type")
    TradeTransactionType transactionType;

    @JsonProperty("company_id")
    UUID companyId;

    @JsonProperty("contact_id")
    UUID contactId;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("transaction_date")
    Instant transactionDate;

    @JsonProperty("subtotal")
    BigDecimal subtotal;

    @JsonProperty("total_cost")
    BigDecimal totalCost;

    @JsonProperty("total_profit")
    BigDecimal totalProfit;

    @JsonProperty("notes")
    String notes;

    @JsonProperty("items")
    List<Item> items;

    @Value
    public static class Item {
        @JsonProperty("line_number")
        int lineNumber;
        @JsonProperty("product_id")
        UUID productId;
        @JsonProperty("description")
        String description;
        @JsonProperty("quantity")
        BigDecimal quantity;
        @JsonProperty("unit_price")
        BigDecimal unitPrice;
        @JsonProperty("cost_price")
        BigDecimal costPrice;
        @JsonProperty("line_total")
        BigDecimal lineTotal;
        @JsonProperty("line_cost")
        BigDecimal lineCost;
        @JsonProperty("line_profit")
        BigDecimal lineProfit;
        @JsonProperty("margin_pct")
        BigDecimal marginPct;

        static Item from(TransactionItem item) {
            return new Item(item.getLineNumber(), item.getProductId(), item.getDescription(), item.getQuantity(),
                    item.getUnitPrice(), item.getCostPrice(), item.getLineTotal(), item.getLineCost(),
                    item.getLineProfit(), item.getMarginPct());
        }
    }

    public static TransactionResponse from(TradeTransaction transaction) {
        return TransactionResponse.builder()
            .id(transaction.getId())
            .transactionNo(transaction.getTransactionNo())
            .transactionType(transaction.getType())
            .companyId(transaction.getCompanyId())
            .contactId(transaction.getContactId())
            .currency(transaction.getCurrency())
            .transactionDate(transaction.getTransactionDate())
            .subtotal(transaction.getSubtotal())
            .totalCost(transaction.getTotalCost())
            .totalProfit(transaction.getTotalProfit())
            .notes(transaction.getNotes())
            .items(transaction.getItems().stream().map(Item::from).toList())
            .build();
    }
}
