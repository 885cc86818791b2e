package com.flagship.currency_ledger.profit.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.currency_ledger.profit.TradeTransactionCommand;
import com.flagship.currency_ledger.profit.TradeTransactionType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Value
public class RecordTransactionRequest {

    @NotNull(message = "Transaction type is required")
    @JsonProperty("transaction_type")
    TradeTransactionType transactionType;

    @NotNull(message = "Company ID is required")
    @JsonProperty("company_id")
    UUID companyId;

    @JsonProperty("contact_id")
    UUID contactId;

    @NotBlank(message = "Currency is required")
    @Pattern(regexp = "^[A-Za-z]{3,10}$", message = "Currency must be a 3 to 10 letter code")
    @JsonProperty("currency")
    String currency;

    @JsonProperty("transaction_date")
    Instant transactionDate;

    @JsonProperty("notes")
    String notes;

    @NotEmpty(message = "At least one item is required")
    @Valid
    @JsonProperty("items")
    List<Item> items;

    @Value
    public static class Item {

        @NotNull(message = "Product ID is required")
        @JsonProperty("product_id")
        UUID productId;

        @Size(max = 200)
        @JsonProperty("description")
        String description;

        @NotNull(message = "Quantity is required")
        @DecimalMin(value = "0", inclusive = false, message = "Quantity must be greater than 0")
        @JsonProperty("quantity")
        BigDecimal quantity;

        @NotNull(message = "Unit price is required")
        @DecimalMin(value = "0", message = "Unit price cannot be negative")
        @JsonProperty("unit_price")
        BigDecimal unitPrice;

        @NotNull(message = "Cost price is required")
        @DecimalMin(value = "0", message = "Cost price cannot be negative")
        @JsonProperty("cost_price")
        BigDecimal costPrice;
    }

    public TradeTransactionCommand toCommand() {
        TradeTransactionCommand.TradeTransactionCommandBuilder builder = TradeTransactionCommand.builder()
            .type(transactionType)
            .companyId(companyId)
            .contactId(contactId)
            .currency(currency)
            .transactionDate(transactionDate)
            .notes(notes);
        items.forEach(item -> builder.line(TradeTransactionCommand.Line.builder()
            .productId(item.getProductId())
            .description(item.getDescription())
            .quantity(item.getQuantity())
            .unitPrice(item.getUnitPrice())
            .costPrice(item.getCostPrice())
            .build()));
        return builder.build();
    }
}
