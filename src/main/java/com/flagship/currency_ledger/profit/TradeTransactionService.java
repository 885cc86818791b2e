package com.flagship.currency_ledger.profit;

import com.flagship.currency_ledger.common.Amounts;
import com.flagship.currency_ledger.common.DocumentNumberGenerator;
import com.flagship.currency_ledger.common.exception.NotFoundException;
import com.flagship.currency_ledger.common.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Records sales, purchases and returns with their line profit.
 *
 * Line values are computed here, once, and stored. Reports read them back as they
 * were written, so later price changes never alter historical profit.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TradeTransactionService {

    private final TradeTransactionRepository repository;
    private final ProfitCalculator calculator;
    private final DocumentNumberGenerator documentNumbers;
    private final Clock clock;

    @Transactional
    public TradeTransaction recordTransaction(TradeTransactionCommand command) {
        if (command.getType() == null) {
            throw new ValidationException("Transaction type is required");
        }
        if (command.getCompanyId() == null) {
            throw new ValidationException("Company ID is required");
        }
        String currency = Amounts.normalizeCurrency(command.getCurrency());
        if (currency == null || currency.isBlank()) {
            throw new ValidationException("Currency is required");
        }
        if (command.getLines() == null || command.getLines().isEmpty()) {
            throw new ValidationException("A transaction needs at least one line");
        }

        List<TransactionItem> items = new ArrayList<>();
        BigDecimal subtotal = BigDecimal.ZERO;
        BigDecimal totalCost = BigDecimal.ZERO;
        int lineNumber = 1;
        for (TradeTransactionCommand.Line line : command.getLines()) {
            if (line.getProductId() == null) {
                throw new ValidationException("Product ID is required on line " + lineNumber);
            }
            LineProfit profit = calculator.computeLineProfit(LineItem.builder()
                    .productId(line.getProductId())
                    .quantity(line.getQuantity())
                    .unitPrice(line.getUnitPrice())
                    .costPrice(line.getCostPrice())
                    .currency(currency)
                    .build());
            items.add(new TransactionItem(
                UUID.randomUUID(),
                lineNumber++,
                line.getProductId(),
                line.getDescription(),
                Amounts.amount(line.getQuantity()),
                Amounts.amount(line.getUnitPrice()),
                Amounts.amount(line.getCostPrice()),
                profit.getLineTotal(),
                profit.getLineCost(),
                profit.getLineProfit(),
                profit.getMarginPct()
            ));
            subtotal = subtotal.add(profit.getLineTotal());
            totalCost = totalCost.add(profit.getLineCost());
        }

        TradeTransaction transaction = new TradeTransaction(
            UUID.randomUUID(),
            documentNumbers.next(command.getType().getDocumentPrefix()),
            command.getType(),
            command.getCompanyId(),
            command.getContactId(),
            currency,
            command.getTransactionDate() != null ? command.getTransactionDate() : clock.instant(),
            subtotal,
            totalCost,
            subtotal.subtract(totalCost),
            command.getNotes(),
            items,
            null
        );

        TradeTransaction saved = repository.save(TradeTransactionEntity.fromDomain(transaction)).toDomain();
        log.info("Transaction recorded: transactionNo={}, type={}, lines={}, subtotal={} {}, profit={}",
                saved.getTransactionNo(), saved.getType(), items.size(), subtotal, currency, saved.getTotalProfit());
        return saved;
    }

    @Transactional(readOnly = true)
    public TradeTransaction getTransaction(UUID id) {
        return repository.findWithItemsById(id)
                .map(TradeTransactionEntity::toDomain)
                .orElseThrow(() -> NotFoundException.of("Transaction", id));
    }
}
