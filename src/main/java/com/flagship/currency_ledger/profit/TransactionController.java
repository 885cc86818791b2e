package com.flagship.currency_ledger.profit;

import com.flagship.currency_ledger.profit.dto.RecordTransactionRequest;
import com.flagship.currency_ledger.profit.dto.TransactionResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/transactions")
@RequiredArgsConstructor
public class TransactionController {

    private final TradeTransactionService transactionService;

    @PostMapping
    public ResponseEntity<TransactionResponse> recordTransaction(@Valid @RequestBody RecordTransactionRequest request) {
        TradeTransaction transaction = transactionService.recordTransaction(request.toCommand());
        return ResponseEntity.status(HttpStatus.CREATED).body(TransactionResponse.from(transaction));
    }

    @GetMapping("/{id}")
    public TransactionResponse getTransaction(@PathVariable("id") UUID id) {
        return TransactionResponse.from(transactionService.getTransaction(id));
    }
}
