package com.flagship.currency_ledger.transfer;

import com.flagship.currency_ledger.transfer.dto.TransferRequest;
import com.flagship.currency_ledger.transfer.dto.TransferResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/transfers")
@RequiredArgsConstructor
public class TransferController {

    private final TransferService transferService;

    @PostMapping
    public ResponseEntity<TransferResponse> transfer(@Valid @RequestBody TransferRequest request) {
        Transfer transfer = transferService.transfer(request.toCommand());
        return ResponseEntity.status(HttpStatus.CREATED).body(TransferResponse.from(transfer));
    }

    @GetMapping("/{id}")
    public TransferResponse getTransfer(@PathVariable("id") UUID id) {
        return TransferResponse.from(transferService.getTransfer(id));
    }

    @GetMapping
    public List<TransferResponse> listTransfers(@RequestParam(value = "account_id", required = false) UUID accountId) {
        return transferService.listTransfers(accountId).stream()
            .map(TransferResponse::from)
            .toList();
    }
}
