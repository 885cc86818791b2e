package com.flagship.currency_ledger.account;

import com.flagship.currency_ledger.account.dto.AccountResponse;
import com.flagship.currency_ledger.account.dto.OpenAccountRequest;
import com.flagship.currency_ledger.ledger.BalanceHistoryPage;
import com.flagship.currency_ledger.ledger.LedgerService;
import com.flagship.currency_ledger.ledger.Reconciliation;
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
@RequestMapping("/api/accounts")
@RequiredArgsConstructor
public class AccountController {

    private final AccountService accountService;
    private final LedgerService ledgerService;

    @PostMapping
    public ResponseEntity<AccountResponse> openAccount(@Valid @RequestBody OpenAccountRequest request) {
        Account account = accountService.openAccount(
            request.getCode(),
            request.getName(),
            request.getCurrency(),
            request.getAccountType(),
            request.getCompanyId(),
            request.getOpeningBalance()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(AccountResponse.from(account));
    }

    @GetMapping
    public List<AccountResponse> listAccounts(
            @RequestParam(value = "company_id", required = false) UUID companyId,
            @RequestParam(value = "account_type", required = false) AccountType type) {
        return accountService.listAccounts(companyId, type).stream()
            .map(AccountResponse::from)
            .toList();
    }

    @GetMapping("/{id}")
    public AccountResponse getAccount(@PathVariable("id") UUID id) {
        return AccountResponse.from(accountService.getAccount(id));
    }

    @PostMapping("/{id}/deactivate")
    public AccountResponse deactivateAccount(@PathVariable("id") UUID id) {
        return AccountResponse.from(accountService.deactivateAccount(id));
    }

    @GetMapping("/{id}/history")
    public BalanceHistoryPage history(
            @PathVariable("id") UUID id,
            @RequestParam(value = "page", defaultValue = "0") int page,
            @RequestParam(value = "size", defaultValue = "50") int size) {
        return ledgerService.history(id, page, size);
    }

    @GetMapping("/{id}/reconciliation")
    public Reconciliation reconcile(@PathVariable("id") UUID id) {
        return ledgerService.reconcile(id);
    }
}
