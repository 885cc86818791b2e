package com.flagship.currency_ledger.account.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.currency_ledger.account.Account;
import com.flagship.currency_ledger.account.AccountType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class AccountResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("code")
    String code;

    @JsonProperty("name")
    String name;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("account_type")
    AccountType accountType;

    @JsonProperty("balance")
    BigDecimal balance;

    @JsonProperty("company_id")
    UUID companyId;

    @JsonProperty("active")
    boolean active;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static AccountResponse from(Account account) {
        return AccountResponse.builder()
            .id(account.getId())
            .code(account.getCode())
            .name(account.getName())
            .currency(account.getCurrency())
            .accountType(account.getType())
            .balance(account.getBalance())
            .companyId(account.getCompanyId())
            .active(account.isActive())
            .createdAt(account.getCreatedAt())
            .updatedAt(account.getUpdatedAt())
            .build();
    }
}
