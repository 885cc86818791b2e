package com.flagship.currency_ledger.account.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.currency_ledger.account.AccountType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class OpenAccountRequest {

    @NotBlank(message = "Code is required")
    @Size(max = 50)
    @JsonProperty("code")
    String code;

    @NotBlank(message = "Name is required")
    @Size(max = 100)
    @JsonProperty("name")
    String name;

    @NotBlank(message = "Currency is required")
    @Pattern(regexp = "^[A-Za-z]{3,10}$", message = "Currency must be a 3 to 10 letter code")
    @JsonProperty("currency")
    String currency;

    @NotNull(message = "Account type is required")
    @JsonProperty("account_type")
    AccountType accountType;

    @NotNull(message = "Company ID is required")
    @JsonProperty("company_id")
    UUID companyId;

    @JsonProperty("opening_balance")
    BigDecimal openingBalance;
}
