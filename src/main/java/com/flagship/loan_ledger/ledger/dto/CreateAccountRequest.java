package com.flagship.loan_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.loan_ledger.ledger.Account;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateAccountRequest {

    @NotBlank(message = "Name is required")
    @JsonProperty("name")
    private String name;

    @NotNull(message = "Account type is required")
    @JsonProperty("account_type")
    private Account.AccountType accountType;

    @JsonProperty("credit_limit")
    private BigDecimal creditLimit;

    @JsonProperty("opening_balance")
    private BigDecimal openingBalance;
}
