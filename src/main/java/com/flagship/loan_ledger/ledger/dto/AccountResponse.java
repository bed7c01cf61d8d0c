package com.flagship.loan_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.loan_ledger.ledger.Account;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
public class AccountResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("name")
    String name;

    @JsonProperty("account_type")
    Account.AccountType accountType;

    @JsonProperty("credit_limit")
    BigDecimal creditLimit;

    @JsonProperty("balance")
    BigDecimal balance;

    public static AccountResponse from(Account account) {
        return AccountResponse.builder()
            .id(account.getId())
            .name(account.getName())
            .accountType(account.getAccountType())
            .creditLimit(account.getCreditLimit())
            .balance(account.getBalance())
            .build();
    }
}
