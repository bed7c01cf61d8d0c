package com.flagship.loan_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LoanLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(LoanLedgerApplication.class, args);
    }
}
