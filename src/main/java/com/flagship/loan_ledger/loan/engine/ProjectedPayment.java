package com.flagship.loan_ledger.loan.engine;

import com.flagship.loan_ledger.loan.LoanPayment;
import lombok.Value;

import java.math.BigDecimal;

/**
 * A recorded payment paired with the loan balance right after it was applied.
 */
@Value
public class ProjectedPayment {
    LoanPayment payment;
    BigDecimal balanceAfter;
}
