package com.flagship.loan_ledger.loan;

import com.flagship.loan_ledger.loan.engine.BalanceProjection;
import lombok.Value;

/**
 * A loan together with its freshly projected balance.
 */
@Value
public class LoanSummary {
    Loan loan;
    BalanceProjection projection;
}
