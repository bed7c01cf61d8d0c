package com.flagship.loan_ledger.ledger;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.UUID;

/**
 * Boundary to the cash ledger. Loan disbursements and repayments are posted
 * here; the loan engine itself never touches account balances.
 */
public interface CashMovementRecorder {

    FundsCheck checkFunds(Account account, BigDecimal amount);

    /**
     * @return id of the posted cash transaction
     * @throws com.flagship.loan_ledger.loan.exception.ResourceNotFoundException if the account does not exist
     */
    UUID postTransaction(CashMovement movement);

    /**
     * Removes the cash transactions linked to a loan payment.
     *
     * @return number of transactions removed
     */
    int removeForLoanPayment(UUID loanPaymentId);

    /**
     * The cash movement that paid out or received a loan's principal, if one was posted.
     */
    Optional<CashMovement> findDisbursement(UUID loanId);

    /**
     * Removes a loan's disbursement, leaving its repayments alone.
     *
     * @return number of transactions removed
     */
    int removeDisbursement(UUID loanId);
}
