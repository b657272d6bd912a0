package com.example.ledger.exception;

import java.math.BigDecimal;

/** Total debits and total credits of a journal entry differ by more than the tolerance. */
public class ImbalanceException extends InvariantViolationException {

  private final BigDecimal totalDebits;
  private final BigDecimal totalCredits;

  public ImbalanceException(BigDecimal totalDebits, BigDecimal totalCredits) {
    super(
        "Journal entry is not balanced: debits=" + totalDebits + ", credits=" + totalCredits);
    this.totalDebits = totalDebits;
    this.totalCredits = totalCredits;
  }

  public BigDecimal getTotalDebits() {
    return totalDebits;
  }

  public BigDecimal getTotalCredits() {
    return totalCredits;
  }
}
