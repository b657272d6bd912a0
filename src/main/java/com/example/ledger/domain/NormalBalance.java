package com.example.ledger.domain;

import java.math.BigDecimal;

/** The side on which an account's balance increases. */
public enum NormalBalance {
  DEBIT,
  CREDIT;

  /**
   * Orients a debit/credit pair into a signed balance: positive means the account carries a
   * balance on its normal side.
   */
  public BigDecimal orient(BigDecimal debit, BigDecimal credit) {
    return this == DEBIT ? debit.subtract(credit) : credit.subtract(debit);
  }
}
