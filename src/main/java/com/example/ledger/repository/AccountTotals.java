package com.example.ledger.repository;

import java.math.BigDecimal;

/** Summed journal line amounts for one account. */
public record AccountTotals(
    Long accountId,
    BigDecimal debit,
    BigDecimal credit,
    BigDecimal functionalDebit,
    BigDecimal functionalCredit) {

  public static AccountTotals empty(Long accountId) {
    return new AccountTotals(
        accountId, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO);
  }
}
