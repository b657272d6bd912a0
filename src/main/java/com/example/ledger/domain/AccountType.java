package com.example.ledger.domain;

/**
 * Top-level classification of an account. Each type has a normal balance side: assets and
 * expenses increase with debits, liabilities, equity and revenue increase with credits.
 */
public enum AccountType {
  ASSET(NormalBalance.DEBIT),
  LIABILITY(NormalBalance.CREDIT),
  EQUITY(NormalBalance.CREDIT),
  REVENUE(NormalBalance.CREDIT),
  EXPENSE(NormalBalance.DEBIT);

  private final NormalBalance normalBalance;

  AccountType(NormalBalance normalBalance) {
    this.normalBalance = normalBalance;
  }

  public NormalBalance getNormalBalance() {
    return normalBalance;
  }

  public boolean isDebitNormal() {
    return normalBalance == NormalBalance.DEBIT;
  }
}
