package com.example.ledger.domain;

/** Refines an {@link AccountType}. A sub-type is only valid for the type it belongs to. */
public enum AccountSubType {
  CURRENT_ASSET(AccountType.ASSET),
  FIXED_ASSET(AccountType.ASSET),
  OTHER_ASSET(AccountType.ASSET),
  CURRENT_LIABILITY(AccountType.LIABILITY),
  LONG_TERM_LIABILITY(AccountType.LIABILITY),
  SHARE_CAPITAL(AccountType.EQUITY),
  RETAINED_EARNINGS(AccountType.EQUITY),
  OTHER_EQUITY(AccountType.EQUITY),
  OPERATING_REVENUE(AccountType.REVENUE),
  NON_OPERATING_REVENUE(AccountType.REVENUE),
  OTHER_INCOME(AccountType.REVENUE),
  COST_OF_SALES(AccountType.EXPENSE),
  OPERATING_EXPENSE(AccountType.EXPENSE),
  FINANCIAL_EXPENSE(AccountType.EXPENSE),
  OTHER_EXPENSE(AccountType.EXPENSE);

  private final AccountType type;

  AccountSubType(AccountType type) {
    this.type = type;
  }

  public AccountType getType() {
    return type;
  }

  public boolean belongsTo(AccountType accountType) {
    return type == accountType;
  }
}
