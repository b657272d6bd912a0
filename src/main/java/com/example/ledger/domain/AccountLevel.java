package com.example.ledger.domain;

/** Depth of an account in the chart of accounts tree. Deeper than DETAIL collapses to DETAIL. */
public enum AccountLevel {
  TYPE,
  SUBTYPE,
  GROUP,
  DETAIL;

  /** The level of a child placed under an account at this level. */
  public AccountLevel childLevel() {
    AccountLevel[] levels = values();
    return levels[Math.min(ordinal() + 1, DETAIL.ordinal())];
  }
}
