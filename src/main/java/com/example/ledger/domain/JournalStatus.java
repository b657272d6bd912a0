package com.example.ledger.domain;

/**
 * Lifecycle of a journal entry.
 *
 * <pre>
 * DRAFT -> APPROVED -> POSTED -> REVERSED
 * DRAFT | APPROVED  -> VOID
 * DRAFT             -> POSTED
 * </pre>
 */
public enum JournalStatus {
  DRAFT,
  APPROVED,
  POSTED,
  REVERSED,
  VOID;

  public boolean isPostable() {
    return this == DRAFT || this == APPROVED;
  }

  public boolean isVoidable() {
    return this == DRAFT || this == APPROVED;
  }

  /** Whether entries in this state have affected account balances. */
  public boolean hasBalanceEffect() {
    return this == POSTED || this == REVERSED;
  }
}
