package com.example.ledger.domain;

/** Where a journal entry originated. */
public enum JournalSource {
  MANUAL,
  SALES,
  PURCHASES,
  PAYROLL,
  BANK,
  SYSTEM
}
