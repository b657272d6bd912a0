package com.example.ledger.domain;

public enum JournalType {
  STANDARD,
  ADJUSTING,
  REVERSING,
  CLOSING,
  OPENING,
  RECURRING
}
