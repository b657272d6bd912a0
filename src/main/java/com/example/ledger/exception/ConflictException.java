package com.example.ledger.exception;

/** The target's current state does not allow the requested transition. */
public class ConflictException extends LedgerException {

  public ConflictException(String message) {
    super(message);
  }
}
