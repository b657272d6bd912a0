package com.example.ledger.exception;

/** A referenced account or journal entry does not exist. */
public class NotFoundException extends LedgerException {

  public NotFoundException(String message) {
    super(message);
  }
}
