package com.example.ledger.exception;

/** The operation touches protected fields of a system account. */
public class ForbiddenException extends LedgerException {

  public ForbiddenException(String message) {
    super(message);
  }
}
