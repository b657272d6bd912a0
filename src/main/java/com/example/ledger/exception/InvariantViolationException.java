package com.example.ledger.exception;

/** An operation would break a structural ledger rule, such as posting to a header account. */
public class InvariantViolationException extends LedgerException {

  public InvariantViolationException(String message) {
    super(message);
  }
}
