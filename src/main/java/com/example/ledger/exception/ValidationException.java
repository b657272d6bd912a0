package com.example.ledger.exception;

/** Malformed or duplicate input, such as a duplicate account code. */
public class ValidationException extends LedgerException {

  public ValidationException(String message) {
    super(message);
  }
}
