package com.example.ledger.exception;

/**
 * Base type for every failure raised by the ledger core. Subclasses identify the kind of failure
 * so callers can present an accurate message.
 */
public abstract class LedgerException extends RuntimeException {

  protected LedgerException(String message) {
    super(message);
  }
}
