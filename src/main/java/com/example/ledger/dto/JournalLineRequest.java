package com.example.ledger.dto;

import java.math.BigDecimal;

import com.example.ledger.domain.LineDimensions;

/** One line of a journal entry as supplied by a caller. Null amounts count as zero. */
public record JournalLineRequest(
    Long accountId,
    String description,
    BigDecimal debit,
    BigDecimal credit,
    LineDimensions dimensions) {

  public static JournalLineRequest debit(Long accountId, BigDecimal amount) {
    return new JournalLineRequest(accountId, null, amount, BigDecimal.ZERO, null);
  }

  public static JournalLineRequest credit(Long accountId, BigDecimal amount) {
    return new JournalLineRequest(accountId, null, BigDecimal.ZERO, amount, null);
  }
}
