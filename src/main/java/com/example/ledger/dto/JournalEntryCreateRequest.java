package com.example.ledger.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import com.example.ledger.domain.JournalSource;
import com.example.ledger.domain.JournalType;

/**
 * Input for creating a draft journal entry. Currency defaults to the company's functional
 * currency, type to STANDARD and source to MANUAL.
 */
public record JournalEntryCreateRequest(
    LocalDate date,
    String description,
    JournalType type,
    JournalSource source,
    Long sourceId,
    String sourceReference,
    String currency,
    BigDecimal exchangeRate,
    LocalDate autoReverseDate,
    List<JournalLineRequest> lines) {

  public static JournalEntryCreateRequest of(
      LocalDate date, String description, List<JournalLineRequest> lines) {
    return new JournalEntryCreateRequest(
        date, description, null, null, null, null, null, null, null, lines);
  }
}
