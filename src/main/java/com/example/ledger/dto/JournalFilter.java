package com.example.ledger.dto;

import java.time.LocalDate;
import java.util.Set;

import com.example.ledger.domain.JournalEntry;
import com.example.ledger.domain.JournalSource;
import com.example.ledger.domain.JournalStatus;
import com.example.ledger.domain.JournalType;

/** Optional criteria for searching journal entries. Null or empty criteria match everything. */
public record JournalFilter(
    Integer fiscalYear,
    Integer fiscalPeriod,
    Set<JournalType> types,
    Set<JournalSource> sources,
    Set<JournalStatus> statuses,
    LocalDate dateFrom,
    LocalDate dateTo,
    String search) {

  public static JournalFilter all() {
    return new JournalFilter(null, null, null, null, null, null, null, null);
  }

  public static JournalFilter forPeriod(int fiscalYear, int fiscalPeriod) {
    return new JournalFilter(fiscalYear, fiscalPeriod, null, null, null, null, null, null);
  }

  public boolean matches(JournalEntry entry) {
    if (fiscalYear != null && entry.getFiscalYear() != fiscalYear) {
      return false;
    }
    if (fiscalPeriod != null && entry.getFiscalPeriod() != fiscalPeriod) {
      return false;
    }
    if (types != null && !types.isEmpty() && !types.contains(entry.getType())) {
      return false;
    }
    if (sources != null && !sources.isEmpty() && !sources.contains(entry.getSource())) {
      return false;
    }
    if (statuses != null && !statuses.isEmpty() && !statuses.contains(entry.getStatus())) {
      return false;
    }
    if (dateFrom != null && entry.getDate().isBefore(dateFrom)) {
      return false;
    }
    if (dateTo != null && entry.getDate().isAfter(dateTo)) {
      return false;
    }
    if (search != null && !search.isBlank()) {
      String needle = search.toLowerCase();
      return entry.getJournalNumber().toLowerCase().contains(needle)
          || (entry.getDescription() != null
              && entry.getDescription().toLowerCase().contains(needle))
          || (entry.getSourceReference() != null
              && entry.getSourceReference().toLowerCase().contains(needle));
    }
    return true;
  }
}
