package com.example.ledger.domain;

import java.time.LocalDate;

/**
 * A fiscal year and period (1-12) under a given fiscal-year start month. The fiscal year is named
 * after the calendar year in which it ends.
 */
public record FiscalPeriod(int fiscalYear, int period, int startMonth) {

  public FiscalPeriod {
    if (period < 1 || period > 12) {
      throw new IllegalArgumentException("Fiscal period must be between 1 and 12: " + period);
    }
    if (startMonth < 1 || startMonth > 12) {
      throw new IllegalArgumentException("Start month must be between 1 and 12: " + startMonth);
    }
  }

  /** First day of the fiscal year this period belongs to. */
  public LocalDate fiscalYearStart() {
    int startYear = startMonth == 1 ? fiscalYear : fiscalYear - 1;
    return LocalDate.of(startYear, startMonth, 1);
  }

  public LocalDate startDate() {
    return fiscalYearStart().plusMonths(period - 1L);
  }

  public LocalDate endDate() {
    return startDate().plusMonths(1).minusDays(1);
  }

  public boolean contains(LocalDate date) {
    return !date.isBefore(startDate()) && !date.isAfter(endDate());
  }
}
