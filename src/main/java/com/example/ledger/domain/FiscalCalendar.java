package com.example.ledger.domain;

import java.time.LocalDate;

/**
 * Maps calendar dates to fiscal periods for a fiscal year that starts on the first day of a given
 * month. With a July start, July-December of year Y are periods 1-6 of fiscal year Y+1 and
 * January-June of year Y are periods 7-12 of fiscal year Y.
 */
public final class FiscalCalendar {

  private FiscalCalendar() {}

  public static FiscalPeriod periodFor(int startMonth, LocalDate date) {
    if (startMonth < 1 || startMonth > 12) {
      throw new IllegalArgumentException("Start month must be between 1 and 12: " + startMonth);
    }
    int month = date.getMonthValue();
    int period = Math.floorMod(month - startMonth, 12) + 1;
    // The fiscal year is named after the calendar year it ends in
    int fiscalYear = startMonth != 1 && month >= startMonth ? date.getYear() + 1 : date.getYear();
    return new FiscalPeriod(fiscalYear, period, startMonth);
  }

  public static FiscalPeriod periodFor(Company company, LocalDate date) {
    return periodFor(company.getFiscalYearStartMonth(), date);
  }
}
