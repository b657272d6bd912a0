package com.example.ledger.domain;

import static org.junit.jupiter.api.Assertions.*;

import java.time.LocalDate;

import org.junit.jupiter.api.Test;

class FiscalCalendarTest {

  @Test
  void periodFor_julyStart_mapsFirstDayOfJulyToPeriodOneOfNextYear() {
    FiscalPeriod period = FiscalCalendar.periodFor(7, LocalDate.of(2024, 7, 1));

    assertEquals(2025, period.fiscalYear());
    assertEquals(1, period.period());
  }

  @Test
  void periodFor_julyStart_mapsLastDayOfJuneToPeriodTwelve() {
    FiscalPeriod period = FiscalCalendar.periodFor(7, LocalDate.of(2024, 6, 30));

    assertEquals(2024, period.fiscalYear());
    assertEquals(12, period.period());
  }

  @Test
  void periodFor_julyStart_mapsDecemberToPeriodSix() {
    FiscalPeriod period = FiscalCalendar.periodFor(7, LocalDate.of(2024, 12, 31));

    assertEquals(2025, period.fiscalYear());
    assertEquals(6, period.period());
  }

  @Test
  void periodFor_januaryStart_matchesCalendarYear() {
    FiscalPeriod period = FiscalCalendar.periodFor(1, LocalDate.of(2024, 3, 15));

    assertEquals(2024, period.fiscalYear());
    assertEquals(3, period.period());
  }

  @Test
  void periodFor_everyStartMonth_startsPeriodOneOnTheFirstOfThatMonth() {
    for (int startMonth = 1; startMonth <= 12; startMonth++) {
      LocalDate firstDay = LocalDate.of(2024, startMonth, 1);
      LocalDate dayBefore = firstDay.minusDays(1);

      FiscalPeriod first = FiscalCalendar.periodFor(startMonth, firstDay);
      FiscalPeriod last = FiscalCalendar.periodFor(startMonth, dayBefore);

      int expectedYear = startMonth == 1 ? 2024 : 2025;
      assertEquals(1, first.period(), "start month " + startMonth);
      assertEquals(expectedYear, first.fiscalYear(), "start month " + startMonth);
      assertEquals(firstDay, first.fiscalYearStart(), "start month " + startMonth);
      assertEquals(12, last.period(), "start month " + startMonth);
      assertEquals(expectedYear - 1, last.fiscalYear(), "start month " + startMonth);
    }
  }

  @Test
  void periodFor_everyStartMonth_returnsPeriodContainingTheDate() {
    for (int startMonth = 1; startMonth <= 12; startMonth++) {
      for (LocalDate date = LocalDate.of(2024, 1, 1);
          date.getYear() == 2024;
          date = date.plusDays(1)) {
        FiscalPeriod period = FiscalCalendar.periodFor(startMonth, date);
        assertTrue(period.contains(date), "start month " + startMonth + ", date " + date);
      }
    }
  }

  @Test
  void fiscalPeriod_julyStart_periodTwelveEndsOnThirtiethOfJune() {
    FiscalPeriod period = new FiscalPeriod(2025, 12, 7);

    assertEquals(LocalDate.of(2024, 7, 1), period.fiscalYearStart());
    assertEquals(LocalDate.of(2025, 6, 1), period.startDate());
    assertEquals(LocalDate.of(2025, 6, 30), period.endDate());
  }

  @Test
  void periodFor_invalidStartMonth_throwsException() {
    assertThrows(
        IllegalArgumentException.class,
        () -> FiscalCalendar.periodFor(13, LocalDate.of(2024, 1, 1)));
  }
}
