package com.example.ledger.service;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.example.ledger.domain.Account;
import com.example.ledger.domain.AccountType;
import com.example.ledger.domain.Company;
import com.example.ledger.repository.AccountRepository;
import com.example.ledger.repository.AccountTotals;
import com.example.ledger.repository.JournalLineRepository;
import com.example.ledger.service.TrialBalanceService.TrialBalance;
import com.example.ledger.service.TrialBalanceService.TrialBalanceLine;

/** Unit tests for TrialBalanceService. "Today" is fixed at 2024-10-01. */
@ExtendWith(MockitoExtension.class)
class TrialBalanceServiceTest {

  private static final LocalDate TODAY = LocalDate.of(2024, 10, 1);

  @Mock private AccountRepository accountRepository;

  @Mock private JournalLineRepository journalLineRepository;

  @Mock private CompanyService companyService;

  private TrialBalanceService trialBalanceService;

  private Company company;
  private Account cash;
  private Account sales;
  private Account rent;
  private Account assetsHeader;

  @BeforeEach
  void setUp() {
    Clock clock = Clock.fixed(Instant.parse("2024-10-01T08:00:00Z"), ZoneOffset.UTC);
    trialBalanceService =
        new TrialBalanceService(accountRepository, journalLineRepository, companyService, clock);

    company = new Company("Test Company", "UGX", 7);
    company.setId(1L);
    lenient().when(companyService.getById(1L)).thenReturn(company);

    cash = account(1L, "110001", AccountType.ASSET);
    sales = account(2L, "410001", AccountType.REVENUE);
    rent = account(3L, "520001", AccountType.EXPENSE);
    assetsHeader = account(4L, "100000", AccountType.ASSET);
    assetsHeader.markHeader(true);
  }

  @Test
  void generateTrialBalance_fromSnapshots_placesBalancesByNormalSide() {
    // Arrange: Dr cash 1000 / Cr sales 800 / Cr rent 200 (a refund)
    post(cash, "1000.00", "0");
    post(sales, "0", "800.00");
    post(rent, "0", "200.00");
    when(accountRepository.findByCompanyIdOrderByCode(1L))
        .thenReturn(List.of(rent, sales, assetsHeader, cash));

    // Act
    TrialBalance result = trialBalanceService.generateTrialBalance(1L, TODAY, "alice");

    // Assert
    assertTrue(result.isBalanced());
    assertAmount("1000.00", result.totalDebits());
    assertAmount("1000.00", result.totalCredits());
    assertEquals(
        List.of("110001", "410001", "520001"),
        result.lines().stream().map(TrialBalanceLine::accountCode).toList());

    TrialBalanceLine cashLine = result.lines().get(0);
    assertAmount("1000.00", cashLine.debit());
    assertAmount("0", cashLine.credit());
    assertFalse(cashLine.abnormal());

    TrialBalanceLine salesLine = result.lines().get(1);
    assertAmount("0", salesLine.debit());
    assertAmount("800.00", salesLine.credit());
    assertFalse(salesLine.abnormal());

    TrialBalanceLine rentLine = result.lines().get(2);
    assertAmount("0", rentLine.debit());
    assertAmount("200.00", rentLine.credit());
    assertAmount("-200.00", rentLine.balance());
    assertTrue(rentLine.abnormal());

    assertEquals(2025, result.fiscalYear());
    assertEquals(4, result.fiscalPeriod());
    assertEquals("alice", result.generatedBy());
    verify(journalLineRepository, never()).sumByAccountAsOf(any(), any(), any());
  }

  @Test
  void generateTrialBalance_skipsZeroBalanceAccounts() {
    post(cash, "500.00", "0");
    post(sales, "0", "500.00");
    when(accountRepository.findByCompanyIdOrderByCode(1L))
        .thenReturn(List.of(cash, sales, rent));

    TrialBalance result = trialBalanceService.generateTrialBalance(1L, TODAY, "alice");

    assertEquals(2, result.lines().size());
  }

  @Test
  void generateTrialBalance_beforeToday_sumsPostedLinesUpToDate() {
    // Arrange: snapshots include later postings that must not show up
    post(cash, "9999.00", "0");
    post(sales, "0", "9999.00");
    when(accountRepository.findByCompanyIdOrderByCode(1L)).thenReturn(List.of(cash, sales));
    LocalDate asOf = LocalDate.of(2024, 8, 31);
    when(journalLineRepository.sumByAccountAsOf(1L, BalanceService.BALANCE_EFFECT_STATUSES, asOf))
        .thenReturn(
            List.of(
                totals(1L, "1000.00", "0"),
                totals(2L, "0", "1000.00")));

    // Act
    TrialBalance result = trialBalanceService.generateTrialBalance(1L, asOf, "alice");

    // Assert
    assertTrue(result.isBalanced());
    assertAmount("1000.00", result.lines().get(0).debit());
    assertAmount("1000.00", result.lines().get(1).credit());
    assertEquals(2025, result.fiscalYear());
    assertEquals(2, result.fiscalPeriod());
  }

  @Test
  void generateTrialBalance_whenLaterEntryPosted_excludesItFromToday() {
    // Arrange: the snapshot already holds an entry dated next month
    post(cash, "1500.00", "0");
    post(sales, "0", "1500.00");
    when(accountRepository.findByCompanyIdOrderByCode(1L)).thenReturn(List.of(cash, sales));
    when(journalLineRepository.existsDatedAfter(1L, BalanceService.BALANCE_EFFECT_STATUSES, TODAY))
        .thenReturn(true);
    when(journalLineRepository.sumByAccountAsOf(1L, BalanceService.BALANCE_EFFECT_STATUSES, TODAY))
        .thenReturn(List.of(totals(1L, "500.00", "0"), totals(2L, "0", "500.00")));

    // Act
    TrialBalance result = trialBalanceService.generateTrialBalance(1L, TODAY, "alice");

    // Assert
    assertTrue(result.isBalanced());
    assertAmount("500.00", result.totalDebits());
    assertAmount("500.00", result.totalCredits());
  }

  @Test
  void generateTrialBalance_whenTotalsDiffer_isNotBalanced() {
    post(cash, "100.00", "0");
    post(sales, "0", "90.00");
    when(accountRepository.findByCompanyIdOrderByCode(1L)).thenReturn(List.of(cash, sales));

    TrialBalance result = trialBalanceService.generateTrialBalance(1L, TODAY, 2025, 4, "alice");

    assertFalse(result.isBalanced());
  }

  private Account account(Long id, String code, AccountType type) {
    Account account = new Account(company, code, "Account " + code, type, "UGX");
    account.setId(id);
    return account;
  }

  private void post(Account account, String debit, String credit) {
    account
        .getBalance()
        .apply(
            new BigDecimal(debit),
            new BigDecimal(credit),
            new BigDecimal(debit),
            new BigDecimal(credit),
            account.getNormalBalance());
  }

  private AccountTotals totals(Long accountId, String debit, String credit) {
    return new AccountTotals(
        accountId,
        new BigDecimal(debit),
        new BigDecimal(credit),
        new BigDecimal(debit),
        new BigDecimal(credit));
  }

  private static void assertAmount(String expected, BigDecimal actual) {
    assertEquals(0, new BigDecimal(expected).compareTo(actual), "was " + actual);
  }
}
