package com.example.ledger.service;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.example.ledger.domain.Account;
import com.example.ledger.domain.AccountType;
import com.example.ledger.domain.Company;
import com.example.ledger.domain.JournalEntry;
import com.example.ledger.domain.JournalLine;
import com.example.ledger.domain.JournalStatus;
import com.example.ledger.exception.InvariantViolationException;
import com.example.ledger.exception.NotFoundException;
import com.example.ledger.repository.AccountRepository;
import com.example.ledger.repository.AccountTotals;
import com.example.ledger.repository.JournalLineRepository;

/** Unit tests for BalanceService, the only writer of account balance snapshots. */
@ExtendWith(MockitoExtension.class)
class BalanceServiceTest {

  @Mock private AccountRepository accountRepository;

  @Mock private JournalLineRepository journalLineRepository;

  @Captor private ArgumentCaptor<Collection<Long>> idsCaptor;

  private BalanceService balanceService;

  private Company company;
  private Account cash;
  private Account sales;

  @BeforeEach
  void setUp() {
    balanceService = new BalanceService(accountRepository, journalLineRepository);

    company = new Company("Test Company", "UGX", 7);
    company.setId(1L);

    cash = new Account(company, "110001", "Cash on Hand", AccountType.ASSET, "UGX");
    cash.setId(1L);

    sales = new Account(company, "410001", "Sales Revenue", AccountType.REVENUE, "UGX");
    sales.setId(2L);

    lenient().when(accountRepository.saveAll(anyList())).thenAnswer(inv -> inv.getArgument(0));
  }

  @Test
  void applyPosting_updatesBothSidesByNormalBalance() {
    // Arrange
    List<JournalLine> lines = lines(line(sales, null, "1000.00"), line(cash, "1000.00", null));
    when(accountRepository.findAllForUpdate(eq(1L), any())).thenReturn(List.of(cash, sales));

    // Act
    balanceService.applyPosting(1L, lines);

    // Assert
    assertAmount("1000.00", cash.getBalance().getBalance());
    assertAmount("1000.00", cash.getBalance().getDebit());
    assertAmount("1000.00", sales.getBalance().getBalance());
    assertAmount("1000.00", sales.getBalance().getCredit());
    verify(accountRepository).saveAll(List.of(cash, sales));
  }

  @Test
  void applyPosting_locksAccountsInAscendingIdOrder() {
    List<JournalLine> lines = lines(line(sales, null, "50.00"), line(cash, "50.00", null));
    when(accountRepository.findAllForUpdate(eq(1L), any())).thenReturn(List.of(cash, sales));

    balanceService.applyPosting(1L, lines);

    verify(accountRepository).findAllForUpdate(eq(1L), idsCaptor.capture());
    assertEquals(List.of(1L, 2L), new ArrayList<>(idsCaptor.getValue()));
  }

  @Test
  void applyPosting_sameAccountOnSeveralLines_appliesNetDelta() {
    List<JournalLine> lines =
        lines(
            line(cash, "300.00", null),
            line(cash, "200.00", null),
            line(cash, null, "100.00"),
            line(sales, null, "400.00"));
    when(accountRepository.findAllForUpdate(eq(1L), any())).thenReturn(List.of(cash, sales));

    balanceService.applyPosting(1L, lines);

    assertAmount("400.00", cash.getBalance().getBalance());
    assertAmount("500.00", cash.getBalance().getDebit());
    assertAmount("100.00", cash.getBalance().getCredit());
    assertAmount("400.00", sales.getBalance().getBalance());
  }

  @Test
  void applyPosting_creditToAsset_reducesBalance() {
    cash.getBalance()
        .apply(
            new BigDecimal("100.00"),
            BigDecimal.ZERO,
            new BigDecimal("100.00"),
            BigDecimal.ZERO,
            cash.getNormalBalance());
    List<JournalLine> lines = lines(line(cash, null, "250.00"), line(sales, "250.00", null));
    when(accountRepository.findAllForUpdate(eq(1L), any())).thenReturn(List.of(cash, sales));

    balanceService.applyPosting(1L, lines);

    assertAmount("-150.00", cash.getBalance().getBalance());
    assertAmount("-250.00", sales.getBalance().getBalance());
  }

  @Test
  void applyPosting_missingAccount_throwsNotFound() {
    List<JournalLine> lines = lines(line(cash, "10.00", null), line(sales, null, "10.00"));
    when(accountRepository.findAllForUpdate(eq(1L), any())).thenReturn(List.of(cash));

    NotFoundException exception =
        assertThrows(NotFoundException.class, () -> balanceService.applyPosting(1L, lines));

    assertTrue(exception.getMessage().contains("2"));
    verify(accountRepository, never()).saveAll(anyList());
  }

  @Test
  void applyPosting_archivedAccount_throwsInvariantViolation() {
    sales.setStatus(Account.Status.ARCHIVED);
    List<JournalLine> lines = lines(line(cash, "10.00", null), line(sales, null, "10.00"));
    when(accountRepository.findAllForUpdate(eq(1L), any())).thenReturn(List.of(cash, sales));

    assertThrows(InvariantViolationException.class, () -> balanceService.applyPosting(1L, lines));
    verify(accountRepository, never()).saveAll(anyList());
  }

  @Test
  void rebuildBalances_replacesSnapshotsWithJournalTotals() {
    // Arrange: cash has drifted, sales has no journal activity at all
    cash.getBalance()
        .apply(
            new BigDecimal("999.00"),
            BigDecimal.ZERO,
            new BigDecimal("999.00"),
            BigDecimal.ZERO,
            cash.getNormalBalance());
    sales.getBalance()
        .apply(
            BigDecimal.ZERO,
            new BigDecimal("5.00"),
            BigDecimal.ZERO,
            new BigDecimal("5.00"),
            sales.getNormalBalance());
    AccountTotals cashTotals =
        new AccountTotals(
            1L,
            new BigDecimal("700.00"),
            new BigDecimal("200.00"),
            new BigDecimal("700.00"),
            new BigDecimal("200.00"));
    when(journalLineRepository.sumByAccount(1L, BalanceService.BALANCE_EFFECT_STATUSES))
        .thenReturn(List.of(cashTotals));
    when(accountRepository.findByCompanyIdOrderByCode(1L)).thenReturn(List.of(cash, sales));
    when(accountRepository.findAllForUpdate(eq(1L), any())).thenReturn(List.of(cash, sales));

    // Act
    balanceService.rebuildBalances(1L);

    // Assert
    assertAmount("500.00", cash.getBalance().getBalance());
    assertAmount("500.00", cash.getBalance().getFunctionalBalance());
    assertTrue(sales.getBalance().isZero());
  }

  @Test
  void balanceEffectStatuses_arePostedAndReversed() {
    assertEquals(
        EnumSet.of(JournalStatus.POSTED, JournalStatus.REVERSED),
        BalanceService.BALANCE_EFFECT_STATUSES);
  }

  private JournalLine line(Account account, String debit, String credit) {
    return new JournalLine(
        account,
        debit != null ? new BigDecimal(debit) : null,
        credit != null ? new BigDecimal(credit) : null);
  }

  private List<JournalLine> lines(JournalLine... lines) {
    JournalEntry entry =
        new JournalEntry(company, LocalDate.of(2024, 8, 15), "UGX", BigDecimal.ONE);
    entry.replaceLines(List.of(lines), "UGX");
    return entry.getLines();
  }

  private static void assertAmount(String expected, BigDecimal actual) {
    assertEquals(
        0, new BigDecimal(expected).compareTo(actual), "expected " + expected + " but was " + actual);
  }
}
