package com.example.ledger.domain;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigDecimal;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AccountTest {

  private Company company;

  @BeforeEach
  void setUp() {
    company = new Company("Test Company", "UGX", 7);
    company.setId(1L);
  }

  @Test
  void placeUnder_null_makesTypeLevelRoot() {
    Account account = account(1L, "100000", AccountType.ASSET);

    account.placeUnder(null);

    assertEquals(AccountLevel.TYPE, account.getLevel());
    assertEquals("100000", account.getPath());
    assertTrue(account.getAncestorIds().isEmpty());
    assertNull(account.getParentId());
  }

  @Test
  void placeUnder_chain_recordsAncestryAndPath() {
    Account root = account(1L, "100000", AccountType.ASSET);
    Account group = account(2L, "110000", AccountType.ASSET);
    Account detail = account(3L, "110001", AccountType.ASSET);

    root.placeUnder(null);
    group.placeUnder(root);
    detail.placeUnder(group);

    assertEquals(AccountLevel.SUBTYPE, group.getLevel());
    assertEquals(AccountLevel.GROUP, detail.getLevel());
    assertEquals(List.of(1L, 2L), detail.getAncestorIds());
    assertEquals("100000/110000/110001", detail.getPath());
    assertEquals(2L, detail.getParentId());
  }

  @Test
  void placeUnder_deeperThanDetail_staysAtDetail() {
    Account parent = account(1L, "100000", AccountType.ASSET);
    parent.setLevel(AccountLevel.DETAIL);

    Account child = account(2L, "100001", AccountType.ASSET);
    child.placeUnder(parent);

    assertEquals(AccountLevel.DETAIL, child.getLevel());
  }

  @Test
  void markHeader_clearsPostable() {
    Account account = account(1L, "100000", AccountType.ASSET);

    account.markHeader(true);

    assertTrue(account.isHeader());
    assertFalse(account.isPostable());
  }

  @Test
  void balance_debitNormalAccount_increasesWithDebits() {
    Account cash = account(1L, "110001", AccountType.ASSET);

    cash.getBalance()
        .apply(
            new BigDecimal("100.00"),
            new BigDecimal("30.00"),
            new BigDecimal("100.00"),
            new BigDecimal("30.00"),
            cash.getNormalBalance());

    assertEquals(0, new BigDecimal("70.00").compareTo(cash.getBalance().getBalance()));
  }

  @Test
  void balance_creditNormalAccount_increasesWithCredits() {
    Account sales = account(1L, "410001", AccountType.REVENUE);

    sales
        .getBalance()
        .apply(
            new BigDecimal("30.00"),
            new BigDecimal("100.00"),
            new BigDecimal("30.00"),
            new BigDecimal("100.00"),
            sales.getNormalBalance());

    assertEquals(0, new BigDecimal("70.00").compareTo(sales.getBalance().getBalance()));
    assertEquals(0, new BigDecimal("70.00").compareTo(sales.getBalance().getFunctionalBalance()));
  }

  @Test
  void normalBalance_followsAccountType() {
    assertEquals(NormalBalance.DEBIT, AccountType.ASSET.getNormalBalance());
    assertEquals(NormalBalance.DEBIT, AccountType.EXPENSE.getNormalBalance());
    assertEquals(NormalBalance.CREDIT, AccountType.LIABILITY.getNormalBalance());
    assertEquals(NormalBalance.CREDIT, AccountType.EQUITY.getNormalBalance());
    assertEquals(NormalBalance.CREDIT, AccountType.REVENUE.getNormalBalance());
  }

  private Account account(Long id, String code, AccountType type) {
    Account account = new Account(company, code, "Account " + code, type, "UGX");
    account.setId(id);
    return account;
  }
}
