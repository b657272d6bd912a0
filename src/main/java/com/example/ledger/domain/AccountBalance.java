package com.example.ledger.domain;

import java.math.BigDecimal;
import java.time.Instant;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

/**
 * Running balance snapshot of an account. This is a materialized cache of every posted journal
 * line touching the account; it is only ever changed by the posting engine, either
 * incrementally or by an explicit rebuild.
 */
@Embeddable
public class AccountBalance {

  @Column(name = "balance_debit", nullable = false, precision = 19, scale = 2)
  private BigDecimal debit = BigDecimal.ZERO;

  @Column(name = "balance_credit", nullable = false, precision = 19, scale = 2)
  private BigDecimal credit = BigDecimal.ZERO;

  @Column(name = "balance", nullable = false, precision = 19, scale = 2)
  private BigDecimal balance = BigDecimal.ZERO;

  @Column(name = "functional_balance", nullable = false, precision = 19, scale = 2)
  private BigDecimal functionalBalance = BigDecimal.ZERO;

  @Column(name = "balance_updated_at")
  private Instant updatedAt;

  public AccountBalance() {}

  public static AccountBalance zero() {
    AccountBalance snapshot = new AccountBalance();
    snapshot.updatedAt = Instant.now();
    return snapshot;
  }

  /**
   * Adds a posting to the snapshot. The net balance is recomputed from the running totals and
   * oriented by the account's normal side.
   */
  public void apply(
      BigDecimal debitDelta,
      BigDecimal creditDelta,
      BigDecimal functionalDebitDelta,
      BigDecimal functionalCreditDelta,
      NormalBalance normalBalance) {
    this.debit = debit.add(debitDelta);
    this.credit = credit.add(creditDelta);
    this.balance = normalBalance.orient(debit, credit);
    this.functionalBalance =
        functionalBalance.add(normalBalance.orient(functionalDebitDelta, functionalCreditDelta));
    this.updatedAt = Instant.now();
  }

  /** Replaces the snapshot with totals recomputed from the journal. */
  public void reset(
      BigDecimal totalDebit,
      BigDecimal totalCredit,
      BigDecimal totalFunctionalDebit,
      BigDecimal totalFunctionalCredit,
      NormalBalance normalBalance) {
    this.debit = totalDebit;
    this.credit = totalCredit;
    this.balance = normalBalance.orient(totalDebit, totalCredit);
    this.functionalBalance = normalBalance.orient(totalFunctionalDebit, totalFunctionalCredit);
    this.updatedAt = Instant.now();
  }

  public boolean isZero() {
    return balance.signum() == 0;
  }

  public BigDecimal getDebit() {
    return debit;
  }

  public BigDecimal getCredit() {
    return credit;
  }

  public BigDecimal getBalance() {
    return balance;
  }

  public BigDecimal getFunctionalBalance() {
    return functionalBalance;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
