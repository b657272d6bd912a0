package com.example.ledger.domain;

import java.math.BigDecimal;
import java.math.RoundingMode;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * One debit and/or credit line of a journal entry. The account code and name are copied from the
 * account when the line is built, so historical entries keep showing the account as it was.
 */
@Entity
@Table(
    name = "journal_line",
    indexes = {
      @Index(name = "idx_journal_line_entry", columnList = "journal_entry_id"),
      @Index(name = "idx_journal_line_account", columnList = "account_id")
    })
public class JournalLine {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "journal_entry_id", nullable = false)
  private JournalEntry journalEntry;

  @Column(name = "line_number", nullable = false)
  private int lineNumber;

  @NotNull
  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "account_id", nullable = false)
  private Account account;

  @NotNull
  @Column(name = "account_code", nullable = false, length = 20)
  private String accountCode;

  @NotNull
  @Column(name = "account_name", nullable = false, length = 100)
  private String accountName;

  @Size(max = 255)
  @Column(length = 255)
  private String description;

  @NotNull
  @Column(nullable = false, precision = 19, scale = 2)
  private BigDecimal debit = BigDecimal.ZERO;

  @NotNull
  @Column(nullable = false, precision = 19, scale = 2)
  private BigDecimal credit = BigDecimal.ZERO;

  @Column(nullable = false, length = 3)
  private String currency;

  @Column(name = "exchange_rate", nullable = false, precision = 19, scale = 6)
  private BigDecimal exchangeRate = BigDecimal.ONE;

  @Column(name = "functional_debit", nullable = false, precision = 19, scale = 2)
  private BigDecimal functionalDebit = BigDecimal.ZERO;

  @Column(name = "functional_credit", nullable = false, precision = 19, scale = 2)
  private BigDecimal functionalCredit = BigDecimal.ZERO;

  @Embedded private LineDimensions dimensions;

  // Constructors
  public JournalLine() {}

  public JournalLine(Account account, BigDecimal debit, BigDecimal credit) {
    this.account = account;
    this.accountCode = account.getCode();
    this.accountName = account.getName();
    this.debit = debit != null ? debit : BigDecimal.ZERO;
    this.credit = credit != null ? credit : BigDecimal.ZERO;
  }

  /**
   * Stamps the entry's currency and rate onto the line and derives the functional amounts. Lines
   * already in the functional currency convert at 1.
   */
  public void convert(String lineCurrency, BigDecimal rate, String functionalCurrency) {
    this.currency = lineCurrency;
    this.exchangeRate = lineCurrency.equals(functionalCurrency) ? BigDecimal.ONE : rate;
    this.functionalDebit = debit.multiply(exchangeRate).setScale(2, RoundingMode.HALF_UP);
    this.functionalCredit = credit.multiply(exchangeRate).setScale(2, RoundingMode.HALF_UP);
  }

  // Getters and Setters
  public Long getId() {
    return id;
  }

  public JournalEntry getJournalEntry() {
    return journalEntry;
  }

  void setJournalEntry(JournalEntry journalEntry) {
    this.journalEntry = journalEntry;
  }

  public int getLineNumber() {
    return lineNumber;
  }

  void setLineNumber(int lineNumber) {
    this.lineNumber = lineNumber;
  }

  public Account getAccount() {
    return account;
  }

  public Long getAccountId() {
    return account.getId();
  }

  public String getAccountCode() {
    return accountCode;
  }

  public String getAccountName() {
    return accountName;
  }

  public String getDescription() {
    return description;
  }

  public void setDescription(String description) {
    this.description = description;
  }

  public BigDecimal getDebit() {
    return debit;
  }

  public BigDecimal getCredit() {
    return credit;
  }

  public String getCurrency() {
    return currency;
  }

  public BigDecimal getExchangeRate() {
    return exchangeRate;
  }

  public BigDecimal getFunctionalDebit() {
    return functionalDebit;
  }

  public BigDecimal getFunctionalCredit() {
    return functionalCredit;
  }

  public LineDimensions getDimensions() {
    return dimensions;
  }

  public void setDimensions(LineDimensions dimensions) {
    this.dimensions = dimensions;
  }
}
