package com.example.ledger.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;

/**
 * Counter row holding the next journal sequence number for one company and fiscal year. Rows are
 * read under a pessimistic write lock so concurrent entry creation never reuses a number.
 */
@Entity
@Table(
    name = "journal_sequence",
    uniqueConstraints = {
      @UniqueConstraint(
          name = "uk_journal_sequence_company_year",
          columnNames = {"company_id", "fiscal_year"})
    })
public class JournalSequence {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @NotNull
  @Column(name = "company_id", nullable = false)
  private Long companyId;

  @Column(name = "fiscal_year", nullable = false)
  private int fiscalYear;

  @Column(name = "next_number", nullable = false)
  private long nextNumber = 1;

  public JournalSequence() {}

  public JournalSequence(Long companyId, int fiscalYear) {
    this.companyId = companyId;
    this.fiscalYear = fiscalYear;
  }

  /** Returns the current number and advances the counter. */
  public long take() {
    return nextNumber++;
  }

  public static String format(int fiscalYear, long sequence) {
    return String.format("JE-%d-%06d", fiscalYear, sequence);
  }

  public Long getId() {
    return id;
  }

  public Long getCompanyId() {
    return companyId;
  }

  public int getFiscalYear() {
    return fiscalYear;
  }

  public long getNextNumber() {
    return nextNumber;
  }
}
