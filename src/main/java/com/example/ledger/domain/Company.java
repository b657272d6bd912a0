package com.example.ledger.domain;

import java.time.Instant;

import jakarta.persistence.*;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * A company owning its own chart of accounts and journal. All ledger data is scoped by company.
 * The fiscal year start month drives fiscal period derivation for every journal entry.
 */
@Entity
@Table(name = "company")
public class Company {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @NotBlank
  @Size(max = 100)
  @Column(nullable = false, length = 100)
  private String name;

  @NotBlank
  @Size(min = 3, max = 3)
  @Column(name = "functional_currency", nullable = false, length = 3)
  private String functionalCurrency;

  @Min(1)
  @Max(12)
  @Column(name = "fiscal_year_start_month", nullable = false)
  private int fiscalYearStartMonth = 7;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @PrePersist
  protected void onCreate() {
    createdAt = Instant.now();
  }

  // Constructors
  public Company() {}

  public Company(String name, String functionalCurrency, int fiscalYearStartMonth) {
    this.name = name;
    this.functionalCurrency = functionalCurrency;
    this.fiscalYearStartMonth = fiscalYearStartMonth;
  }

  // Getters and Setters
  public Long getId() {
    return id;
  }

  public void setId(Long id) {
    this.id = id;
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public String getFunctionalCurrency() {
    return functionalCurrency;
  }

  public void setFunctionalCurrency(String functionalCurrency) {
    this.functionalCurrency = functionalCurrency;
  }

  public int getFiscalYearStartMonth() {
    return fiscalYearStartMonth;
  }

  public void setFiscalYearStartMonth(int fiscalYearStartMonth) {
    this.fiscalYearStartMonth = fiscalYearStartMonth;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
