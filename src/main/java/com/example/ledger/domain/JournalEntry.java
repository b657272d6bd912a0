package com.example.ledger.domain;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * A double-entry journal entry. Content is editable only while DRAFT; once POSTED the entry is
 * immutable and can only be undone by a reversing entry, which is linked both ways through
 * {@code reversalOfId} and {@code reversedById}.
 */
@Entity
@Table(
    name = "journal_entry",
    uniqueConstraints = {
      @UniqueConstraint(
          name = "uk_journal_company_number",
          columnNames = {"company_id", "journal_number"})
    },
    indexes = {
      @Index(name = "idx_journal_company_date", columnList = "company_id, entry_date"),
      @Index(
          name = "idx_journal_company_period",
          columnList = "company_id, fiscal_year, fiscal_period"),
      @Index(name = "idx_journal_company_status", columnList = "company_id, status")
    })
public class JournalEntry {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Version private Long version;

  @NotNull
  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "company_id", nullable = false)
  private Company company;

  @NotBlank
  @Column(name = "journal_number", nullable = false, length = 20)
  private String journalNumber;

  @NotNull
  @Column(name = "entry_date", nullable = false)
  private LocalDate date;

  @Column(name = "fiscal_year", nullable = false)
  private int fiscalYear;

  @Column(name = "fiscal_period", nullable = false)
  private int fiscalPeriod;

  @NotNull
  @Enumerated(EnumType.STRING)
  @Column(nullable = false, length = 20)
  private JournalType type = JournalType.STANDARD;

  @NotNull
  @Enumerated(EnumType.STRING)
  @Column(nullable = false, length = 20)
  private JournalSource source = JournalSource.MANUAL;

  @Column(name = "source_id")
  private Long sourceId;

  @Size(max = 100)
  @Column(name = "source_reference", length = 100)
  private String sourceReference;

  @Size(max = 500)
  @Column(length = 500)
  private String description;

  @OneToMany(mappedBy = "journalEntry", cascade = CascadeType.ALL, orphanRemoval = true)
  @OrderBy("lineNumber")
  private List<JournalLine> lines = new ArrayList<>();

  @Column(name = "total_debits", nullable = false, precision = 19, scale = 2)
  private BigDecimal totalDebits = BigDecimal.ZERO;

  @Column(name = "total_credits", nullable = false, precision = 19, scale = 2)
  private BigDecimal totalCredits = BigDecimal.ZERO;

  @Column(name = "functional_total_debits", nullable = false, precision = 19, scale = 2)
  private BigDecimal functionalTotalDebits = BigDecimal.ZERO;

  @Column(name = "functional_total_credits", nullable = false, precision = 19, scale = 2)
  private BigDecimal functionalTotalCredits = BigDecimal.ZERO;

  @Column(name = "is_balanced", nullable = false)
  private boolean balanced = false;

  @NotBlank
  @Column(nullable = false, length = 3)
  private String currency;

  @Column(name = "exchange_rate", nullable = false, precision = 19, scale = 6)
  private BigDecimal exchangeRate = BigDecimal.ONE;

  @NotNull
  @Enumerated(EnumType.STRING)
  @Column(nullable = false, length = 10)
  private JournalStatus status = JournalStatus.DRAFT;

  @Column(name = "is_reversal", nullable = false)
  private boolean reversal = false;

  @Column(name = "reversal_of_id")
  private Long reversalOfId;

  @Column(name = "reversed_by_id")
  private Long reversedById;

  @Column(name = "auto_reverse_date")
  private LocalDate autoReverseDate;

  @ElementCollection
  @CollectionTable(name = "journal_approval", joinColumns = @JoinColumn(name = "journal_entry_id"))
  @OrderColumn(name = "seq")
  private List<ApprovalAction> approvalHistory = new ArrayList<>();

  @Column(name = "created_by", length = 100)
  private String createdBy;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_by", length = 100)
  private String updatedBy;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  @Column(name = "approved_by", length = 100)
  private String approvedBy;

  @Column(name = "approved_at")
  private Instant approvedAt;

  @Column(name = "posted_by", length = 100)
  private String postedBy;

  @Column(name = "posted_at")
  private Instant postedAt;

  @PrePersist
  protected void onCreate() {
    createdAt = Instant.now();
    updatedAt = Instant.now();
  }

  @PreUpdate
  protected void onUpdate() {
    updatedAt = Instant.now();
  }

  // Constructors
  public JournalEntry() {}

  public JournalEntry(Company company, LocalDate date, String currency, BigDecimal exchangeRate) {
    this.company = company;
    this.date = date;
    this.currency = currency;
    this.exchangeRate = exchangeRate;
  }

  /**
   * Replaces all lines, renumbering them from 1, converting them to the functional currency and
   * recomputing the totals.
   */
  public void replaceLines(List<JournalLine> newLines, String functionalCurrency) {
    lines.clear();
    int lineNumber = 1;
    for (JournalLine line : newLines) {
      line.setJournalEntry(this);
      line.setLineNumber(lineNumber++);
      line.convert(currency, exchangeRate, functionalCurrency);
      lines.add(line);
    }
    recalculateTotals();
  }

  private void recalculateTotals() {
    totalDebits = BigDecimal.ZERO;
    totalCredits = BigDecimal.ZERO;
    functionalTotalDebits = BigDecimal.ZERO;
    functionalTotalCredits = BigDecimal.ZERO;
    for (JournalLine line : lines) {
      totalDebits = totalDebits.add(line.getDebit());
      totalCredits = totalCredits.add(line.getCredit());
      functionalTotalDebits = functionalTotalDebits.add(line.getFunctionalDebit());
      functionalTotalCredits = functionalTotalCredits.add(line.getFunctionalCredit());
    }
  }

  /** Absolute difference between total debits and total credits. */
  public BigDecimal getImbalance() {
    return totalDebits.subtract(totalCredits).abs();
  }

  public void assignFiscalPeriod(FiscalPeriod period) {
    this.fiscalYear = period.fiscalYear();
    this.fiscalPeriod = period.period();
  }

  public void recordApproval(ApprovalAction action) {
    approvalHistory.add(action);
  }

  public boolean isPosted() {
    return status == JournalStatus.POSTED;
  }

  public boolean isDraft() {
    return status == JournalStatus.DRAFT;
  }

  // Getters and Setters
  public Long getId() {
    return id;
  }

  public void setId(Long id) {
    this.id = id;
  }

  public Long getVersion() {
    return version;
  }

  public Company getCompany() {
    return company;
  }

  public String getJournalNumber() {
    return journalNumber;
  }

  public void setJournalNumber(String journalNumber) {
    this.journalNumber = journalNumber;
  }

  public LocalDate getDate() {
    return date;
  }

  public void setDate(LocalDate date) {
    this.date = date;
  }

  public int getFiscalYear() {
    return fiscalYear;
  }

  public int getFiscalPeriod() {
    return fiscalPeriod;
  }

  public JournalType getType() {
    return type;
  }

  public void setType(JournalType type) {
    this.type = type;
  }

  public JournalSource getSource() {
    return source;
  }

  public void setSource(JournalSource source) {
    this.source = source;
  }

  public Long getSourceId() {
    return sourceId;
  }

  public void setSourceId(Long sourceId) {
    this.sourceId = sourceId;
  }

  public String getSourceReference() {
    return sourceReference;
  }

  public void setSourceReference(String sourceReference) {
    this.sourceReference = sourceReference;
  }

  public String getDescription() {
    return description;
  }

  public void setDescription(String description) {
    this.description = description;
  }

  public List<JournalLine> getLines() {
    return lines;
  }

  public BigDecimal getTotalDebits() {
    return totalDebits;
  }

  public BigDecimal getTotalCredits() {
    return totalCredits;
  }

  public BigDecimal getFunctionalTotalDebits() {
    return functionalTotalDebits;
  }

  public BigDecimal getFunctionalTotalCredits() {
    return functionalTotalCredits;
  }

  public boolean isBalanced() {
    return balanced;
  }

  public void setBalanced(boolean balanced) {
    this.balanced = balanced;
  }

  public String getCurrency() {
    return currency;
  }

  public BigDecimal getExchangeRate() {
    return exchangeRate;
  }

  public JournalStatus getStatus() {
    return status;
  }

  public void setStatus(JournalStatus status) {
    this.status = status;
  }

  public boolean isReversal() {
    return reversal;
  }

  public Long getReversalOfId() {
    return reversalOfId;
  }

  public void markAsReversalOf(Long originalId) {
    this.reversal = true;
    this.reversalOfId = originalId;
  }

  public Long getReversedById() {
    return reversedById;
  }

  public void setReversedById(Long reversedById) {
    this.reversedById = reversedById;
  }

  public LocalDate getAutoReverseDate() {
    return autoReverseDate;
  }

  public void setAutoReverseDate(LocalDate autoReverseDate) {
    this.autoReverseDate = autoReverseDate;
  }

  public List<ApprovalAction> getApprovalHistory() {
    return approvalHistory;
  }

  public String getCreatedBy() {
    return createdBy;
  }

  public void setCreatedBy(String createdBy) {
    this.createdBy = createdBy;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public String getUpdatedBy() {
    return updatedBy;
  }

  public void setUpdatedBy(String updatedBy) {
    this.updatedBy = updatedBy;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public String getApprovedBy() {
    return approvedBy;
  }

  public Instant getApprovedAt() {
    return approvedAt;
  }

  public void markApproved(String actor) {
    this.status = JournalStatus.APPROVED;
    this.approvedBy = actor;
    this.approvedAt = Instant.now();
  }

  public String getPostedBy() {
    return postedBy;
  }

  public Instant getPostedAt() {
    return postedAt;
  }

  public void markPosted(String actor) {
    this.status = JournalStatus.POSTED;
    this.postedBy = actor;
    this.postedAt = Instant.now();
  }
}
