package com.example.ledger.domain;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * An account in a company's chart of accounts. Accounts form a tree: a child always shares its
 * parent's type, and its level is one deeper than the parent's, capped at DETAIL.
 *
 * <p>Header accounts group children and cannot be posted to. The embedded {@link AccountBalance}
 * is written only by the posting engine.
 */
@Entity
@Table(
    name = "account",
    uniqueConstraints = {
      @UniqueConstraint(
          name = "uk_account_company_code",
          columnNames = {"company_id", "code"})
    },
    indexes = {
      @Index(name = "idx_account_company_type", columnList = "company_id, type"),
      @Index(name = "idx_account_parent", columnList = "parent_id")
    })
public class Account {

  public enum Status {
    ACTIVE,
    INACTIVE,
    ARCHIVED
  }

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Version private Long version;

  @NotNull
  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "company_id", nullable = false)
  private Company company;

  @NotBlank
  @Size(max = 20)
  @Column(nullable = false, length = 20)
  private String code;

  @NotBlank
  @Size(max = 100)
  @Column(nullable = false, length = 100)
  private String name;

  @Size(max = 500)
  @Column(length = 500)
  private String description;

  @NotNull
  @Enumerated(EnumType.STRING)
  @Column(nullable = false, length = 20)
  private AccountType type;

  @Enumerated(EnumType.STRING)
  @Column(name = "sub_type", length = 30)
  private AccountSubType subType;

  @NotNull
  @Enumerated(EnumType.STRING)
  @Column(nullable = false, length = 10)
  private AccountLevel level = AccountLevel.TYPE;

  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "parent_id")
  private Account parent;

  /** Ids from the tree root down to the direct parent. */
  @ElementCollection(fetch = FetchType.EAGER)
  @CollectionTable(name = "account_ancestor", joinColumns = @JoinColumn(name = "account_id"))
  @OrderColumn(name = "depth")
  @Column(name = "ancestor_id", nullable = false)
  private List<Long> ancestorIds = new ArrayList<>();

  @NotBlank
  @Column(nullable = false, length = 200)
  private String path;

  @Column(name = "is_header", nullable = false)
  private boolean header = false;

  @Column(name = "is_postable", nullable = false)
  private boolean postable = true;

  @Column(name = "is_system", nullable = false)
  private boolean system = false;

  @Size(max = 50)
  @Column(name = "system_key", length = 50)
  private String systemKey;

  @NotBlank
  @Size(min = 3, max = 3)
  @Column(nullable = false, length = 3)
  private String currency;

  @NotNull
  @Enumerated(EnumType.STRING)
  @Column(nullable = false, length = 10)
  private Status status = Status.ACTIVE;

  @Embedded private AccountBalance balance = AccountBalance.zero();

  @Column(name = "created_by", length = 100)
  private String createdBy;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_by", length = 100)
  private String updatedBy;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

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
  public Account() {}

  public Account(Company company, String code, String name, AccountType type, String currency) {
    this.company = company;
    this.code = code;
    this.name = name;
    this.type = type;
    this.currency = currency;
    this.path = code;
  }

  /**
   * Places this account under the given parent, recomputing level, ancestry and path. Passing
   * null makes it a root account.
   */
  public void placeUnder(Account newParent) {
    this.parent = newParent;
    this.ancestorIds = new ArrayList<>();
    if (newParent == null) {
      this.level = AccountLevel.TYPE;
      this.path = code;
      return;
    }
    this.level = newParent.getLevel().childLevel();
    this.ancestorIds.addAll(newParent.getAncestorIds());
    this.ancestorIds.add(newParent.getId());
    this.path = newParent.getPath() + "/" + code;
  }

  /** Sets the header flag; postable is kept as its complement. */
  public void markHeader(boolean isHeader) {
    this.header = isHeader;
    this.postable = !isHeader;
  }

  public NormalBalance getNormalBalance() {
    return type.getNormalBalance();
  }

  public boolean isActive() {
    return status == Status.ACTIVE;
  }

  public boolean isArchived() {
    return status == Status.ARCHIVED;
  }

  public Long getParentId() {
    return parent != null ? parent.getId() : null;
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

  public void setCompany(Company company) {
    this.company = company;
  }

  public String getCode() {
    return code;
  }

  public void setCode(String code) {
    this.code = code;
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public String getDescription() {
    return description;
  }

  public void setDescription(String description) {
    this.description = description;
  }

  public AccountType getType() {
    return type;
  }

  public void setType(AccountType type) {
    this.type = type;
  }

  public AccountSubType getSubType() {
    return subType;
  }

  public void setSubType(AccountSubType subType) {
    this.subType = subType;
  }

  public AccountLevel getLevel() {
    return level;
  }

  public void setLevel(AccountLevel level) {
    this.level = level;
  }

  public Account getParent() {
    return parent;
  }

  public List<Long> getAncestorIds() {
    return ancestorIds;
  }

  public String getPath() {
    return path;
  }

  public boolean isHeader() {
    return header;
  }

  public boolean isPostable() {
    return postable;
  }

  public boolean isSystem() {
    return system;
  }

  public void setSystem(boolean system) {
    this.system = system;
  }

  public String getSystemKey() {
    return systemKey;
  }

  public void setSystemKey(String systemKey) {
    this.systemKey = systemKey;
  }

  public String getCurrency() {
    return currency;
  }

  public void setCurrency(String currency) {
    this.currency = currency;
  }

  public Status getStatus() {
    return status;
  }

  public void setStatus(Status status) {
    this.status = status;
  }

  public AccountBalance getBalance() {
    return balance;
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

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Account)) return false;
    Account other = (Account) o;
    return id != null && id.equals(other.id);
  }

  @Override
  public int hashCode() {
    return getClass().hashCode();
  }
}
