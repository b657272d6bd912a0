package com.example.ledger.service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.example.ledger.domain.Account;
import com.example.ledger.domain.AccountSubType;
import com.example.ledger.domain.AccountType;
import com.example.ledger.domain.Company;
import com.example.ledger.dto.AccountCreateRequest;
import com.example.ledger.dto.AccountFilter;
import com.example.ledger.dto.AccountTreeNode;
import com.example.ledger.dto.AccountUpdateRequest;
import com.example.ledger.exception.ConflictException;
import com.example.ledger.exception.ForbiddenException;
import com.example.ledger.exception.InvariantViolationException;
import com.example.ledger.exception.NotFoundException;
import com.example.ledger.exception.ValidationException;
import com.example.ledger.repository.AccountRepository;

/**
 * Owns the chart of accounts: creation, re-parenting, archival and tree queries. Balances are
 * read-only here; only {@link BalanceService} writes them.
 */
@Service
@Transactional
public class AccountService {

  private static final Logger log = LoggerFactory.getLogger(AccountService.class);

  @Value("${ledger.account-code-length:6}")
  private int accountCodeLength = 6;

  private final AccountRepository accountRepository;
  private final CompanyService companyService;
  private final AuditService auditService;

  public AccountService(
      AccountRepository accountRepository,
      CompanyService companyService,
      AuditService auditService) {
    this.accountRepository = accountRepository;
    this.companyService = companyService;
    this.auditService = auditService;
  }

  /**
   * Creates a new account with a zero balance.
   *
   * @throws ValidationException if the code is malformed or already used
   * @throws NotFoundException if the parent does not exist
   * @throws InvariantViolationException if the parent or sub-type belongs to another type
   */
  public Account create(Long companyId, String actor, AccountCreateRequest request) {
    Company company = companyService.getById(companyId);
    validateNewAccount(companyId, request);

    String currency =
        request.currency() != null
            ? request.currency().toUpperCase()
            : company.getFunctionalCurrency();
    Account account =
        new Account(company, request.code(), request.name(), request.type(), currency);
    account.setDescription(request.description());
    account.setSubType(request.subType());
    account.markHeader(request.header());

    Account parent = null;
    if (request.parentId() != null) {
      parent = loadParent(companyId, request.parentId(), request.type());
    }
    account.placeUnder(parent);
    account.setCreatedBy(actor);
    account.setUpdatedBy(actor);
    account = accountRepository.save(account);

    log.info("Created account {} - {} at {}", account.getCode(), account.getName(), account.getPath());
    auditService.logEvent(
        company,
        actor,
        "ACCOUNT_CREATED",
        "Account",
        account.getId(),
        "Created account: " + account.getCode() + " - " + account.getName());
    return account;
  }

  /**
   * Applies a partial update. Archiving through update goes through the same guards as {@link
   * #archive}; moving to a new parent recomputes level, ancestry and path for the account and all
   * of its descendants.
   *
   * @throws ForbiddenException if a system account would be archived
   */
  public Account update(Long companyId, Long accountId, String actor, AccountUpdateRequest request) {
    Account account = getById(companyId, accountId);
    Map<String, Object> changes = new LinkedHashMap<>();

    if (request.status() == Account.Status.ARCHIVED && !account.isArchived()) {
      checkArchivable(account);
    }

    if (request.name() != null && !request.name().equals(account.getName())) {
      if (request.name().isBlank()) {
        throw new ValidationException("Account name is required");
      }
      changes.put("name", Map.of("from", account.getName(), "to", request.name()));
      account.setName(request.name());
    }
    if (request.description() != null
        && !request.description().equals(account.getDescription())) {
      changes.put(
          "description",
          Map.of(
              "from", account.getDescription() != null ? account.getDescription() : "",
              "to", request.description()));
      account.setDescription(request.description());
    }
    if (request.subType() != null && request.subType() != account.getSubType()) {
      checkSubType(account.getType(), request.subType());
      changes.put(
          "subType",
          Map.of(
              "from", account.getSubType() != null ? account.getSubType().name() : "",
              "to", request.subType().name()));
      account.setSubType(request.subType());
    }
    if (request.status() != null && request.status() != account.getStatus()) {
      changes.put(
          "status", Map.of("from", account.getStatus().name(), "to", request.status().name()));
      account.setStatus(request.status());
    }
    if (request.changeParent() && !Objects.equals(request.parentId(), account.getParentId())) {
      Account newParent = null;
      if (request.parentId() != null) {
        newParent = loadParent(companyId, request.parentId(), account.getType());
        if (newParent.getId().equals(account.getId())
            || newParent.getAncestorIds().contains(account.getId())) {
          throw new InvariantViolationException(
              "Account " + account.getCode() + " cannot be moved under its own descendant");
        }
      }
      changes.put(
          "parent",
          Map.of(
              "from", account.getParentId() != null ? account.getParentId() : "",
              "to", request.parentId() != null ? request.parentId() : ""));
      account.placeUnder(newParent);
      refreshDescendants(account);
    }

    if (changes.isEmpty()) {
      return account;
    }
    account.setUpdatedBy(actor);
    Account saved = accountRepository.save(account);
    log.info("Updated account {}: {}", saved.getCode(), changes.keySet());
    auditService.logEvent(
        saved.getCompany(),
        actor,
        "ACCOUNT_UPDATED",
        "Account",
        saved.getId(),
        "Updated account: " + saved.getCode(),
        changes);
    return saved;
  }

  /**
   * Soft-deletes an account by moving it to ARCHIVED. Accounts are never hard deleted.
   *
   * @throws ForbiddenException for system accounts
   * @throws ConflictException if the balance is not zero or live child accounts exist
   */
  public Account archive(Long companyId, Long accountId, String actor) {
    Account account = getById(companyId, accountId);
    if (account.isArchived()) {
      throw new ConflictException("Account is already archived: " + account.getCode());
    }
    checkArchivable(account);
    account.setStatus(Account.Status.ARCHIVED);
    account.setUpdatedBy(actor);
    account = accountRepository.save(account);

    log.info("Archived account {}", account.getCode());
    auditService.logEvent(
        account.getCompany(),
        actor,
        "ACCOUNT_ARCHIVED",
        "Account",
        account.getId(),
        "Archived account: " + account.getCode());
    return account;
  }

  /** Builds the forest of active accounts, each sibling group sorted by code. */
  @Transactional(readOnly = true)
  public List<AccountTreeNode> getTree(Long companyId) {
    List<Account> accounts =
        accountRepository.findByCompanyIdAndStatusOrderByCode(companyId, Account.Status.ACTIVE);

    Map<Long, AccountTreeNode> nodes = new HashMap<>();
    for (Account account : accounts) {
      nodes.put(account.getId(), AccountTreeNode.of(account));
    }

    List<AccountTreeNode> roots = new ArrayList<>();
    for (Account account : accounts) {
      AccountTreeNode node = nodes.get(account.getId());
      AccountTreeNode parent = account.getParentId() != null ? nodes.get(account.getParentId()) : null;
      if (parent != null) {
        parent.children().add(node);
      } else {
        // Parents that are inactive or archived drop out, leaving their children at the root
        roots.add(node);
      }
    }
    AccountTreeNode.sortByCode(roots);
    return roots;
  }

  @Transactional(readOnly = true)
  public List<Account> findAll(Long companyId, AccountFilter filter) {
    AccountFilter criteria = filter != null ? filter : AccountFilter.all();
    return accountRepository.findByCompanyIdOrderByCode(companyId).stream()
        .filter(criteria::matches)
        .toList();
  }

  @Transactional(readOnly = true)
  public Optional<Account> findById(Long companyId, Long accountId) {
    return accountRepository.findByCompanyIdAndId(companyId, accountId);
  }

  @Transactional(readOnly = true)
  public Account getById(Long companyId, Long accountId) {
    return accountRepository
        .findByCompanyIdAndId(companyId, accountId)
        .orElseThrow(() -> new NotFoundException("Account not found: " + accountId));
  }

  @Transactional(readOnly = true)
  public Optional<Account> findByCode(Long companyId, String code) {
    return accountRepository.findByCompanyIdAndCode(companyId, code);
  }

  @Transactional(readOnly = true)
  public Account getByCode(Long companyId, String code) {
    return findByCode(companyId, code)
        .orElseThrow(() -> new NotFoundException("Account not found: " + code));
  }

  @Transactional(readOnly = true)
  public Optional<Account> findBySystemKey(Long companyId, String systemKey) {
    return accountRepository.findByCompanyIdAndSystemKey(companyId, systemKey);
  }

  /**
   * Creates the standard chart of accounts for a company that has none yet. Detail accounts are
   * flagged as system accounts.
   *
   * @throws ConflictException if the company already has accounts
   */
  public List<Account> initializeDefaultChart(Long companyId, String actor) {
    Company company = companyService.getById(companyId);
    if (accountRepository.countByCompanyId(companyId) > 0) {
      throw new ConflictException("Company already has a chart of accounts: " + company.getName());
    }

    Map<String, Account> byCode = new HashMap<>();
    List<Account> created = new ArrayList<>();
    for (DefaultChartOfAccounts.Template template : DefaultChartOfAccounts.templates()) {
      Account account =
          new Account(
              company,
              template.code(),
              template.name(),
              template.type(),
              template.currency() != null ? template.currency() : company.getFunctionalCurrency());
      account.setSubType(template.subType());
      account.markHeader(template.header());
      account.setSystem(template.systemKey() != null);
      account.setSystemKey(template.systemKey());
      account.placeUnder(template.parentCode() != null ? byCode.get(template.parentCode()) : null);
      account.setCreatedBy(actor);
      account.setUpdatedBy(actor);
      account = accountRepository.save(account);
      byCode.put(account.getCode(), account);
      created.add(account);
    }

    log.info("Initialized default chart of {} accounts for {}", created.size(), company.getName());
    auditService.logEvent(
        company,
        actor,
        "CHART_INITIALIZED",
        "Company",
        company.getId(),
        "Created default chart of accounts (" + created.size() + " accounts)");
    return created;
  }

  private void validateNewAccount(Long companyId, AccountCreateRequest request) {
    if (request.code() == null
        || !Pattern.matches("\\d{" + accountCodeLength + "}", request.code())) {
      throw new ValidationException(
          "Account code must be exactly " + accountCodeLength + " digits: " + request.code());
    }
    if (request.name() == null || request.name().isBlank()) {
      throw new ValidationException("Account name is required");
    }
    if (request.type() == null) {
      throw new ValidationException("Account type is required");
    }
    if (request.currency() != null && request.currency().length() != 3) {
      throw new ValidationException("Currency must be a 3-letter code: " + request.currency());
    }
    if (accountRepository.existsByCompanyIdAndCode(companyId, request.code())) {
      throw new ValidationException("Account code already exists: " + request.code());
    }
    if (request.subType() != null) {
      checkSubType(request.type(), request.subType());
    }
  }

  private Account loadParent(Long companyId, Long parentId, AccountType childType) {
    Account parent =
        accountRepository
            .findByCompanyIdAndId(companyId, parentId)
            .orElseThrow(() -> new NotFoundException("Parent account not found: " + parentId));
    if (parent.getType() != childType) {
      throw new InvariantViolationException(
          "Child account must have same type as parent: parent "
              + parent.getCode()
              + " is "
              + parent.getType()
              + ", child is "
              + childType);
    }
    return parent;
  }

  private void checkSubType(AccountType type, AccountSubType subType) {
    if (!subType.belongsTo(type)) {
      throw new InvariantViolationException(
          "Sub-type " + subType + " does not belong to account type " + type);
    }
  }

  private void checkArchivable(Account account) {
    if (account.isSystem()) {
      throw new ForbiddenException("Cannot archive system account: " + account.getCode());
    }
    if (!account.getBalance().isZero()) {
      throw new ConflictException(
          "Cannot archive account with non-zero balance: "
              + account.getCode()
              + " ("
              + account.getBalance().getBalance()
              + ")");
    }
    if (accountRepository.existsLiveChild(account.getId())) {
      throw new ConflictException(
          "Cannot archive account with child accounts: " + account.getCode());
    }
  }

  private void refreshDescendants(Account account) {
    for (Account child : accountRepository.findByParentId(account.getId())) {
      child.placeUnder(account);
      accountRepository.save(child);
      refreshDescendants(child);
    }
  }
}
