package com.example.ledger.service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.example.ledger.domain.Account;
import com.example.ledger.domain.ApprovalAction;
import com.example.ledger.domain.Company;
import com.example.ledger.domain.FiscalCalendar;
import com.example.ledger.domain.FiscalPeriod;
import com.example.ledger.domain.JournalEntry;
import com.example.ledger.domain.JournalLine;
import com.example.ledger.domain.JournalSource;
import com.example.ledger.domain.JournalStatus;
import com.example.ledger.domain.JournalType;
import com.example.ledger.dto.JournalEntryCreateRequest;
import com.example.ledger.dto.JournalEntryUpdateRequest;
import com.example.ledger.dto.JournalFilter;
import com.example.ledger.dto.JournalLineRequest;
import com.example.ledger.exception.ConflictException;
import com.example.ledger.exception.ImbalanceException;
import com.example.ledger.exception.InvariantViolationException;
import com.example.ledger.exception.NotFoundException;
import com.example.ledger.exception.ValidationException;
import com.example.ledger.repository.AccountRepository;
import com.example.ledger.repository.JournalEntryRepository;

/**
 * Owns the journal entry lifecycle: creation and editing of drafts, approval, posting, reversal
 * and voiding.
 *
 * <ul>
 *   <li>Every entry must balance: total debits and credits may differ by less than the tolerance
 *   <li>Lines may only reference existing, postable, non-archived accounts
 *   <li>Only DRAFT entries can be edited; POSTED entries are immutable
 *   <li>POSTED entries are undone by a linked reversing entry, never voided or deleted
 * </ul>
 */
@Service
@Transactional
public class JournalEntryService {

  private static final Logger log = LoggerFactory.getLogger(JournalEntryService.class);

  // Column widths on journal_entry and journal_line
  static final int MAX_DESCRIPTION_LENGTH = 500;
  static final int MAX_SOURCE_REFERENCE_LENGTH = 100;
  static final int MAX_LINE_DESCRIPTION_LENGTH = 255;

  static final String REVERSAL_LINE_PREFIX = "Reversal: ";

  @Value("${ledger.balance-tolerance:0.01}")
  private BigDecimal balanceTolerance = new BigDecimal("0.01");

  private final JournalEntryRepository journalEntryRepository;
  private final AccountRepository accountRepository;
  private final CompanyService companyService;
  private final BalanceService balanceService;
  private final JournalNumberService journalNumberService;
  private final AuditService auditService;

  public JournalEntryService(
      JournalEntryRepository journalEntryRepository,
      AccountRepository accountRepository,
      CompanyService companyService,
      BalanceService balanceService,
      JournalNumberService journalNumberService,
      AuditService auditService) {
    this.journalEntryRepository = journalEntryRepository;
    this.accountRepository = accountRepository;
    this.companyService = companyService;
    this.balanceService = balanceService;
    this.journalNumberService = journalNumberService;
    this.auditService = auditService;
  }

  /**
   * Validates and stores a new DRAFT entry. Nothing is persisted if any check fails.
   *
   * @throws ValidationException if the date, lines, amounts, exchange rate or text lengths are
   *     malformed
   * @throws NotFoundException if a line references a missing account
   * @throws InvariantViolationException if a line references a non-postable account
   * @throws ImbalanceException if debits and credits do not balance
   */
  public JournalEntry create(Long companyId, String actor, JournalEntryCreateRequest request) {
    Company company = companyService.getById(companyId);
    if (request.date() == null) {
      throw new ValidationException("Journal entry date is required");
    }
    checkLength("Description", request.description(), MAX_DESCRIPTION_LENGTH);
    checkLength("Source reference", request.sourceReference(), MAX_SOURCE_REFERENCE_LENGTH);

    String currency =
        request.currency() != null
            ? request.currency().toUpperCase()
            : company.getFunctionalCurrency();
    BigDecimal exchangeRate = resolveExchangeRate(company, currency, request.exchangeRate());
    List<JournalLine> lines = buildLines(companyId, request.lines());

    JournalEntry entry = new JournalEntry(company, request.date(), currency, exchangeRate);
    entry.replaceLines(lines, company.getFunctionalCurrency());
    checkBalanced(entry);
    entry.setBalanced(true);

    FiscalPeriod period = FiscalCalendar.periodFor(company, request.date());
    entry.assignFiscalPeriod(period);
    entry.setType(request.type() != null ? request.type() : JournalType.STANDARD);
    entry.setSource(request.source() != null ? request.source() : JournalSource.MANUAL);
    entry.setSourceId(request.sourceId());
    entry.setSourceReference(request.sourceReference());
    entry.setDescription(request.description());
    entry.setAutoReverseDate(request.autoReverseDate());
    entry.setCreatedBy(actor);
    entry.setUpdatedBy(actor);

    // Numbers are assigned last so rejected entries never consume one
    entry.setJournalNumber(journalNumberService.assignNumber(companyId, period.fiscalYear()));
    entry = journalEntryRepository.save(entry);

    log.info(
        "Created journal {} dated {} (FY{} P{}) for {}",
        entry.getJournalNumber(),
        entry.getDate(),
        entry.getFiscalYear(),
        entry.getFiscalPeriod(),
        entry.getTotalDebits());
    auditService.logEvent(
        company,
        actor,
        "JOURNAL_CREATED",
        "JournalEntry",
        entry.getId(),
        "Created journal: " + entry.getJournalNumber());
    return entry;
  }

  /**
   * Edits a DRAFT entry. Replacing the lines re-runs every check of {@link #create}. A new date
   * re-derives the fiscal period; the journal number keeps the year it was issued in.
   *
   * @throws ConflictException if the entry is not a draft
   */
  public JournalEntry update(
      Long companyId, Long journalId, String actor, JournalEntryUpdateRequest request) {
    JournalEntry entry = getById(companyId, journalId);
    if (!entry.isDraft()) {
      throw new ConflictException(
          "Only draft journal entries can be updated: "
              + entry.getJournalNumber()
              + " is "
              + entry.getStatus());
    }

    Map<String, Object> changes = new LinkedHashMap<>();
    if (request.date() != null && !request.date().equals(entry.getDate())) {
      changes.put("date", Map.of("from", entry.getDate().toString(), "to", request.date().toString()));
      entry.setDate(request.date());
      entry.assignFiscalPeriod(FiscalCalendar.periodFor(entry.getCompany(), request.date()));
    }
    if (request.description() != null) {
      checkLength("Description", request.description(), MAX_DESCRIPTION_LENGTH);
      entry.setDescription(request.description());
      changes.put("description", request.description());
    }
    if (request.lines() != null) {
      List<JournalLine> lines = buildLines(companyId, request.lines());
      entry.replaceLines(lines, entry.getCompany().getFunctionalCurrency());
      checkBalanced(entry);
      entry.setBalanced(true);
      changes.put("lines", lines.size());
    }

    entry.setUpdatedBy(actor);
    entry = journalEntryRepository.save(entry);
    auditService.logEvent(
        entry.getCompany(),
        actor,
        "JOURNAL_UPDATED",
        "JournalEntry",
        entry.getId(),
        "Updated journal: " + entry.getJournalNumber(),
        changes);
    return entry;
  }

  /**
   * Moves a DRAFT entry to APPROVED and records the approval.
   *
   * @throws ConflictException if the entry is not a draft
   */
  public JournalEntry approve(Long companyId, Long journalId, String actor, String comments) {
    JournalEntry entry = getById(companyId, journalId);
    if (!entry.isDraft()) {
      throw new ConflictException(
          "Only draft journal entries can be approved: "
              + entry.getJournalNumber()
              + " is "
              + entry.getStatus());
    }
    entry.markApproved(actor);
    entry.recordApproval(new ApprovalAction(ApprovalAction.Action.APPROVED, actor, comments));
    entry.setUpdatedBy(actor);
    entry = journalEntryRepository.save(entry);

    log.info("Approved journal {}", entry.getJournalNumber());
    auditService.logEvent(
        entry.getCompany(),
        actor,
        "JOURNAL_APPROVED",
        "JournalEntry",
        entry.getId(),
        "Approved journal: " + entry.getJournalNumber());
    return entry;
  }

  /**
   * Posts a DRAFT or APPROVED entry: its lines are applied to account balances and the entry
   * becomes immutable.
   *
   * @throws ConflictException if the entry is in any other state, including already POSTED
   */
  public JournalEntry post(Long companyId, Long journalId, String actor) {
    return postEntry(getById(companyId, journalId), actor);
  }

  /**
   * Reverses a POSTED entry. A new REVERSING entry with every line's debit and credit swapped is
   * created at {@code reversalDate} and posted immediately; the original becomes REVERSED. The two
   * entries are linked both ways and both stay in history.
   *
   * @return the posted reversing entry
   * @throws ConflictException if the entry was already reversed or is not posted
   */
  public JournalEntry reverse(
      Long companyId, Long journalId, String actor, LocalDate reversalDate, String description) {
    JournalEntry original = getById(companyId, journalId);
    if (original.getReversedById() != null || original.getStatus() == JournalStatus.REVERSED) {
      throw new ConflictException(
          "Journal has already been reversed: " + original.getJournalNumber());
    }
    if (!original.isPosted()) {
      throw new ConflictException(
          "Only posted journal entries can be reversed: "
              + original.getJournalNumber()
              + " is "
              + original.getStatus());
    }
    if (reversalDate == null) {
      throw new ValidationException("Reversal date is required");
    }

    List<JournalLineRequest> swapped = new ArrayList<>();
    for (JournalLine line : original.getLines()) {
      swapped.add(
          new JournalLineRequest(
              line.getAccountId(),
              reversalLineDescription(line),
              line.getCredit(),
              line.getDebit(),
              line.getDimensions() != null ? line.getDimensions().copy() : null));
    }
    JournalEntryCreateRequest reversalRequest =
        new JournalEntryCreateRequest(
            reversalDate,
            description != null ? description : defaultReversalDescription(original),
            JournalType.REVERSING,
            original.getSource(),
            original.getId(),
            "Reversal of " + original.getJournalNumber(),
            original.getCurrency(),
            original.getExchangeRate(),
            null,
            swapped);

    JournalEntry reversal = create(companyId, actor, reversalRequest);
    reversal.markAsReversalOf(original.getId());
    reversal = postEntry(reversal, actor);

    original.setStatus(JournalStatus.REVERSED);
    original.setReversedById(reversal.getId());
    original.setUpdatedBy(actor);
    journalEntryRepository.save(original);

    log.info("Reversed journal {} with {}", original.getJournalNumber(), reversal.getJournalNumber());
    auditService.logEvent(
        original.getCompany(),
        actor,
        "JOURNAL_REVERSED",
        "JournalEntry",
        original.getId(),
        "Reversed journal " + original.getJournalNumber() + " by " + reversal.getJournalNumber(),
        Map.of("reversalId", reversal.getId(), "reversalDate", reversalDate.toString()));
    return reversal;
  }

  /**
   * Voids a DRAFT or APPROVED entry. The reason is kept in the approval history. Voided entries
   * never touched balances, so nothing else changes.
   *
   * @throws ValidationException if no reason is given
   * @throws ConflictException if the entry is POSTED, REVERSED or already VOID
   */
  public JournalEntry voidEntry(Long companyId, Long journalId, String actor, String reason) {
    if (reason == null || reason.isBlank()) {
      throw new ValidationException("A reason is required to void a journal entry");
    }
    JournalEntry entry = getById(companyId, journalId);
    if (entry.getStatus() == JournalStatus.VOID) {
      throw new ConflictException("Journal is already void: " + entry.getJournalNumber());
    }
    if (!entry.getStatus().isVoidable()) {
      throw new ConflictException(
          "Posted journals must be reversed, not voided: "
              + entry.getJournalNumber()
              + " is "
              + entry.getStatus());
    }
    entry.setStatus(JournalStatus.VOID);
    entry.recordApproval(
        new ApprovalAction(ApprovalAction.Action.REJECTED, actor, "Voided: " + reason));
    entry.setUpdatedBy(actor);
    entry = journalEntryRepository.save(entry);

    log.info("Voided journal {}: {}", entry.getJournalNumber(), reason);
    auditService.logEvent(
        entry.getCompany(),
        actor,
        "JOURNAL_VOIDED",
        "JournalEntry",
        entry.getId(),
        "Voided journal " + entry.getJournalNumber() + ": " + reason);
    return entry;
  }

  @Transactional(readOnly = true)
  public Optional<JournalEntry> findById(Long companyId, Long journalId) {
    return journalEntryRepository.findByCompanyIdAndId(companyId, journalId);
  }

  @Transactional(readOnly = true)
  public JournalEntry getById(Long companyId, Long journalId) {
    return journalEntryRepository
        .findByCompanyIdAndId(companyId, journalId)
        .orElseThrow(() -> new NotFoundException("Journal entry not found: " + journalId));
  }

  @Transactional(readOnly = true)
  public Optional<JournalEntry> findByNumber(Long companyId, String journalNumber) {
    return journalEntryRepository.findByCompanyIdAndJournalNumber(companyId, journalNumber);
  }

  /** Entries matching the filter, most recent first. */
  @Transactional(readOnly = true)
  public List<JournalEntry> search(Long companyId, JournalFilter filter) {
    JournalFilter criteria = filter != null ? filter : JournalFilter.all();
    List<JournalEntry> candidates =
        criteria.fiscalYear() != null
            ? journalEntryRepository.findByCompanyIdAndFiscalYear(companyId, criteria.fiscalYear())
            : journalEntryRepository.findByCompanyId(companyId);
    return candidates.stream().filter(criteria::matches).toList();
  }

  private static String defaultReversalDescription(JournalEntry original) {
    String base = "Reversal of " + original.getJournalNumber();
    return original.getDescription() != null
        ? truncate(base + ": " + original.getDescription(), MAX_DESCRIPTION_LENGTH)
        : base;
  }

  private static String reversalLineDescription(JournalLine line) {
    if (line.getDescription() == null) {
      return null;
    }
    return truncate(REVERSAL_LINE_PREFIX + line.getDescription(), MAX_LINE_DESCRIPTION_LENGTH);
  }

  private static String truncate(String value, int maxLength) {
    return value.length() > maxLength ? value.substring(0, maxLength) : value;
  }

  private static void checkLength(String field, String value, int maxLength) {
    if (value != null && value.length() > maxLength) {
      throw new ValidationException(
          field + " must be at most " + maxLength + " characters, got " + value.length());
    }
  }

  private JournalEntry postEntry(JournalEntry entry, String actor) {
    if (!entry.getStatus().isPostable()) {
      throw new ConflictException(
          "Only draft or approved journal entries can be posted: "
              + entry.getJournalNumber()
              + " is "
              + entry.getStatus());
    }
    checkBalanced(entry);

    balanceService.applyPosting(entry.getCompany().getId(), entry.getLines());
    entry.markPosted(actor);
    entry.setUpdatedBy(actor);
    entry = journalEntryRepository.save(entry);

    log.info("Posted journal {} ({} lines)", entry.getJournalNumber(), entry.getLines().size());
    auditService.logEvent(
        entry.getCompany(),
        actor,
        "JOURNAL_POSTED",
        "JournalEntry",
        entry.getId(),
        "Posted journal: " + entry.getJournalNumber());
    return entry;
  }

  private List<JournalLine> buildLines(Long companyId, List<JournalLineRequest> requests) {
    if (requests == null || requests.isEmpty()) {
      throw new ValidationException("Journal entry requires at least one line");
    }
    List<JournalLine> lines = new ArrayList<>();
    for (JournalLineRequest request : requests) {
      if (request.accountId() == null) {
        throw new ValidationException("Journal line account is required");
      }
      checkLength("Line description", request.description(), MAX_LINE_DESCRIPTION_LENGTH);
      BigDecimal debit = checkAmount(request.debit());
      BigDecimal credit = checkAmount(request.credit());

      Account account =
          accountRepository
              .findByCompanyIdAndId(companyId, request.accountId())
              .orElseThrow(
                  () -> new NotFoundException("Account not found: " + request.accountId()));
      if (!account.isPostable()) {
        throw new InvariantViolationException("Account " + account.getCode() + " is not postable");
      }
      if (account.isArchived()) {
        throw new InvariantViolationException("Account " + account.getCode() + " is archived");
      }

      JournalLine line = new JournalLine(account, debit, credit);
      line.setDescription(request.description());
      line.setDimensions(request.dimensions());
      lines.add(line);
    }
    return lines;
  }

  private BigDecimal checkAmount(BigDecimal amount) {
    if (amount == null) {
      return BigDecimal.ZERO;
    }
    if (amount.signum() < 0) {
      throw new ValidationException("Journal line amounts cannot be negative: " + amount);
    }
    if (amount.stripTrailingZeros().scale() > 2) {
      throw new ValidationException("Journal line amounts allow at most 2 decimals: " + amount);
    }
    return amount;
  }

  private BigDecimal resolveExchangeRate(Company company, String currency, BigDecimal rate) {
    if (currency.length() != 3) {
      throw new ValidationException("Currency must be a 3-letter code: " + currency);
    }
    if (currency.equals(company.getFunctionalCurrency())) {
      return BigDecimal.ONE;
    }
    if (rate == null || rate.signum() <= 0) {
      throw new ValidationException(
          "A positive exchange rate is required for " + currency + " entries");
    }
    return rate;
  }

  private void checkBalanced(JournalEntry entry) {
    if (entry.getImbalance().compareTo(balanceTolerance) >= 0) {
      throw new ImbalanceException(entry.getTotalDebits(), entry.getTotalCredits());
    }
  }
}
