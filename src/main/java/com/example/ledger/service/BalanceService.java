package com.example.ledger.service;

import java.math.BigDecimal;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.example.ledger.domain.Account;
import com.example.ledger.domain.JournalLine;
import com.example.ledger.domain.JournalStatus;
import com.example.ledger.exception.InvariantViolationException;
import com.example.ledger.exception.NotFoundException;
import com.example.ledger.repository.AccountRepository;
import com.example.ledger.repository.AccountTotals;
import com.example.ledger.repository.JournalLineRepository;

/**
 * The posting engine: the only write path to account balances.
 *
 * <p>A posting locks every affected account in ascending id order, adds the summed line deltas to
 * each account once and saves them, all inside the caller's transaction. Either every line of the
 * entry reaches the balances or none does. Guarding against posting the same entry twice is the
 * caller's job (the journal status gate).
 */
@Service
@Transactional
public class BalanceService {

  private static final Logger log = LoggerFactory.getLogger(BalanceService.class);

  /** Entry states whose lines are reflected in account balances. */
  static final Set<JournalStatus> BALANCE_EFFECT_STATUSES =
      EnumSet.allOf(JournalStatus.class).stream()
          .filter(JournalStatus::hasBalanceEffect)
          .collect(Collectors.toCollection(() -> EnumSet.noneOf(JournalStatus.class)));

  private final AccountRepository accountRepository;
  private final JournalLineRepository journalLineRepository;

  public BalanceService(
      AccountRepository accountRepository, JournalLineRepository journalLineRepository) {
    this.accountRepository = accountRepository;
    this.journalLineRepository = journalLineRepository;
  }

  /**
   * Adds the lines' debits and credits to the running balances of the referenced accounts.
   *
   * @throws NotFoundException if a referenced account no longer exists
   * @throws InvariantViolationException if a referenced account has been archived
   */
  public List<Account> applyPosting(Long companyId, List<JournalLine> lines) {
    // TreeMap keeps account ids ascending, matching the lock order of findAllForUpdate
    Map<Long, AccountTotals> deltas = new TreeMap<>();
    for (JournalLine line : lines) {
      deltas.merge(
          line.getAccountId(),
          new AccountTotals(
              line.getAccountId(),
              line.getDebit(),
              line.getCredit(),
              line.getFunctionalDebit(),
              line.getFunctionalCredit()),
          BalanceService::add);
    }

    List<Account> accounts = accountRepository.findAllForUpdate(companyId, deltas.keySet());
    if (accounts.size() != deltas.size()) {
      Set<Long> found = accounts.stream().map(Account::getId).collect(Collectors.toSet());
      Long missing =
          deltas.keySet().stream().filter(id -> !found.contains(id)).findFirst().orElse(null);
      throw new NotFoundException("Account not found: " + missing);
    }

    for (Account account : accounts) {
      if (account.isArchived()) {
        throw new InvariantViolationException(
            "Cannot post to archived account: " + account.getCode());
      }
      AccountTotals delta = deltas.get(account.getId());
      account
          .getBalance()
          .apply(
              delta.debit(),
              delta.credit(),
              delta.functionalDebit(),
              delta.functionalCredit(),
              account.getNormalBalance());
      log.debug(
          "Account {} += Dr {} / Cr {} -> balance {}",
          account.getCode(),
          delta.debit(),
          delta.credit(),
          account.getBalance().getBalance());
    }
    return accountRepository.saveAll(accounts);
  }

  /**
   * Recomputes every account snapshot of a company from the lines of posted and reversed
   * entries. Used to repair the cache; normal posting never calls this.
   */
  public List<Account> rebuildBalances(Long companyId) {
    Map<Long, AccountTotals> totals =
        journalLineRepository.sumByAccount(companyId, BALANCE_EFFECT_STATUSES).stream()
            .collect(Collectors.toMap(AccountTotals::accountId, Function.identity()));

    List<Long> accountIds =
        accountRepository.findByCompanyIdOrderByCode(companyId).stream()
            .map(Account::getId)
            .toList();
    if (accountIds.isEmpty()) {
      return List.of();
    }
    List<Account> accounts = accountRepository.findAllForUpdate(companyId, accountIds);

    int changed = 0;
    for (Account account : accounts) {
      AccountTotals sum = totals.getOrDefault(account.getId(), AccountTotals.empty(account.getId()));
      BigDecimal before = account.getBalance().getBalance();
      account
          .getBalance()
          .reset(
              sum.debit(),
              sum.credit(),
              sum.functionalDebit(),
              sum.functionalCredit(),
              account.getNormalBalance());
      if (before.compareTo(account.getBalance().getBalance()) != 0) {
        log.warn(
            "Balance of account {} corrected from {} to {}",
            account.getCode(),
            before,
            account.getBalance().getBalance());
        changed++;
      }
    }
    log.info("Rebuilt balances of {} accounts, {} corrected", accounts.size(), changed);
    return accountRepository.saveAll(accounts);
  }

  private static AccountTotals add(AccountTotals a, AccountTotals b) {
    return new AccountTotals(
        a.accountId(),
        a.debit().add(b.debit()),
        a.credit().add(b.credit()),
        a.functionalDebit().add(b.functionalDebit()),
        a.functionalCredit().add(b.functionalCredit()));
  }
}
