package com.example.ledger.service;

import com.example.ledger.domain.Account;
import com.example.ledger.domain.AccountType;
import com.example.ledger.domain.Company;
import com.example.ledger.domain.FiscalCalendar;
import com.example.ledger.domain.FiscalPeriod;
import com.example.ledger.exception.ValidationException;
import com.example.ledger.repository.AccountRepository;
import com.example.ledger.repository.AccountTotals;
import com.example.ledger.repository.JournalLineRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Service for generating the trial balance.
 * Each account with a non-zero balance appears once, in the debit column when its balance sits
 * on the debit side and in the credit column otherwise.
 * The account balance snapshots are read only when nothing posted is dated after the as-of date;
 * otherwise the posted journal lines up to that date are summed.
 */
@Service
@Transactional(readOnly = true)
public class TrialBalanceService {

    private static final Logger log = LoggerFactory.getLogger(TrialBalanceService.class);

    @Value("${ledger.balance-tolerance:0.01}")
    private BigDecimal balanceTolerance = new BigDecimal("0.01");

    private final AccountRepository accountRepository;
    private final JournalLineRepository journalLineRepository;
    private final CompanyService companyService;
    private final Clock clock;

    public TrialBalanceService(AccountRepository accountRepository,
                               JournalLineRepository journalLineRepository,
                               CompanyService companyService,
                               Clock clock) {
        this.accountRepository = accountRepository;
        this.journalLineRepository = journalLineRepository;
        this.companyService = companyService;
        this.clock = clock;
    }

    /**
     * Generates a trial balance labelled with the fiscal period containing {@code asOfDate}.
     */
    public TrialBalance generateTrialBalance(Long companyId, LocalDate asOfDate, String actor) {
        if (asOfDate == null) {
            throw new ValidationException("Trial balance date is required");
        }
        Company company = companyService.getById(companyId);
        FiscalPeriod period = FiscalCalendar.periodFor(company, asOfDate);
        return generateTrialBalance(companyId, asOfDate, period.fiscalYear(), period.period(), actor);
    }

    public TrialBalance generateTrialBalance(Long companyId, LocalDate asOfDate,
                                             int fiscalYear, int fiscalPeriod, String actor) {
        if (asOfDate == null) {
            throw new ValidationException("Trial balance date is required");
        }
        companyService.getById(companyId);

        List<Account> accounts = accountRepository.findByCompanyIdOrderByCode(companyId);
        boolean fromJournal = asOfDate.isBefore(LocalDate.now(clock))
            || journalLineRepository.existsDatedAfter(
                companyId, BalanceService.BALANCE_EFFECT_STATUSES, asOfDate);
        Map<Long, AccountTotals> totals = fromJournal
            ? journalLineRepository
                .sumByAccountAsOf(companyId, BalanceService.BALANCE_EFFECT_STATUSES, asOfDate)
                .stream()
                .collect(Collectors.toMap(AccountTotals::accountId, Function.identity()))
            : Map.of();

        List<TrialBalanceLine> lines = new ArrayList<>();
        BigDecimal totalDebits = BigDecimal.ZERO;
        BigDecimal totalCredits = BigDecimal.ZERO;

        for (Account account : accounts) {
            if (!account.isPostable()) {
                continue;
            }
            BigDecimal balance;
            if (fromJournal) {
                AccountTotals accountTotals = totals.get(account.getId());
                balance = accountTotals == null
                    ? BigDecimal.ZERO
                    : account.getNormalBalance().orient(accountTotals.debit(), accountTotals.credit());
            } else {
                balance = account.getBalance().getBalance();
            }

            // Skip accounts with no balance
            if (balance.signum() == 0) {
                continue;
            }

            TrialBalanceLine line = toLine(account, balance);
            lines.add(line);
            totalDebits = totalDebits.add(line.debit());
            totalCredits = totalCredits.add(line.credit());
        }
        lines.sort(Comparator.comparing(TrialBalanceLine::accountCode));

        boolean balanced = totalDebits.subtract(totalCredits).abs().compareTo(balanceTolerance) < 0;
        if (!balanced) {
            log.warn("Trial balance for company {} as of {} is out of balance: debits={}, credits={}",
                companyId, asOfDate, totalDebits, totalCredits);
        }
        log.info("Generated trial balance for company {} as of {} ({} lines, {})",
            companyId, asOfDate, lines.size(), fromJournal ? "from journal" : "from snapshots");

        return new TrialBalance(companyId, asOfDate, fiscalYear, fiscalPeriod, lines,
            totalDebits, totalCredits, balanced, Instant.now(clock), actor);
    }

    /**
     * A balance on the account's normal side lands in that side's column. A negative balance is
     * abnormal and lands in the opposite column as a positive amount.
     */
    private TrialBalanceLine toLine(Account account, BigDecimal balance) {
        boolean debitSide = account.getType().isDebitNormal() == (balance.signum() > 0);
        BigDecimal amount = balance.abs();
        return new TrialBalanceLine(
            account.getId(),
            account.getCode(),
            account.getName(),
            account.getType(),
            debitSide ? amount : BigDecimal.ZERO,
            debitSide ? BigDecimal.ZERO : amount,
            balance,
            balance.signum() < 0
        );
    }

    // Record classes for report data
    public record TrialBalance(
        Long companyId,
        LocalDate asOfDate,
        int fiscalYear,
        int fiscalPeriod,
        List<TrialBalanceLine> lines,
        BigDecimal totalDebits,
        BigDecimal totalCredits,
        boolean balanced,
        Instant generatedAt,
        String generatedBy
    ) {
        public boolean isBalanced() {
            return balanced;
        }
    }

    public record TrialBalanceLine(
        Long accountId,
        String accountCode,
        String accountName,
        AccountType accountType,
        BigDecimal debit,
        BigDecimal credit,
        BigDecimal balance,
        boolean abnormal
    ) {}
}
