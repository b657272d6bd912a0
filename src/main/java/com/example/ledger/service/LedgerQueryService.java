package com.example.ledger.service;

import com.example.ledger.domain.Account;
import com.example.ledger.domain.FiscalPeriod;
import com.example.ledger.domain.JournalEntry;
import com.example.ledger.domain.JournalLine;
import com.example.ledger.domain.NormalBalance;
import com.example.ledger.exception.NotFoundException;
import com.example.ledger.exception.ValidationException;
import com.example.ledger.repository.AccountRepository;
import com.example.ledger.repository.AccountTotals;
import com.example.ledger.repository.JournalLineRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Read side of the journal: per-account ledgers with opening, running and closing balances.
 * Only lines of entries that have affected balances (POSTED or REVERSED) are included.
 */
@Service
@Transactional(readOnly = true)
public class LedgerQueryService {

    private final AccountRepository accountRepository;
    private final JournalLineRepository journalLineRepository;
    private final CompanyService companyService;

    public LedgerQueryService(AccountRepository accountRepository,
                              JournalLineRepository journalLineRepository,
                              CompanyService companyService) {
        this.accountRepository = accountRepository;
        this.journalLineRepository = journalLineRepository;
        this.companyService = companyService;
    }

    /**
     * Builds the ledger of one account between two dates, inclusive.
     * Balances are signed by the account's normal side.
     */
    public AccountLedger getAccountLedger(Long companyId, Long accountId, LocalDate from, LocalDate to) {
        if (from == null || to == null) {
            throw new ValidationException("Ledger date range is required");
        }
        if (to.isBefore(from)) {
            throw new ValidationException("Ledger end date " + to + " is before start date " + from);
        }
        Account account = accountRepository.findByCompanyIdAndId(companyId, accountId)
            .orElseThrow(() -> new NotFoundException("Account not found: " + accountId));
        NormalBalance side = account.getNormalBalance();

        AccountTotals before = journalLineRepository
            .sumByAccountBefore(companyId, accountId, BalanceService.BALANCE_EFFECT_STATUSES, from)
            .orElse(AccountTotals.empty(accountId));
        BigDecimal opening = side.orient(before.debit(), before.credit());

        List<LedgerLine> lines = new ArrayList<>();
        BigDecimal running = opening;
        BigDecimal totalDebits = BigDecimal.ZERO;
        BigDecimal totalCredits = BigDecimal.ZERO;

        for (JournalLine line : getPostedLines(companyId, accountId, from, to)) {
            running = running.add(side.orient(line.getDebit(), line.getCredit()));
            totalDebits = totalDebits.add(line.getDebit());
            totalCredits = totalCredits.add(line.getCredit());

            JournalEntry entry = line.getJournalEntry();
            lines.add(new LedgerLine(
                entry.getId(),
                entry.getJournalNumber(),
                entry.getDate(),
                line.getDescription() != null ? line.getDescription() : entry.getDescription(),
                line.getDebit(),
                line.getCredit(),
                running
            ));
        }

        return new AccountLedger(account.getId(), account.getCode(), account.getName(), from, to,
            opening, lines, totalDebits, totalCredits, running);
    }

    /**
     * Builds the ledger of one account for a whole fiscal year.
     */
    public AccountLedger getAccountLedger(Long companyId, Long accountId, int fiscalYear) {
        int startMonth = companyService.getById(companyId).getFiscalYearStartMonth();
        LocalDate from = new FiscalPeriod(fiscalYear, 1, startMonth).startDate();
        LocalDate to = new FiscalPeriod(fiscalYear, 12, startMonth).endDate();
        return getAccountLedger(companyId, accountId, from, to);
    }

    /**
     * Lines posted to an account between two dates, inclusive, in date and journal number order.
     */
    public List<JournalLine> getPostedLines(Long companyId, Long accountId, LocalDate from, LocalDate to) {
        return journalLineRepository.findByAccountAndDateRange(
            companyId, accountId, BalanceService.BALANCE_EFFECT_STATUSES, from, to);
    }

    // Record classes for ledger data
    public record AccountLedger(
        Long accountId,
        String accountCode,
        String accountName,
        LocalDate from,
        LocalDate to,
        BigDecimal openingBalance,
        List<LedgerLine> lines,
        BigDecimal totalDebits,
        BigDecimal totalCredits,
        BigDecimal closingBalance
    ) {}

    public record LedgerLine(
        Long journalEntryId,
        String journalNumber,
        LocalDate date,
        String description,
        BigDecimal debit,
        BigDecimal credit,
        BigDecimal runningBalance
    ) {}
}
