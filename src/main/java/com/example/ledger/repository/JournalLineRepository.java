package com.example.ledger.repository;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.example.ledger.domain.JournalLine;
import com.example.ledger.domain.JournalStatus;

/**
 * Read access to journal lines. Callers pass the set of entry statuses whose lines have affected
 * balances (see {@link JournalStatus#hasBalanceEffect()}).
 */
@Repository
public interface JournalLineRepository extends JpaRepository<JournalLine, Long> {

  @Query(
      "SELECT l FROM JournalLine l JOIN FETCH l.journalEntry e "
          + "WHERE e.company.id = :companyId AND l.account.id = :accountId "
          + "AND e.status IN :statuses AND e.date BETWEEN :startDate AND :endDate "
          + "ORDER BY e.date, e.journalNumber, l.lineNumber")
  List<JournalLine> findByAccountAndDateRange(
      @Param("companyId") Long companyId,
      @Param("accountId") Long accountId,
      @Param("statuses") Collection<JournalStatus> statuses,
      @Param("startDate") LocalDate startDate,
      @Param("endDate") LocalDate endDate);

  @Query(
      "SELECT new com.example.ledger.repository.AccountTotals(l.account.id, SUM(l.debit), "
          + "SUM(l.credit), SUM(l.functionalDebit), SUM(l.functionalCredit)) "
          + "FROM JournalLine l JOIN l.journalEntry e "
          + "WHERE e.company.id = :companyId AND l.account.id = :accountId "
          + "AND e.status IN :statuses AND e.date < :beforeDate "
          + "GROUP BY l.account.id")
  Optional<AccountTotals> sumByAccountBefore(
      @Param("companyId") Long companyId,
      @Param("accountId") Long accountId,
      @Param("statuses") Collection<JournalStatus> statuses,
      @Param("beforeDate") LocalDate beforeDate);

  @Query(
      "SELECT new com.example.ledger.repository.AccountTotals(l.account.id, SUM(l.debit), "
          + "SUM(l.credit), SUM(l.functionalDebit), SUM(l.functionalCredit)) "
          + "FROM JournalLine l JOIN l.journalEntry e "
          + "WHERE e.company.id = :companyId AND e.status IN :statuses "
          + "AND e.date <= :asOfDate "
          + "GROUP BY l.account.id")
  List<AccountTotals> sumByAccountAsOf(
      @Param("companyId") Long companyId,
      @Param("statuses") Collection<JournalStatus> statuses,
      @Param("asOfDate") LocalDate asOfDate);

  @Query(
      "SELECT CASE WHEN COUNT(l) > 0 THEN true ELSE false END "
          + "FROM JournalLine l JOIN l.journalEntry e "
          + "WHERE e.company.id = :companyId AND e.status IN :statuses "
          + "AND e.date > :afterDate")
  boolean existsDatedAfter(
      @Param("companyId") Long companyId,
      @Param("statuses") Collection<JournalStatus> statuses,
      @Param("afterDate") LocalDate afterDate);

  @Query(
      "SELECT new com.example.ledger.repository.AccountTotals(l.account.id, SUM(l.debit), "
          + "SUM(l.credit), SUM(l.functionalDebit), SUM(l.functionalCredit)) "
          + "FROM JournalLine l JOIN l.journalEntry e "
          + "WHERE e.company.id = :companyId AND e.status IN :statuses "
          + "GROUP BY l.account.id")
  List<AccountTotals> sumByAccount(
      @Param("companyId") Long companyId,
      @Param("statuses") Collection<JournalStatus> statuses);
}
