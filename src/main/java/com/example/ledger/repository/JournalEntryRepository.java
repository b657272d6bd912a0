package com.example.ledger.repository;

import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.example.ledger.domain.JournalEntry;

@Repository
public interface JournalEntryRepository extends JpaRepository<JournalEntry, Long> {

  @Query("SELECT j FROM JournalEntry j WHERE j.company.id = :companyId AND j.id = :id")
  Optional<JournalEntry> findByCompanyIdAndId(
      @Param("companyId") Long companyId, @Param("id") Long id);

  @Query(
      "SELECT j FROM JournalEntry j WHERE j.company.id = :companyId "
          + "AND j.journalNumber = :journalNumber")
  Optional<JournalEntry> findByCompanyIdAndJournalNumber(
      @Param("companyId") Long companyId, @Param("journalNumber") String journalNumber);

  @Query(
      "SELECT j FROM JournalEntry j WHERE j.company.id = :companyId "
          + "ORDER BY j.date DESC, j.journalNumber DESC")
  List<JournalEntry> findByCompanyId(@Param("companyId") Long companyId);

  @Query(
      "SELECT j FROM JournalEntry j WHERE j.company.id = :companyId AND j.fiscalYear = :fiscalYear "
          + "ORDER BY j.date DESC, j.journalNumber DESC")
  List<JournalEntry> findByCompanyIdAndFiscalYear(
      @Param("companyId") Long companyId, @Param("fiscalYear") int fiscalYear);
}
