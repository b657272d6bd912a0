package com.example.ledger.repository;

import java.util.Optional;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.example.ledger.domain.JournalSequence;

@Repository
public interface JournalSequenceRepository extends JpaRepository<JournalSequence, Long> {

  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query(
      "SELECT s FROM JournalSequence s WHERE s.companyId = :companyId "
          + "AND s.fiscalYear = :fiscalYear")
  Optional<JournalSequence> findForUpdate(
      @Param("companyId") Long companyId, @Param("fiscalYear") int fiscalYear);
}
