package com.example.ledger.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.example.ledger.domain.JournalSequence;
import com.example.ledger.repository.JournalSequenceRepository;

/**
 * Assigns sequential journal numbers per company and fiscal year, formatted {@code
 * JE-<fiscalYear>-<6-digit sequence>}.
 *
 * <ul>
 *   <li>The counter row is lazily created on first use in a fiscal year
 *   <li>The row is held under a pessimistic write lock until the creating transaction ends, so
 *       concurrent creators serialize and never share a number
 *   <li>A rolled-back creation rolls the counter back with it
 * </ul>
 */
@Service
public class JournalNumberService {

  private static final Logger log = LoggerFactory.getLogger(JournalNumberService.class);

  private final JournalSequenceRepository sequenceRepository;
  private final JournalSequenceCreator sequenceCreator;

  public JournalNumberService(
      JournalSequenceRepository sequenceRepository, JournalSequenceCreator sequenceCreator) {
    this.sequenceRepository = sequenceRepository;
    this.sequenceCreator = sequenceCreator;
  }

  @Transactional
  public String assignNumber(Long companyId, int fiscalYear) {
    JournalSequence sequence =
        sequenceRepository
            .findForUpdate(companyId, fiscalYear)
            .orElseGet(() -> createCounter(companyId, fiscalYear));
    long number = sequence.take();
    sequenceRepository.save(sequence);
    return JournalSequence.format(fiscalYear, number);
  }

  private JournalSequence createCounter(Long companyId, int fiscalYear) {
    try {
      sequenceCreator.create(companyId, fiscalYear);
      log.info("Started journal sequence for company {} fiscal year {}", companyId, fiscalYear);
    } catch (DataIntegrityViolationException e) {
      log.debug(
          "Journal sequence for company {} fiscal year {} was created concurrently",
          companyId,
          fiscalYear);
    }
    return sequenceRepository
        .findForUpdate(companyId, fiscalYear)
        .orElseThrow(
            () ->
                new IllegalStateException(
                    "Journal sequence missing for company " + companyId + " year " + fiscalYear));
  }
}
