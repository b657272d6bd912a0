package com.example.ledger.service;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import com.example.ledger.domain.JournalSequence;
import com.example.ledger.repository.JournalSequenceRepository;

/**
 * Inserts the counter row for a (company, fiscal year) in its own transaction, so the row is
 * visible to every concurrent creator once committed. A unique-constraint violation means another
 * transaction inserted it first.
 */
@Component
public class JournalSequenceCreator {

  private final JournalSequenceRepository sequenceRepository;

  public JournalSequenceCreator(JournalSequenceRepository sequenceRepository) {
    this.sequenceRepository = sequenceRepository;
  }

  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public void create(Long companyId, int fiscalYear) {
    sequenceRepository.saveAndFlush(new JournalSequence(companyId, fiscalYear));
  }
}
