package com.example.ledger.service;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import com.example.ledger.domain.JournalSequence;
import com.example.ledger.repository.JournalSequenceRepository;

@ExtendWith(MockitoExtension.class)
class JournalNumberServiceTest {

  @Mock private JournalSequenceRepository sequenceRepository;

  @Mock private JournalSequenceCreator sequenceCreator;

  private JournalNumberService journalNumberService;

  @BeforeEach
  void setUp() {
    journalNumberService = new JournalNumberService(sequenceRepository, sequenceCreator);
  }

  @Test
  void assignNumber_existingCounter_returnsConsecutiveNumbers() {
    JournalSequence sequence = new JournalSequence(1L, 2025);
    when(sequenceRepository.findForUpdate(1L, 2025)).thenReturn(Optional.of(sequence));

    assertEquals("JE-2025-000001", journalNumberService.assignNumber(1L, 2025));
    assertEquals("JE-2025-000002", journalNumberService.assignNumber(1L, 2025));
    assertEquals(3L, sequence.getNextNumber());
    verify(sequenceRepository, times(2)).save(sequence);
    verifyNoInteractions(sequenceCreator);
  }

  @Test
  void assignNumber_firstInFiscalYear_createsCounter() {
    JournalSequence sequence = new JournalSequence(1L, 2026);
    when(sequenceRepository.findForUpdate(1L, 2026))
        .thenReturn(Optional.empty(), Optional.of(sequence));

    String number = journalNumberService.assignNumber(1L, 2026);

    assertEquals("JE-2026-000001", number);
    verify(sequenceCreator).create(1L, 2026);
  }

  @Test
  void assignNumber_counterCreatedConcurrently_usesTheExistingRow() {
    JournalSequence sequence = new JournalSequence(1L, 2026);
    sequence.take();
    when(sequenceRepository.findForUpdate(1L, 2026))
        .thenReturn(Optional.empty(), Optional.of(sequence));
    doThrow(new DataIntegrityViolationException("duplicate key"))
        .when(sequenceCreator)
        .create(1L, 2026);

    String number = journalNumberService.assignNumber(1L, 2026);

    assertEquals("JE-2026-000002", number);
  }

  @Test
  void assignNumber_counterStillMissing_throwsException() {
    when(sequenceRepository.findForUpdate(1L, 2026)).thenReturn(Optional.empty());

    assertThrows(IllegalStateException.class, () -> journalNumberService.assignNumber(1L, 2026));
  }

  @Test
  void format_padsSequenceToSixDigits() {
    assertEquals("JE-2025-000042", JournalSequence.format(2025, 42));
    assertEquals("JE-2025-1234567", JournalSequence.format(2025, 1234567));
  }
}
