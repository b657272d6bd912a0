package com.example.ledger.service;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.example.ledger.domain.AuditEvent;
import com.example.ledger.domain.Company;
import com.example.ledger.repository.AuditEventRepository;

@ExtendWith(MockitoExtension.class)
class AuditServiceTest {

  @Mock private AuditEventRepository auditEventRepository;

  private AuditService auditService;

  private Company company;

  @BeforeEach
  void setUp() {
    auditService = new AuditService(auditEventRepository);
    company = new Company("Test Company", "UGX", 7);
    lenient()
        .when(auditEventRepository.save(any(AuditEvent.class)))
        .thenAnswer(inv -> inv.getArgument(0));
  }

  @Test
  void logEvent_withDetails_storesThemAsJson() {
    Map<String, Object> changes = new LinkedHashMap<>();
    changes.put("name", Map.of("from", "Cash", "to", "Cash on Hand"));

    AuditEvent event =
        auditService.logEvent(
            company, "alice", "ACCOUNT_UPDATED", "Account", 5L, "Updated account", changes);

    assertEquals("ACCOUNT_UPDATED", event.getEventType());
    assertEquals("alice", event.getActor());
    assertEquals(5L, event.getEntityId());
    assertTrue(event.getDetailsJson().contains("\"to\":\"Cash on Hand\""));
  }

  @Test
  void logEvent_withoutDetails_leavesJsonEmpty() {
    AuditEvent event =
        auditService.logEvent(company, "alice", "JOURNAL_POSTED", "JournalEntry", 7L, "Posted");

    assertNull(event.getDetailsJson());
  }

  @Test
  void getHistory_delegatesToEntityQuery() {
    AuditEvent created =
        new AuditEvent(company, "alice", "JOURNAL_CREATED", "JournalEntry", 7L, "Created");
    when(auditEventRepository.findByEntity("JournalEntry", 7L)).thenReturn(List.of(created));

    assertEquals(List.of(created), auditService.getHistory("JournalEntry", 7L));
  }
}
