package com.example.ledger.service;

import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.example.ledger.domain.AuditEvent;
import com.example.ledger.domain.Company;
import com.example.ledger.repository.AuditEventRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Records audit events for changes to ledger data. Events are written in the caller's
 * transaction, so a rolled-back operation leaves no audit trail behind.
 */
@Service
@Transactional
public class AuditService {

  private final AuditEventRepository auditEventRepository;
  private final ObjectMapper objectMapper;

  public AuditService(AuditEventRepository auditEventRepository) {
    this.auditEventRepository = auditEventRepository;
    this.objectMapper = new ObjectMapper();
  }

  public AuditEvent logEvent(
      Company company,
      String actor,
      String eventType,
      String entityType,
      Long entityId,
      String summary) {
    return logEvent(company, actor, eventType, entityType, entityId, summary, null);
  }

  /**
   * Records an event with structured details, serialized to JSON.
   *
   * @param details field-level changes or other context; may be null
   */
  public AuditEvent logEvent(
      Company company,
      String actor,
      String eventType,
      String entityType,
      Long entityId,
      String summary,
      Map<String, Object> details) {
    AuditEvent event = new AuditEvent(company, actor, eventType, entityType, entityId, summary);
    if (details != null && !details.isEmpty()) {
      try {
        event.setDetailsJson(objectMapper.writeValueAsString(details));
      } catch (JsonProcessingException e) {
        throw new IllegalStateException("Could not serialize audit details for " + eventType, e);
      }
    }
    return auditEventRepository.save(event);
  }

  /** Events recorded against one entity, oldest first. */
  @Transactional(readOnly = true)
  public List<AuditEvent> getHistory(String entityType, Long entityId) {
    return auditEventRepository.findByEntity(entityType, entityId);
  }
}
