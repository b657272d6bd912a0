package com.example.ledger.domain;

import java.time.Instant;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/** Append-only record of a change made to ledger data. */
@Entity
@Table(
    name = "audit_event",
    indexes = {
      @Index(name = "idx_audit_company_time", columnList = "company_id, occurred_at"),
      @Index(name = "idx_audit_entity", columnList = "entity_type, entity_id")
    })
public class AuditEvent {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @NotNull
  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "company_id", nullable = false)
  private Company company;

  @Column(name = "actor", length = 100)
  private String actor;

  @NotBlank
  @Column(name = "event_type", nullable = false, length = 50)
  private String eventType;

  @NotBlank
  @Column(name = "entity_type", nullable = false, length = 50)
  private String entityType;

  @Column(name = "entity_id")
  private Long entityId;

  @Column(length = 500)
  private String summary;

  @Column(name = "details_json", columnDefinition = "TEXT")
  private String detailsJson;

  @Column(name = "occurred_at", nullable = false, updatable = false)
  private Instant occurredAt;

  @PrePersist
  protected void onCreate() {
    occurredAt = Instant.now();
  }

  public AuditEvent() {}

  public AuditEvent(
      Company company, String actor, String eventType, String entityType, Long entityId,
      String summary) {
    this.company = company;
    this.actor = actor;
    this.eventType = eventType;
    this.entityType = entityType;
    this.entityId = entityId;
    this.summary = summary;
  }

  public Long getId() {
    return id;
  }

  public Company getCompany() {
    return company;
  }

  public String getActor() {
    return actor;
  }

  public String getEventType() {
    return eventType;
  }

  public String getEntityType() {
    return entityType;
  }

  public Long getEntityId() {
    return entityId;
  }

  public String getSummary() {
    return summary;
  }

  public String getDetailsJson() {
    return detailsJson;
  }

  public void setDetailsJson(String detailsJson) {
    this.detailsJson = detailsJson;
  }

  public Instant getOccurredAt() {
    return occurredAt;
  }
}
