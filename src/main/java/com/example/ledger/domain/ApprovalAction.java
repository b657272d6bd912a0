package com.example.ledger.domain;

import java.time.Instant;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;

/** One entry in a journal's approval history. Appended, never edited. */
@Embeddable
public class ApprovalAction {

  public enum Action {
    APPROVED,
    REJECTED
  }

  @Enumerated(EnumType.STRING)
  @Column(name = "action", nullable = false, length = 10)
  private Action action;

  @Column(name = "user_id", nullable = false, length = 100)
  private String userId;

  @Column(name = "acted_at", nullable = false)
  private Instant timestamp;

  @Column(name = "comments", length = 500)
  private String comments;

  public ApprovalAction() {}

  public ApprovalAction(Action action, String userId, String comments) {
    this.action = action;
    this.userId = userId;
    this.comments = comments;
    this.timestamp = Instant.now();
  }

  public Action getAction() {
    return action;
  }

  public String getUserId() {
    return userId;
  }

  public Instant getTimestamp() {
    return timestamp;
  }

  public String getComments() {
    return comments;
  }
}
