package com.example.ledger.repository;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.example.ledger.domain.AuditEvent;

@Repository
public interface AuditEventRepository extends JpaRepository<AuditEvent, Long> {

  @Query(
      "SELECT e FROM AuditEvent e WHERE e.entityType = :entityType AND e.entityId = :entityId "
          + "ORDER BY e.occurredAt, e.id")
  List<AuditEvent> findByEntity(
      @Param("entityType") String entityType, @Param("entityId") Long entityId);
}
