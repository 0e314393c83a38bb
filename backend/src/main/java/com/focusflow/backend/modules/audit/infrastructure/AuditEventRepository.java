package com.focusflow.backend.modules.audit.infrastructure;

import java.util.List;

import com.focusflow.backend.modules.audit.domain.AuditEvent;

import org.springframework.data.jpa.repository.JpaRepository;

public interface AuditEventRepository extends JpaRepository<AuditEvent, Long> {

    List<AuditEvent> findByEventNameOrderByCreatedAtAsc(String eventName);
}
