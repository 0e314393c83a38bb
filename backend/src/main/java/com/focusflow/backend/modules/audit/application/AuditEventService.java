package com.focusflow.backend.modules.audit.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.focusflow.backend.modules.audit.domain.AuditEvent;
import com.focusflow.backend.modules.audit.infrastructure.AuditEventRepository;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Append-only event log. Joins the caller's transaction when there is one, so an event recorded
 * inside a mode change commits or rolls back with it.
 */
@Service
public class AuditEventService {

    public static final String EVENT_MEETING_SUMMARY = "meeting_summary_generated";
    public static final String EVENT_NOTE_LOGGED = "focus_note_logged";

    private final AuditEventRepository auditEventRepository;
    private final Clock clock;

    public AuditEventService(AuditEventRepository auditEventRepository, Clock clock) {
        this.auditEventRepository = auditEventRepository;
        this.clock = clock;
    }

    @Transactional
    public AuditEvent record(String eventName, Map<String, Object> metadata) {
        Objects.requireNonNull(eventName, "eventName is required");
        Map<String, Object> copy = metadata == null ? Map.of() : new LinkedHashMap<>(metadata);
        return auditEventRepository.save(new AuditEvent(eventName, copy, OffsetDateTime.now(clock)));
    }

    @Transactional(readOnly = true)
    public List<AuditEvent> findByEventName(String eventName) {
        return auditEventRepository.findByEventNameOrderByCreatedAtAsc(eventName);
    }
}
