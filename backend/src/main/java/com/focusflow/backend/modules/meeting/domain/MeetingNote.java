package com.focusflow.backend.modules.meeting.domain;

import java.time.OffsetDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * Free-text note captured during a meeting. {@code userId} may be absent for notes whose author
 * could not be resolved; those are never summarized.
 */
@Entity
@Table(name = "meeting_note")
public class MeetingNote {

    public static final int MAX_USER_ID_LENGTH = 64;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "user_id", updatable = false, length = MAX_USER_ID_LENGTH)
    private String userId;

    @Column(name = "body", nullable = false, updatable = false)
    private String body;

    @Column(name = "summarized", nullable = false)
    private boolean summarized;

    @Column(name = "summarized_at")
    private OffsetDateTime summarizedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    protected MeetingNote() {
    }

    public MeetingNote(String userId, String body, OffsetDateTime createdAt) {
        this.userId = userId;
        this.body = body;
        this.createdAt = createdAt;
    }

    public Long getId() {
        return id;
    }

    public String getUserId() {
        return userId;
    }

    public String getBody() {
        return body;
    }

    public boolean isSummarized() {
        return summarized;
    }

    public OffsetDateTime getSummarizedAt() {
        return summarizedAt;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }
}
