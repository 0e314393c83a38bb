package com.focusflow.backend.modules.mode.domain;

import java.time.OffsetDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.Immutable;

/**
 * Append-only audit row for every mode change (and every blocked message while in focus).
 */
@Entity
@Immutable
@Table(name = "mode_transition")
public class ModeTransition {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "user_id", nullable = false, updatable = false, length = 64)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "previous_mode", updatable = false, length = 16)
    private ActivityMode previousMode;

    @Enumerated(EnumType.STRING)
    @Column(name = "next_mode", nullable = false, updatable = false, length = 16)
    private ActivityMode nextMode;

    @Column(name = "reason", nullable = false, updatable = false, length = 64)
    private String reason;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    protected ModeTransition() {
    }

    public ModeTransition(String userId, ActivityMode previousMode, ActivityMode nextMode, TransitionReason reason, OffsetDateTime createdAt) {
        this.userId = userId;
        this.previousMode = previousMode;
        this.nextMode = nextMode;
        this.reason = reason.code();
        this.createdAt = createdAt;
    }

    public Long getId() {
        return id;
    }

    public String getUserId() {
        return userId;
    }

    public ActivityMode getPreviousMode() {
        return previousMode;
    }

    public ActivityMode getNextMode() {
        return nextMode;
    }

    public String getReason() {
        return reason;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }
}
