package com.focusflow.backend.modules.mode.domain;

import java.time.OffsetDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * The single live mode row of a user. {@code activeSessionId} is set exactly when the mode is focus;
 * the mutators below are the only way to change either field.
 */
@Entity
@Table(name = "user_mode_state")
public class UserModeState {

    public static final int MAX_USER_ID_LENGTH = 64;

    @Id
    @Column(name = "user_id", nullable = false, updatable = false, length = MAX_USER_ID_LENGTH)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "current_mode", nullable = false, length = 16)
    private ActivityMode currentMode = ActivityMode.IDLE;

    @Column(name = "active_session_id")
    private Long activeSessionId;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;

    protected UserModeState() {
    }

    public UserModeState(String userId, OffsetDateTime now) {
        this.userId = userId;
        this.currentMode = ActivityMode.IDLE;
        this.updatedAt = now;
    }

    public void enterFocus(Long sessionId, OffsetDateTime now) {
        if (sessionId == null) {
            throw new IllegalArgumentException("focus requires an owning session");
        }
        this.currentMode = ActivityMode.FOCUS;
        this.activeSessionId = sessionId;
        this.updatedAt = now;
    }

    public void switchTo(ActivityMode mode, OffsetDateTime now) {
        if (mode.ownsSession()) {
            throw new IllegalArgumentException("focus must be entered with a session");
        }
        this.currentMode = mode;
        this.activeSessionId = null;
        this.updatedAt = now;
    }

    public boolean isFocused() {
        return currentMode == ActivityMode.FOCUS;
    }

    public boolean hasActiveSession() {
        return activeSessionId != null;
    }

    public String getUserId() {
        return userId;
    }

    public ActivityMode getCurrentMode() {
        return currentMode;
    }

    public Long getActiveSessionId() {
        return activeSessionId;
    }

    public OffsetDateTime getUpdatedAt() {
        return updatedAt;
    }
}
