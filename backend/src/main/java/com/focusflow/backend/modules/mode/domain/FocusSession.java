package com.focusflow.backend.modules.mode.domain;

import java.time.OffsetDateTime;

import com.focusflow.backend.global.common.time.TimeWindows;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

@Entity
@Table(name = "focus_session")
public class FocusSession {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "user_id", nullable = false, updatable = false, length = 64)
    private String userId;

    @Column(name = "mode_label", nullable = false, length = 64)
    private String modeLabel;

    @Column(name = "started_at", nullable = false, updatable = false)
    private OffsetDateTime startedAt;

    @Column(name = "ended_at")
    private OffsetDateTime endedAt;

    @Column(name = "planned_duration_minutes")
    private Integer plannedDurationMinutes;

    @Column(name = "expected_end")
    private OffsetDateTime expectedEnd;

    @Column(name = "interruption_count", nullable = false)
    private int interruptionCount;

    protected FocusSession() {
    }

    public static FocusSession open(String userId, String modeLabel, Integer plannedDurationMinutes, OffsetDateTime now) {
        FocusSession session = new FocusSession();
        session.userId = userId;
        session.modeLabel = modeLabel;
        session.startedAt = now;
        session.plannedDurationMinutes = plannedDurationMinutes;
        session.expectedEnd = TimeWindows.plusMinutes(now, plannedDurationMinutes);
        return session;
    }

    /**
     * Closes the session once. Returns {@code false} when it was already closed, leaving {@code endedAt} untouched.
     */
    public boolean close(OffsetDateTime now) {
        if (endedAt != null) {
            return false;
        }
        this.endedAt = now;
        return true;
    }

    public void recordInterruption() {
        interruptionCount++;
    }

    public boolean isOpen() {
        return endedAt == null;
    }

    public long actualDurationMinutes(OffsetDateTime now) {
        OffsetDateTime end = endedAt != null ? endedAt : now;
        return TimeWindows.minutesBetween(startedAt, end, 1);
    }

    public Long getId() {
        return id;
    }

    public String getUserId() {
        return userId;
    }

    public String getModeLabel() {
        return modeLabel;
    }

    public OffsetDateTime getStartedAt() {
        return startedAt;
    }

    public OffsetDateTime getEndedAt() {
        return endedAt;
    }

    public Integer getPlannedDurationMinutes() {
        return plannedDurationMinutes;
    }

    public OffsetDateTime getExpectedEnd() {
        return expectedEnd;
    }

    public int getInterruptionCount() {
        return interruptionCount;
    }
}
