package com.focusflow.backend.modules.mode.application;

import java.time.OffsetDateTime;

import com.focusflow.backend.modules.mode.domain.FocusSession;

public record SessionView(
        Long id,
        String userId,
        String mode,
        OffsetDateTime startedAt,
        OffsetDateTime endedAt,
        Integer plannedDurationMinutes,
        OffsetDateTime expectedEnd,
        int interruptionCount
) {

    public static SessionView of(FocusSession session) {
        if (session == null) {
            return null;
        }
        return new SessionView(
                session.getId(),
                session.getUserId(),
                session.getModeLabel(),
                session.getStartedAt(),
                session.getEndedAt(),
                session.getPlannedDurationMinutes(),
                session.getExpectedEnd(),
                session.getInterruptionCount()
        );
    }
}
