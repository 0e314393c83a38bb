package com.focusflow.backend.modules.mode.application;

import java.time.OffsetDateTime;

import com.focusflow.backend.modules.mode.domain.ActivityMode;
import com.focusflow.backend.modules.mode.domain.FocusSession;
import com.focusflow.backend.modules.mode.domain.UserModeState;

public record ModeStateView(
        String userId,
        String currentMode,
        Long activeSessionId,
        SessionView activeSession,
        OffsetDateTime updatedAt
) {

    public static ModeStateView of(UserModeState state, FocusSession activeSession) {
        return new ModeStateView(
                state.getUserId(),
                state.getCurrentMode().code(),
                state.getActiveSessionId(),
                SessionView.of(activeSession),
                state.getUpdatedAt()
        );
    }

    /**
     * View of a user that has never been seen: idle, no session, no row.
     */
    public static ModeStateView idle(String userId) {
        return new ModeStateView(userId, ActivityMode.IDLE.code(), null, null, null);
    }
}
