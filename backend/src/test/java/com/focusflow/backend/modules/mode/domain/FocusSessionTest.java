package com.focusflow.backend.modules.mode.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.OffsetDateTime;

import org.junit.jupiter.api.Test;

class FocusSessionTest {

    private static final OffsetDateTime T0 = OffsetDateTime.parse("2025-03-10T09:00:00Z");

    @Test
    void openComputesExpectedEndFromPlannedDuration() {
        FocusSession session = FocusSession.open("u1", "focus", 25, T0);

        assertThat(session.isOpen()).isTrue();
        assertThat(session.getExpectedEnd()).isEqualTo(T0.plusMinutes(25));
        assertThat(session.getInterruptionCount()).isZero();
    }

    @Test
    void openWithoutPlannedDurationHasNoExpectedEnd() {
        FocusSession session = FocusSession.open("u1", "focus", null, T0);

        assertThat(session.getExpectedEnd()).isNull();
    }

    @Test
    void closeOnlySucceedsOnce() {
        FocusSession session = FocusSession.open("u1", "focus", 25, T0);

        assertThat(session.close(T0.plusMinutes(10))).isTrue();
        assertThat(session.close(T0.plusMinutes(20))).isFalse();
        assertThat(session.getEndedAt()).isEqualTo(T0.plusMinutes(10));
    }

    @Test
    void actualDurationIsRoundedAndClampedToOneMinute() {
        FocusSession shortSession = FocusSession.open("u1", "focus", 25, T0);
        shortSession.close(T0.plusSeconds(5));
        FocusSession longer = FocusSession.open("u1", "focus", 25, T0);
        longer.close(T0.plusMinutes(24).plusSeconds(40));

        assertThat(shortSession.actualDurationMinutes(T0)).isEqualTo(1);
        assertThat(longer.actualDurationMinutes(T0)).isEqualTo(25);
    }

    @Test
    void focusStateRequiresSession() {
        UserModeState state = new UserModeState("u1", T0);

        assertThatThrownBy(() -> state.enterFocus(null, T0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> state.switchTo(ActivityMode.FOCUS, T0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void leavingFocusClearsActiveSession() {
        UserModeState state = new UserModeState("u1", T0);
        state.enterFocus(7L, T0);

        state.switchTo(ActivityMode.BREAK, T0.plusMinutes(1));

        assertThat(state.getCurrentMode()).isEqualTo(ActivityMode.BREAK);
        assertThat(state.hasActiveSession()).isFalse();
    }
}
