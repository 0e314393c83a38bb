package com.focusflow.backend.modules.mode.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.focusflow.backend.modules.mode.domain.TransitionReason;

import org.junit.jupiter.api.Test;

class FinalizeOptionsTest {

    @Test
    void notifyingAndSilentCarryTheReason() {
        FinalizeOptions notifying = FinalizeOptions.notifying(TransitionReason.SESSION_EXPIRED);
        FinalizeOptions silent = FinalizeOptions.silent(TransitionReason.DAILY_RESET);

        assertThat(notifying.notifyUser()).isTrue();
        assertThat(notifying.reason()).isEqualTo(TransitionReason.SESSION_EXPIRED);
        assertThat(silent.notifyUser()).isFalse();
        assertThat(silent.reason()).isEqualTo(TransitionReason.DAILY_RESET);
    }

    @Test
    void reasonIsRequired() {
        assertThatThrownBy(() -> new FinalizeOptions(null, true))
                .isInstanceOf(NullPointerException.class);
    }
}
