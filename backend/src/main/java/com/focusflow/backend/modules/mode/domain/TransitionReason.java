package com.focusflow.backend.modules.mode.domain;

import java.util.Locale;

public enum TransitionReason {
    MANUAL_START,
    MANUAL_STOP,
    MANUAL_SET,
    MESSAGE_BLOCKED,
    SESSION_EXPIRED,
    DAILY_RESET;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
