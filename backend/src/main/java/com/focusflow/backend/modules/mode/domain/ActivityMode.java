package com.focusflow.backend.modules.mode.domain;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * The mutually exclusive activity a user is in. Only {@link #FOCUS} owns an open session.
 */
public enum ActivityMode {
    IDLE,
    FOCUS,
    BREAK,
    MEETING,
    SLEEP;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean ownsSession() {
        return this == FOCUS;
    }

    public static Optional<ActivityMode> fromCode(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(mode -> mode.name().equals(normalized))
                .findFirst();
    }

    public static String allowedCodes() {
        return Arrays.stream(values())
                .map(ActivityMode::code)
                .collect(Collectors.joining(", "));
    }
}
