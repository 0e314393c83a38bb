package com.focusflow.backend.modules.notification.application;

import java.util.Map;

/**
 * Text to deliver to one user. {@code dedupeKey}, when set, makes delivery idempotent per user.
 */
public record NotificationMessage(
        String userId,
        String kindCode,
        String title,
        String body,
        String dedupeKey,
        Map<String, Object> metadata
) {

    public static final String KIND_GENERAL = "GENERAL";

    public static NotificationMessage plain(String userId, String text) {
        return new NotificationMessage(userId, KIND_GENERAL, "FocusFlow", text, null, Map.of());
    }
}
