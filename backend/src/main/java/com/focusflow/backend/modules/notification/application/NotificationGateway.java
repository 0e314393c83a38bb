package com.focusflow.backend.modules.notification.application;

/**
 * Outbound user notifications. Implementations report failure through the return value and never throw,
 * so a notification problem cannot undo a committed state change.
 */
public interface NotificationGateway {

    /**
     * @return {@code true} when the message was delivered, or had already been delivered under the same dedupe key
     */
    boolean notify(NotificationMessage message);

    /**
     * Whether a notification with this dedupe key already reached the user. Lookup failures report {@code false}.
     */
    boolean isDelivered(String userId, String dedupeKey);

    default boolean notify(String userId, String text) {
        return notify(NotificationMessage.plain(userId, text));
    }
}
