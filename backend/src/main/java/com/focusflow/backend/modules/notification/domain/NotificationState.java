package com.focusflow.backend.modules.notification.domain;

public enum NotificationState {
    UNREAD,
    READ,
    EXPIRED
}
