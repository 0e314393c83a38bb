package com.focusflow.backend.modules.notification.domain;

public enum NotificationDispatchStatus {
    SUCCESS,
    FAILED
}
