package com.focusflow.backend.modules.notification.presentation.dto;

public record MarkAllReadResponse(int updated) {
}
