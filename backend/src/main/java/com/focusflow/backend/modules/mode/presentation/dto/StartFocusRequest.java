package com.focusflow.backend.modules.mode.presentation.dto;

public record StartFocusRequest(
        String userId,
        Integer durationMinutes
) {
}
