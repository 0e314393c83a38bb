package com.focusflow.backend.modules.mode.presentation.dto;

public record SetModeRequest(
        String userId,
        String mode
) {
}
