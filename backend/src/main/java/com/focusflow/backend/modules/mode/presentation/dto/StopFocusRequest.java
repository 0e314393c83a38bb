package com.focusflow.backend.modules.mode.presentation.dto;

public record StopFocusRequest(String userId) {
}
