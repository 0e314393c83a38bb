package com.focusflow.backend.modules.admin.presentation.dto;

public record JobStatusResponse(
        String name,
        boolean running
) {
}
