package com.focusflow.backend.modules.mode.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

public record CreateFocusModeRequest(
        @NotBlank @Size(max = 120) String name,
        @NotNull @Positive Integer durationMinutes,
        String description,
        @Size(max = 64) String slug
) {
}
