package com.focusflow.backend.modules.mode.presentation.dto;

import com.focusflow.backend.modules.mode.domain.FocusModeDefinition;

public record FocusModeResponse(
        Long id,
        String name,
        String slug,
        String description,
        int durationMinutes
) {

    public static FocusModeResponse from(FocusModeDefinition definition) {
        return new FocusModeResponse(
                definition.getId(),
                definition.getName(),
                definition.getSlug(),
                definition.getDescription(),
                definition.getDurationMinutes()
        );
    }
}
