package com.focusflow.backend.modules.meeting.presentation.dto;

import java.time.OffsetDateTime;

public record MeetingNoteResponse(
        Long id,
        String userId,
        String text,
        boolean summarized,
        OffsetDateTime createdAt
) {
}
