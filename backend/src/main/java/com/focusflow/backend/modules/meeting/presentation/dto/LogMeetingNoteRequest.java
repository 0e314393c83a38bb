package com.focusflow.backend.modules.meeting.presentation.dto;

public record LogMeetingNoteRequest(
        String userId,
        String text
) {
}
