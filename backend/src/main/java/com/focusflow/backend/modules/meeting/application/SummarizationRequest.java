package com.focusflow.backend.modules.meeting.application;

public record SummarizationRequest(
        String userId,
        String transcript,
        int noteCount,
        long windowMinutes
) {
}
